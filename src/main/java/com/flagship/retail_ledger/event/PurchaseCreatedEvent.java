package com.flagship.retail_ledger.event;

import com.flagship.retail_ledger.purchase.Purchase;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
public class PurchaseCreatedEvent implements LedgerEvent {
    UUID eventId;
    String tenantId;
    UUID purchaseId;
    UUID supplierId;
    BigDecimal totalAmount;
    BigDecimal paidAmount;
    String paymentType;
    List<Line> lines;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PurchaseCreated";
    public static final String AGGREGATE_TYPE = "Purchase";

    @Value
    public static class Line {
        UUID itemId;
        BigDecimal quantity;
        BigDecimal unitCost;
        BigDecimal subtotal;
    }

    @Override
    public UUID getAggregateId() {
        return purchaseId;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PurchaseCreatedEvent fromPurchase(Purchase purchase) {
        return new PurchaseCreatedEvent(
            UUID.randomUUID(),
            purchase.getTenantId(),
            purchase.getId(),
            purchase.getSupplierId(),
            purchase.getTotalAmount(),
            purchase.getPaidAmount(),
            purchase.getPaymentType().name(),
            purchase.getLines().stream()
                .map(line -> new Line(line.getItemId(), line.getQuantity(), line.getUnitCost(), line.getSubtotal()))
                .toList(),
            Instant.now()
        );
    }
}
