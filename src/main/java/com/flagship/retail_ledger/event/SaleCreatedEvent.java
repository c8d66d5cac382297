package com.flagship.retail_ledger.event;

import com.flagship.retail_ledger.sale.Sale;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
public class SaleCreatedEvent implements LedgerEvent {
    UUID eventId;
    String tenantId;
    UUID saleId;
    UUID customerId;
    BigDecimal totalAmount;
    BigDecimal paidAmount;
    String paymentType;
    String paymentMethod;
    List<Line> lines;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SaleCreated";
    public static final String AGGREGATE_TYPE = "Sale";

    @Value
    public static class Line {
        UUID itemId;
        BigDecimal quantity;
        BigDecimal unitPrice;
        String priceTier;
        BigDecimal subtotal;
    }

    @Override
    public UUID getAggregateId() {
        return saleId;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static SaleCreatedEvent fromSale(Sale sale) {
        return new SaleCreatedEvent(
            UUID.randomUUID(),
            sale.getTenantId(),
            sale.getId(),
            sale.getCustomerId(),
            sale.getTotalAmount(),
            sale.getPaidAmount(),
            sale.getPaymentType().name(),
            sale.getPaymentMethod().name(),
            sale.getLines().stream()
                .map(line -> new Line(line.getItemId(), line.getQuantity(), line.getUnitPrice(),
                    line.getPriceTier().name(), line.getSubtotal()))
                .toList(),
            Instant.now()
        );
    }
}
