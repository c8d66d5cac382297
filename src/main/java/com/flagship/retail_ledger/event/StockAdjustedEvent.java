package com.flagship.retail_ledger.event;

import com.flagship.retail_ledger.stock.StockAdjustment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class StockAdjustedEvent implements LedgerEvent {
    UUID eventId;
    String tenantId;
    UUID adjustmentId;
    UUID itemId;
    String adjustmentType;
    BigDecimal previousQuantity;
    BigDecimal newQuantity;
    String reason;
    String userId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "StockAdjusted";
    public static final String AGGREGATE_TYPE = "Item";

    @Override
    public UUID getAggregateId() {
        return itemId;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static StockAdjustedEvent fromAdjustment(StockAdjustment adjustment) {
        return new StockAdjustedEvent(
            UUID.randomUUID(),
            adjustment.getTenantId(),
            adjustment.getId(),
            adjustment.getItemId(),
            adjustment.getType().name(),
            adjustment.getPreviousQuantity(),
            adjustment.getNewQuantity(),
            adjustment.getReason(),
            adjustment.getUserId(),
            Instant.now()
        );
    }
}
