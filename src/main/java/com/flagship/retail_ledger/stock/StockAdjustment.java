package com.flagship.retail_ledger.stock;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class StockAdjustment {
    UUID id;
    String tenantId;
    UUID itemId;
    AdjustmentType type;
    BigDecimal quantity;
    BigDecimal previousQuantity;
    BigDecimal newQuantity;
    String reason;
    String userId;
    Instant createdAt;
}
