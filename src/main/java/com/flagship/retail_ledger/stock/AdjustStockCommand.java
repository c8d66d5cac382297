package com.flagship.retail_ledger.stock;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class AdjustStockCommand {
    String tenantId;
    String userId;
    UUID itemId;
    AdjustmentType type;
    BigDecimal quantity;
    String reason;
    String idempotencyKey;
}
