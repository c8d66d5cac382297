package com.flagship.retail_ledger.returns;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class CustomerReturn {
    UUID id;
    String tenantId;
    UUID saleId;
    UUID saleLineId;
    UUID itemId;
    BigDecimal quantity;
    ReturnType type;
    BigDecimal amount;
    String reason;
    String createdBy;
    Instant createdAt;
}
