package com.flagship.retail_ledger.returns;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class SupplierReturn {
    UUID id;
    String tenantId;
    UUID purchaseId;
    UUID purchaseLineId;
    UUID itemId;
    BigDecimal quantity;
    ReturnType type;
    BigDecimal amount;
    String reason;
    String createdBy;
    Instant createdAt;
}
