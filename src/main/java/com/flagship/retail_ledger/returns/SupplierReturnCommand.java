package com.flagship.retail_ledger.returns;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class SupplierReturnCommand {
    String tenantId;
    String userId;
    UUID purchaseId;
    UUID itemId;
    UUID lineId;
    BigDecimal quantity;
    ReturnType type;
    BigDecimal amount;
    String reason;
}
