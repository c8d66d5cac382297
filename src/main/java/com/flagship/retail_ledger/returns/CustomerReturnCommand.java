package com.flagship.retail_ledger.returns;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Goods brought back against a sale. {@code lineId} picks the sale line; without it the line is
 * found by {@code itemId}, which must then match exactly one line.
 */
@Value
@Builder
public class CustomerReturnCommand {
    String tenantId;
    String userId;
    UUID saleId;
    UUID itemId;
    UUID lineId;
    BigDecimal quantity;
    ReturnType type;
    BigDecimal amount;
    String reason;
}
