package com.flagship.retail_ledger.returns;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A sale or purchase line with how much of it has been returned so far.
 */
@Value
public class ReturnableLine {
    UUID lineId;
    UUID itemId;
    int lineNumber;
    BigDecimal quantity;
    BigDecimal returnedQuantity;

    public BigDecimal getRemainingQuantity() {
        return quantity.subtract(returnedQuantity);
    }
}
