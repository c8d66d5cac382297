package com.flagship.retail_ledger.pricing;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Order-level discount as entered at checkout: a percentage of the subtotal or a flat amount.
 */
@Value
public class OrderDiscount {
    DiscountType type;
    BigDecimal value;

    public static OrderDiscount percent(BigDecimal value) {
        return new OrderDiscount(DiscountType.PERCENT, value);
    }

    public static OrderDiscount amount(BigDecimal value) {
        return new OrderDiscount(DiscountType.AMOUNT, value);
    }
}
