package com.flagship.retail_ledger.pricing;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Priced line: the discount actually taken (never more than the gross value) and the subtotal
 * left after it, so that {@code subtotal == gross - discount}.
 */
@Value
public class LineAmount {
    BigDecimal discount;
    BigDecimal subtotal;
}
