package com.flagship.retail_ledger.pricing;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Unit price together with the tier it was actually taken from.
 */
@Value
public class ResolvedPrice {
    PriceTier tier;
    BigDecimal unitPrice;

    public boolean isFallback(PriceTier requested) {
        return tier != requested;
    }
}
