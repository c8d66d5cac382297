package com.flagship.retail_ledger.sale;

import com.flagship.retail_ledger.pricing.PriceTier;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A line as rung up at the counter. The quantity is given either as a decimal
 * ({@code quantity}) or as {@code cartons} plus loose {@code pieces}. Prices are never taken from
 * the caller; only the tier is.
 */
@Value
@Builder
public class SaleLineCommand {
    UUID itemId;
    BigDecimal quantity;
    Long cartons;
    Integer pieces;
    PriceTier priceTier;
    BigDecimal lineDiscount;
}
