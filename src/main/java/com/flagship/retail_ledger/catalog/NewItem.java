package com.flagship.retail_ledger.catalog;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Attributes for seeding a catalog item.
 */
@Value
@Builder
public class NewItem {
    String name;
    @Builder.Default
    BigDecimal quantity = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal costPrice = BigDecimal.ZERO;
    BigDecimal sellingPrice;
    BigDecimal retailPrice;
    BigDecimal wholesalePrice;
    BigDecimal promoPrice;
    String unitName;
    @Builder.Default
    int piecesPerUnit = 1;
}
