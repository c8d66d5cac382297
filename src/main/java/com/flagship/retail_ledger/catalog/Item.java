package com.flagship.retail_ledger.catalog;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Read model of a catalog item. Only the stock ledger writes {@code quantity}.
 */
@Value
public class Item {
    UUID id;
    String tenantId;
    String name;
    BigDecimal quantity;
    BigDecimal costPrice;
    BigDecimal sellingPrice;
    BigDecimal retailPrice;     // optional tier
    BigDecimal wholesalePrice;  // optional tier
    BigDecimal promoPrice;      // optional tier
    String unitName;
    int piecesPerUnit;

    public boolean isCartonMode() {
        return piecesPerUnit > 1;
    }

    public boolean isWeightMode() {
        return piecesPerUnit == 1 && unitName != null && !unitName.isBlank();
    }
}
