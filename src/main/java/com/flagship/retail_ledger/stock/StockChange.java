package com.flagship.retail_ledger.stock;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Before and after quantities of a single stock mutation.
 */
@Value
public class StockChange {
    UUID itemId;
    BigDecimal previousQuantity;
    BigDecimal newQuantity;

    public BigDecimal getDelta() {
        return newQuantity.subtract(previousQuantity);
    }
}
