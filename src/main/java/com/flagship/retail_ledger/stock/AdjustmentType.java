package com.flagship.retail_ledger.stock;

/**
 * Manual stock correction. INCREASE and DECREASE move stock by the given quantity; SET replaces
 * it with an absolute count (a stock take).
 */
public enum AdjustmentType {
    INCREASE,
    DECREASE,
    SET
}
