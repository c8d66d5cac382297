package com.flagship.retail_ledger.stock;

/**
 * What caused a stock movement. The movement's source id points at the sale, purchase,
 * return or adjustment row.
 */
public enum MovementSource {
    SALE,
    PURCHASE,
    CUSTOMER_RETURN,
    SUPPLIER_RETURN,
    ADJUSTMENT
}
