package com.flagship.retail_ledger.catalog;

/**
 * The two kinds of balance-carrying parties. A customer balance is what the customer owes the
 * shop; a supplier balance is what the shop owes the supplier.
 */
public enum CounterpartyKind {
    CUSTOMER("customers"),
    SUPPLIER("suppliers");

    private final String tableName;

    CounterpartyKind(String tableName) {
        this.tableName = tableName;
    }

    public String tableName() {
        return tableName;
    }

    public String displayName() {
        return this == CUSTOMER ? "Customer" : "Supplier";
    }
}
