package com.flagship.retail_ledger.purchase;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A received line. {@code unitCost} overrides the item's cost price when the supplier invoice
 * differs; otherwise the catalog cost applies.
 */
@Value
@Builder
public class PurchaseLineCommand {
    UUID itemId;
    BigDecimal quantity;
    Long cartons;
    Integer pieces;
    BigDecimal unitCost;
}
