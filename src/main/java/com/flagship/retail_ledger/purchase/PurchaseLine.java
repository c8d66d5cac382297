package com.flagship.retail_ledger.purchase;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class PurchaseLine {
    UUID id;
    UUID purchaseId;
    UUID itemId;
    int lineNumber;
    BigDecimal quantity;
    BigDecimal unitCost;
    BigDecimal subtotal;
}
