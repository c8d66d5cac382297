package com.flagship.retail_ledger.sale;

import com.flagship.retail_ledger.pricing.PriceTier;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class SaleLine {
    UUID id;
    UUID saleId;
    UUID itemId;
    int lineNumber;
    BigDecimal quantity;
    BigDecimal unitPrice;
    PriceTier priceTier;      // tier actually applied
    BigDecimal lineDiscount;
    BigDecimal subtotal;
}
