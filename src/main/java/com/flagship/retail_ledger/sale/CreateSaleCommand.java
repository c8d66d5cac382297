package com.flagship.retail_ledger.sale;

import com.flagship.retail_ledger.common.PaymentMethod;
import com.flagship.retail_ledger.common.PaymentType;
import com.flagship.retail_ledger.pricing.OrderDiscount;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class CreateSaleCommand {
    String tenantId;
    String userId;
    UUID customerId;          // null for a walk-in sale
    @Singular
    List<SaleLineCommand> lines;
    PaymentType paymentType;
    PaymentMethod paymentMethod;
    BigDecimal paidAmount;    // ignored for CASH
    OrderDiscount discount;
}
