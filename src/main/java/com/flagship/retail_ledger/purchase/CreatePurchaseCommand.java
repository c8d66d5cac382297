package com.flagship.retail_ledger.purchase;

import com.flagship.retail_ledger.common.PaymentMethod;
import com.flagship.retail_ledger.common.PaymentType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class CreatePurchaseCommand {
    String tenantId;
    String userId;
    UUID supplierId;
    @Singular
    List<PurchaseLineCommand> lines;
    PaymentType paymentType;
    PaymentMethod paymentMethod;
    BigDecimal paidAmount;
}
