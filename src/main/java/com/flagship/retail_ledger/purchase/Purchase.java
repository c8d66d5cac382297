package com.flagship.retail_ledger.purchase;

import com.flagship.retail_ledger.common.PaymentMethod;
import com.flagship.retail_ledger.common.PaymentType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Goods received from a supplier. {@code totalAmount - paidAmount} was added to the supplier balance.
 */
@Value
public class Purchase {
    UUID id;
    String tenantId;
    UUID supplierId;
    List<PurchaseLine> lines;
    BigDecimal totalAmount;
    BigDecimal paidAmount;
    PaymentType paymentType;
    PaymentMethod paymentMethod;
    String createdBy;
    Instant createdAt;

    public BigDecimal getUnpaidAmount() {
        return totalAmount.subtract(paidAmount);
    }
}
