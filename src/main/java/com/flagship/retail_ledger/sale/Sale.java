package com.flagship.retail_ledger.sale;

import com.flagship.retail_ledger.common.PaymentMethod;
import com.flagship.retail_ledger.common.PaymentType;
import com.flagship.retail_ledger.pricing.DiscountType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A committed sale. Immutable once written; corrections go through returns.
 *
 * {@code totalAmount = max(0, subtotal - orderDiscount)} where subtotal is the sum of the line
 * subtotals, and {@code totalAmount - paidAmount} is what was added to the customer balance.
 */
@Value
public class Sale {
    UUID id;
    String tenantId;
    UUID customerId;
    List<SaleLine> lines;
    BigDecimal subtotal;
    DiscountType discountType;
    BigDecimal discountValue;
    BigDecimal orderDiscount;
    BigDecimal totalAmount;
    BigDecimal paidAmount;
    PaymentType paymentType;
    PaymentMethod paymentMethod;
    String createdBy;
    Instant createdAt;

    public BigDecimal getUnpaidAmount() {
        return totalAmount.subtract(paidAmount);
    }

    public boolean isWalkIn() {
        return customerId == null;
    }
}
