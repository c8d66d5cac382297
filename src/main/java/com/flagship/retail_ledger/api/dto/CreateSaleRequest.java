package com.flagship.retail_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.common.PaymentMethod;
import com.flagship.retail_ledger.common.PaymentType;
import com.flagship.retail_ledger.pricing.DiscountType;
import com.flagship.retail_ledger.pricing.OrderDiscount;
import com.flagship.retail_ledger.sale.CreateSaleCommand;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
public class CreateSaleRequest {

    @JsonProperty("customer_id")
    UUID customerId;

    @NotEmpty(message = "At least one line is required")
    @Valid
    @JsonProperty("lines")
    List<SaleLineRequest> lines;

    @NotNull(message = "Payment type is required")
    @JsonProperty("payment_type")
    PaymentType paymentType;

    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    @DecimalMin(value = "0", message = "Paid amount cannot be negative")
    @JsonProperty("paid_amount")
    BigDecimal paidAmount;

    @JsonProperty("discount_type")
    DiscountType discountType;

    @DecimalMin(value = "0", message = "Discount cannot be negative")
    @JsonProperty("discount_value")
    BigDecimal discountValue;

    public CreateSaleCommand toCommand(String tenantId, String userId) {
        CreateSaleCommand.CreateSaleCommandBuilder builder = CreateSaleCommand.builder()
            .tenantId(tenantId)
            .userId(userId)
            .customerId(customerId)
            .paymentType(paymentType)
            .paymentMethod(paymentMethod != null ? paymentMethod : PaymentMethod.CASH)
            .paidAmount(paidAmount);
        if (discountType != null && discountValue != null) {
            builder.discount(new OrderDiscount(discountType, discountValue));
        }
        lines.forEach(line -> builder.line(line.toCommand()));
        return builder.build();
    }
}
