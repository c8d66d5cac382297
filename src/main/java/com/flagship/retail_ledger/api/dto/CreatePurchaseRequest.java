package com.flagship.retail_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.common.PaymentMethod;
import com.flagship.retail_ledger.common.PaymentType;
import com.flagship.retail_ledger.purchase.CreatePurchaseCommand;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
public class CreatePurchaseRequest {

    @NotNull(message = "Supplier ID is required")
    @JsonProperty("supplier_id")
    UUID supplierId;

    @NotEmpty(message = "At least one line is required")
    @Valid
    @JsonProperty("lines")
    List<PurchaseLineRequest> lines;

    @NotNull(message = "Payment type is required")
    @JsonProperty("payment_type")
    PaymentType paymentType;

    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    @DecimalMin(value = "0", message = "Paid amount cannot be negative")
    @JsonProperty("paid_amount")
    BigDecimal paidAmount;

    public CreatePurchaseCommand toCommand(String tenantId, String userId) {
        CreatePurchaseCommand.CreatePurchaseCommandBuilder builder = CreatePurchaseCommand.builder()
            .tenantId(tenantId)
            .userId(userId)
            .supplierId(supplierId)
            .paymentType(paymentType)
            .paymentMethod(paymentMethod != null ? paymentMethod : PaymentMethod.CASH)
            .paidAmount(paidAmount);
        lines.forEach(line -> builder.line(line.toCommand()));
        return builder.build();
    }
}
