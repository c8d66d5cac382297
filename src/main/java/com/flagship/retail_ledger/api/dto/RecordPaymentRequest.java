package com.flagship.retail_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.catalog.CounterpartyKind;
import com.flagship.retail_ledger.common.PaymentMethod;
import com.flagship.retail_ledger.payment.RecordPaymentCommand;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class RecordPaymentRequest {

    @NotNull(message = "Counterparty kind is required")
    @JsonProperty("counterparty_kind")
    CounterpartyKind counterpartyKind;

    @NotNull(message = "Counterparty ID is required")
    @JsonProperty("counterparty_id")
    UUID counterpartyId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotNull(message = "Payment method is required")
    @JsonProperty("method")
    PaymentMethod method;

    @JsonProperty("reference")
    String reference;

    public RecordPaymentCommand toCommand(String tenantId, String userId, String idempotencyKey) {
        return RecordPaymentCommand.builder()
            .tenantId(tenantId)
            .userId(userId)
            .kind(counterpartyKind)
            .counterpartyId(counterpartyId)
            .amount(amount)
            .method(method)
            .reference(reference)
            .idempotencyKey(idempotencyKey)
            .build();
    }
}
