package com.flagship.retail_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.catalog.CounterpartyKind;
import com.flagship.retail_ledger.common.PaymentMethod;
import com.flagship.retail_ledger.payment.Payment;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PaymentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("counterparty_kind")
    CounterpartyKind counterpartyKind;

    @JsonProperty("counterparty_id")
    UUID counterpartyId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("method")
    PaymentMethod method;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("created_at")
    Instant createdAt;

    public static PaymentResponse from(Payment payment) {
        return PaymentResponse.builder()
            .id(payment.getId())
            .counterpartyKind(payment.getKind())
            .counterpartyId(payment.getCounterpartyId())
            .amount(payment.getAmount())
            .method(payment.getMethod())
            .reference(payment.getReference())
            .createdBy(payment.getCreatedBy())
            .createdAt(payment.getCreatedAt())
            .build();
    }
}
