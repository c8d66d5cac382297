package com.flagship.retail_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.balance.BalanceOverride;
import com.flagship.retail_ledger.catalog.CounterpartyKind;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class BalanceOverrideResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("counterparty_kind")
    CounterpartyKind counterpartyKind;

    @JsonProperty("counterparty_id")
    UUID counterpartyId;

    @JsonProperty("previous_balance")
    BigDecimal previousBalance;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("created_at")
    Instant createdAt;

    public static BalanceOverrideResponse from(BalanceOverride override) {
        return BalanceOverrideResponse.builder()
            .id(override.getId())
            .counterpartyKind(override.getKind())
            .counterpartyId(override.getCounterpartyId())
            .previousBalance(override.getPreviousBalance())
            .balance(override.getNewBalance())
            .reason(override.getReason())
            .userId(override.getUserId())
            .createdAt(override.getCreatedAt())
            .build();
    }
}
