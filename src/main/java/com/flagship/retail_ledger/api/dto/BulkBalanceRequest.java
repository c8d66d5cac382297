package com.flagship.retail_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.catalog.CounterpartyKind;
import com.flagship.retail_ledger.engine.BulkBalanceRow;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
public class BulkBalanceRequest {

    @NotNull(message = "Counterparty kind is required")
    @JsonProperty("counterparty_kind")
    CounterpartyKind counterpartyKind;

    @NotEmpty(message = "adjustments array is required")
    @JsonProperty("adjustments")
    List<Row> adjustments;

    public List<BulkBalanceRow> toRows() {
        return adjustments.stream()
            .map(row -> BulkBalanceRow.builder()
                .counterpartyId(row.getCounterpartyId())
                .balance(row.getBalance())
                .reason(row.getReason())
                .build())
            .toList();
    }

    @Value
    public static class Row {
        @JsonProperty("counterparty_id")
        UUID counterpartyId;

        @JsonProperty("balance")
        BigDecimal balance;

        @JsonProperty("reason")
        String reason;
    }
}
