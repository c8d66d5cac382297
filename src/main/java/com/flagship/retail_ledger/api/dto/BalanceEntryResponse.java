package com.flagship.retail_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.balance.BalanceEntry;
import com.flagship.retail_ledger.balance.BalanceEntryType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class BalanceEntryResponse {

    @JsonProperty("entry_type")
    BalanceEntryType entryType;

    @JsonProperty("source_id")
    UUID sourceId;

    @JsonProperty("delta")
    BigDecimal delta;

    @JsonProperty("resulting_balance")
    BigDecimal resultingBalance;

    @JsonProperty("created_at")
    Instant createdAt;

    public static BalanceEntryResponse from(BalanceEntry entry) {
        return new BalanceEntryResponse(entry.getEntryType(), entry.getSourceId(), entry.getDelta(),
            entry.getResultingBalance(), entry.getCreatedAt());
    }
}
