package com.flagship.retail_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.balance.BalanceReconciliation;
import com.flagship.retail_ledger.catalog.CounterpartyKind;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class ReconciliationResponse {

    @JsonProperty("counterparty_kind")
    CounterpartyKind counterpartyKind;

    @JsonProperty("counterparty_id")
    UUID counterpartyId;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("journal_sum")
    BigDecimal journalSum;

    @JsonProperty("drift")
    BigDecimal drift;

    @JsonProperty("overridden")
    boolean overridden;

    @JsonProperty("consistent")
    boolean consistent;

    public static ReconciliationResponse from(BalanceReconciliation reconciliation) {
        return new ReconciliationResponse(reconciliation.getKind(), reconciliation.getCounterpartyId(),
            reconciliation.getBalance(), reconciliation.getJournalSum(), reconciliation.getDrift(),
            reconciliation.isOverridden(), reconciliation.isConsistent());
    }
}
