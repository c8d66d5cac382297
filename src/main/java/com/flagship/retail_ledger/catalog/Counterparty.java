package com.flagship.retail_ledger.catalog;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A customer or supplier as seen by the ledger.
 */
@Value
public class Counterparty {
    UUID id;
    String tenantId;
    CounterpartyKind kind;
    String name;
    BigDecimal balance;
}
