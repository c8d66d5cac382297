package com.flagship.retail_ledger.stock;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One row of the append-only stock journal.
 */
@Value
public class StockMovement {
    UUID id;
    String tenantId;
    UUID itemId;
    MovementSource source;
    UUID sourceId;
    BigDecimal delta;
    BigDecimal resultingQuantity;
    long sequenceNumber;
    Instant createdAt;
}
