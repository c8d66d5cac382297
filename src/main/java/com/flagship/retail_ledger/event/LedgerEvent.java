package com.flagship.retail_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * A fact the ledger publishes after an operation commits.
 *
 * Serialized as JSON into the outbox. Consumers deduplicate on {@link #getEventId()}.
 */
public interface LedgerEvent {

    UUID getEventId();

    String getTenantId();

    /**
     * Aggregate the event belongs to, also the Kafka record key.
     */
    UUID getAggregateId();

    String getAggregateType();

    String getEventType();

    Instant getOccurredAt();
}
