package com.flagship.retail_ledger.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.retail_ledger.event.StockAdjustedEvent;
import com.flagship.retail_ledger.support.LedgerIntegrationSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.IllegalTransactionStateException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class OutboxServiceTest extends LedgerIntegrationSupport {

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private ObjectMapper objectMapper;

    private StockAdjustedEvent event(UUID itemId) {
        return new StockAdjustedEvent(UUID.randomUUID(), tenantId, UUID.randomUUID(), itemId, "INCREASE",
            new BigDecimal("1"), new BigDecimal("3"), "Recount", userId, Instant.now());
    }

    @Test
    @DisplayName("Saving an event outside a transaction is rejected")
    void testSaveRequiresTransaction() {
        assertThrows(IllegalTransactionStateException.class,
            () -> outboxService.saveEvent(event(UUID.randomUUID())));
    }

    @Test
    @DisplayName("Events are stored as JSON in order per aggregate")
    void testSaveAndRead() {
        printTestHeader("Outbox Save");
        UUID itemId = UUID.randomUUID();

        transactionTemplate.executeWithoutResult(status -> {
            outboxService.saveEvent(event(itemId));
            outboxService.saveEvent(event(itemId));
        });

        List<OutboxEvent> events = outboxService.getEventsForAggregate(StockAdjustedEvent.AGGREGATE_TYPE, itemId);
        printOutput("Events", events);
        assertEquals(2, events.size());
        assertTrue(events.get(0).getSequenceNumber() < events.get(1).getSequenceNumber());
        assertEquals(StockAdjustedEvent.EVENT_TYPE, events.get(0).getEventType());
        assertFalse(events.get(0).isPublished());

        JsonNode payload = assertDoesNotThrow(() -> objectMapper.readTree(events.get(0).getPayload()));
        assertEquals(itemId.toString(), payload.get("itemId").asText());
        assertEquals(tenantId, payload.get("tenantId").asText());
        printSuccess("Payload carries the item and tenant");
    }

    @Test
    @DisplayName("Published events leave the unpublished count, failed ones count retries")
    void testPublishedAndFailed() {
        UUID itemId = UUID.randomUUID();
        long before = outboxService.countUnpublished();

        OutboxEvent saved = transactionTemplate.execute(status -> outboxService.saveEvent(event(itemId)));
        assertEquals(before + 1, outboxService.countUnpublished());

        outboxService.markFailed(saved.getId(), "broker unavailable");
        OutboxEvent failed = outboxService.getEventsForAggregate(StockAdjustedEvent.AGGREGATE_TYPE, itemId).get(0);
        assertEquals(1, failed.getRetryCount());
        assertEquals("broker unavailable", failed.getLastError());
        assertFalse(failed.isDeadLettered(5));
        assertTrue(failed.isDeadLettered(1));

        outboxService.markPublished(saved.getId());
        OutboxEvent published = outboxService.getEventsForAggregate(StockAdjustedEvent.AGGREGATE_TYPE, itemId).get(0);
        assertTrue(published.isPublished());
        assertEquals(before, outboxService.countUnpublished());
    }
}
