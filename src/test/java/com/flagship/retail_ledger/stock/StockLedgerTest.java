package com.flagship.retail_ledger.stock;

import com.flagship.retail_ledger.exception.InsufficientStockException;
import com.flagship.retail_ledger.exception.NotFoundException;
import com.flagship.retail_ledger.exception.ValidationException;
import com.flagship.retail_ledger.support.LedgerIntegrationSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.IllegalTransactionStateException;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Stock ledger guards: stock never goes negative, every change leaves a movement, and nothing
 * mutates stock outside a caller's transaction.
 */
class StockLedgerTest extends LedgerIntegrationSupport {

    @Autowired
    private StockLedger stockLedger;

    @Test
    @DisplayName("Decrease below zero is rejected and leaves stock untouched")
    void testDecreaseBeyondAvailable() {
        printTestHeader("Decrease Beyond Available");
        UUID itemId = createItem("Sugar 1kg", "3", "12.00");

        InsufficientStockException e = assertThrows(InsufficientStockException.class,
            () -> transactionTemplate.execute(status ->
                stockLedger.decrease(tenantId, itemId, new BigDecimal("5"), MovementSource.SALE, UUID.randomUUID())));

        printExpectedException("InsufficientStockException", e.getMessage());
        assertAmount("3", e.getAvailable());
        assertAmount("5", e.getRequested());
        assertEquals("3", e.getDetails().get("available"));
        assertAmount("3", stockOf(itemId));
        assertTrue(stockLedger.getMovements(tenantId, itemId).isEmpty());
        printSuccess("Stock unchanged at 3");
    }

    @Test
    @DisplayName("Every mutation writes a movement whose deltas sum to the stock change")
    void testMovementsTrackEveryChange() {
        printTestHeader("Movements Track Every Change");
        UUID itemId = createItem("Flour", "10", "8.00");
        UUID sourceId = UUID.randomUUID();

        transactionTemplate.executeWithoutResult(status -> {
            stockLedger.decrease(tenantId, itemId, new BigDecimal("2.5"), MovementSource.SALE, sourceId);
            stockLedger.increase(tenantId, itemId, new BigDecimal("4"), MovementSource.PURCHASE, sourceId);
            stockLedger.set(tenantId, itemId, new BigDecimal("7"), MovementSource.ADJUSTMENT, sourceId);
        });

        List<StockMovement> movements = stockLedger.getMovements(tenantId, itemId);
        printOutput("Movements", movements.size());
        assertEquals(3, movements.size());
        assertEquals(MovementSource.SALE, movements.get(0).getSource());
        assertAmount("-2.5", movements.get(0).getDelta());
        assertAmount("7.5", movements.get(0).getResultingQuantity());
        assertAmount("-4.5", movements.get(2).getDelta());

        BigDecimal sum = movements.stream().map(StockMovement::getDelta).reduce(BigDecimal.ZERO, BigDecimal::add);
        assertAmount("-3", sum);
        assertAmount("7", stockOf(itemId));
        assertEquals(3, stockLedger.getMovementsForSource(tenantId, sourceId).size());
        printSuccess("Movement deltas reconcile with stock");
    }

    @Test
    @DisplayName("Stock mutations require an existing transaction")
    void testMandatoryTransaction() {
        printTestHeader("Mandatory Transaction");
        UUID itemId = createItem("Salt", "5", "2.00");

        assertThrows(IllegalTransactionStateException.class,
            () -> stockLedger.increase(tenantId, itemId, BigDecimal.ONE, MovementSource.PURCHASE, UUID.randomUUID()));
        assertAmount("5", stockOf(itemId));
        printSuccess("Call outside a transaction rejected");
    }

    @Test
    @DisplayName("Items of another tenant are invisible")
    void testTenantIsolation() {
        printTestHeader("Tenant Isolation");
        UUID itemId = createItem("Oil 1L", "5", "20.00");

        assertThrows(NotFoundException.class, () -> transactionTemplate.execute(status ->
            stockLedger.decrease("other-tenant", itemId, BigDecimal.ONE, MovementSource.SALE, UUID.randomUUID())));
        assertAmount("5", stockOf(itemId));
        printSuccess("Other tenant could not touch the item");
    }

    @Test
    @DisplayName("Zero or negative quantities and negative targets are rejected")
    void testInvalidQuantities() {
        UUID itemId = createItem("Beans", "5", "6.00");

        assertThrows(ValidationException.class, () -> transactionTemplate.execute(status ->
            stockLedger.increase(tenantId, itemId, BigDecimal.ZERO, MovementSource.PURCHASE, UUID.randomUUID())));
        assertThrows(ValidationException.class, () -> transactionTemplate.execute(status ->
            stockLedger.decrease(tenantId, itemId, new BigDecimal("-1"), MovementSource.SALE, UUID.randomUUID())));
        assertThrows(ValidationException.class, () -> transactionTemplate.execute(status ->
            stockLedger.set(tenantId, itemId, new BigDecimal("-1"), MovementSource.ADJUSTMENT, UUID.randomUUID())));
        assertAmount("5", stockOf(itemId));
    }
}
