package com.flagship.retail_ledger.balance;

import com.flagship.retail_ledger.catalog.CounterpartyKind;
import com.flagship.retail_ledger.exception.NegativeBalanceGuardException;
import com.flagship.retail_ledger.exception.ValidationException;
import com.flagship.retail_ledger.support.LedgerIntegrationSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class BalanceLedgerTest extends LedgerIntegrationSupport {

    @Autowired
    private BalanceLedger balanceLedger;

    @Autowired
    private BalanceOverrideService balanceOverrideService;

    private BalanceChange apply(UUID customerId, String delta, BalanceEntryType type, FloorPolicy policy) {
        return transactionTemplate.execute(status -> balanceLedger.applyDelta(
            tenantId, CounterpartyKind.CUSTOMER, customerId, new BigDecimal(delta), type, UUID.randomUUID(), policy));
    }

    @Test
    @DisplayName("Floor policy rejects a delta that would take the balance below zero")
    void testFloorEnforced() {
        printTestHeader("Floor Enforced");
        UUID customerId = createCustomer("Ama");
        apply(customerId, "100", BalanceEntryType.CREDIT_SALE, FloorPolicy.ENFORCE_FLOOR);

        NegativeBalanceGuardException e = assertThrows(NegativeBalanceGuardException.class,
            () -> apply(customerId, "-150", BalanceEntryType.PAYMENT, FloorPolicy.ENFORCE_FLOOR));

        printExpectedException("NegativeBalanceGuardException", e.getMessage());
        assertAmount("100", e.getCurrentBalance());
        assertAmount("100", balanceLedger.getBalance(tenantId, CounterpartyKind.CUSTOMER, customerId));
        assertEquals(1, balanceLedger.getEntries(tenantId, CounterpartyKind.CUSTOMER, customerId).size());
        printSuccess("Balance unchanged, no journal entry written");
    }

    @Test
    @DisplayName("ALLOW_NEGATIVE lets a credit note push the balance below zero")
    void testAllowNegative() {
        UUID customerId = createCustomer("Kofi");
        apply(customerId, "20", BalanceEntryType.CREDIT_SALE, FloorPolicy.ENFORCE_FLOOR);

        BalanceChange change = apply(customerId, "-50", BalanceEntryType.RETURN_CREDIT, FloorPolicy.ALLOW_NEGATIVE);

        assertAmount("20", change.getPreviousBalance());
        assertAmount("-30", change.getNewBalance());
        assertAmount("-30", balanceLedger.getBalance(tenantId, CounterpartyKind.CUSTOMER, customerId));
    }

    @Test
    @DisplayName("A zero delta writes no journal entry")
    void testZeroDelta() {
        UUID customerId = createCustomer("Esi");
        apply(customerId, "0", BalanceEntryType.CREDIT_SALE, FloorPolicy.ENFORCE_FLOOR);
        assertTrue(balanceLedger.getEntries(tenantId, CounterpartyKind.CUSTOMER, customerId).isEmpty());
    }

    @Test
    @DisplayName("Reconciliation shows no drift for journaled changes and flags overrides")
    void testReconciliation() {
        printTestHeader("Reconciliation");
        UUID customerId = createCustomer("Yaw");
        apply(customerId, "120.50", BalanceEntryType.CREDIT_SALE, FloorPolicy.ENFORCE_FLOOR);
        apply(customerId, "-20.50", BalanceEntryType.PAYMENT, FloorPolicy.ENFORCE_FLOOR);

        BalanceReconciliation clean = balanceLedger.reconcile(tenantId, CounterpartyKind.CUSTOMER, customerId);
        printOutput("Before override", clean);
        assertTrue(clean.isConsistent());
        assertFalse(clean.isOverridden());
        assertAmount("100", clean.getJournalSum());

        BalanceOverride override = balanceOverrideService.override(OverrideBalanceCommand.builder()
            .tenantId(tenantId)
            .userId("manager-1")
            .kind(CounterpartyKind.CUSTOMER)
            .counterpartyId(customerId)
            .newBalance(new BigDecimal("75"))
            .reason("Agreed settlement")
            .build());
        assertAmount("100", override.getPreviousBalance());
        assertAmount("75", override.getNewBalance());

        BalanceReconciliation drifted = balanceLedger.reconcile(tenantId, CounterpartyKind.CUSTOMER, customerId);
        printOutput("After override", drifted);
        assertFalse(drifted.isConsistent());
        assertTrue(drifted.isOverridden());
        assertAmount("-25", drifted.getDrift());

        Integer audits = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM balance_overrides WHERE tenant_id = ? AND counterparty_id = ?",
            Integer.class, tenantId, customerId);
        assertEquals(1, audits);
        printSuccess("Override audited and reported as drift");
    }

    @Test
    @DisplayName("Overrides reject negative balances and require a reason")
    void testOverrideValidation() {
        UUID supplierId = createSupplier("Acme Wholesale");

        assertThrows(ValidationException.class, () -> balanceOverrideService.override(OverrideBalanceCommand.builder()
            .tenantId(tenantId).userId("manager-1").kind(CounterpartyKind.SUPPLIER).counterpartyId(supplierId)
            .newBalance(new BigDecimal("-1")).reason("typo").build()));
        assertThrows(ValidationException.class, () -> balanceOverrideService.override(OverrideBalanceCommand.builder()
            .tenantId(tenantId).userId("manager-1").kind(CounterpartyKind.SUPPLIER).counterpartyId(supplierId)
            .newBalance(BigDecimal.TEN).reason(" ").build()));

        List<BalanceEntry> entries = balanceLedger.getEntries(tenantId, CounterpartyKind.SUPPLIER, supplierId);
        assertTrue(entries.isEmpty());
        assertAmount("0", balanceLedger.getBalance(tenantId, CounterpartyKind.SUPPLIER, supplierId));
    }
}
