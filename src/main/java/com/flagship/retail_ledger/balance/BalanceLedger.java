package com.flagship.retail_ledger.balance;

import com.flagship.retail_ledger.catalog.CounterpartyKind;
import com.flagship.retail_ledger.exception.NegativeBalanceGuardException;
import com.flagship.retail_ledger.exception.NotFoundException;
import com.flagship.retail_ledger.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * The only writer of customer and supplier balances.
 *
 * Deltas lock the counterparty row with SELECT ... FOR UPDATE, so concurrent deltas on one
 * counterparty serialize and none is lost. Every delta appends a {@code balance_entries} row;
 * without overrides the journal sums to the stored balance.
 */
@Service
@Slf4j
public class BalanceLedger {

    static final int MONEY_SCALE = 2;

    private final JdbcTemplate jdbcTemplate;

    public BalanceLedger(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Adds {@code delta} to the counterparty balance. A zero delta changes nothing and writes no entry.
     *
     * With {@link FloorPolicy#ENFORCE_FLOOR} a negative delta that would leave the balance below
     * zero is rejected. Positive deltas are always accepted, even onto a negative balance.
     *
     * @throws NegativeBalanceGuardException if the floor would be breached
     * @throws NotFoundException             if the counterparty does not exist in this tenant
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BalanceChange applyDelta(String tenantId, CounterpartyKind kind, UUID counterpartyId,
                                    BigDecimal delta, BalanceEntryType entryType, UUID sourceId,
                                    FloorPolicy floorPolicy) {
        if (delta == null) {
            throw new ValidationException("Balance delta is required");
        }
        BigDecimal amount = money(delta);
        BigDecimal previous = lockBalance(tenantId, kind, counterpartyId);

        if (amount.signum() == 0) {
            return new BalanceChange(kind, counterpartyId, previous, previous);
        }

        BigDecimal updated = previous.add(amount);
        if (floorPolicy == FloorPolicy.ENFORCE_FLOOR && amount.signum() < 0 && updated.signum() < 0) {
            throw new NegativeBalanceGuardException(counterpartyId, previous, amount);
        }

        writeBalance(tenantId, kind, counterpartyId, updated);
        jdbcTemplate.update(
            "INSERT INTO balance_entries (tenant_id, counterparty_kind, counterparty_id, entry_type, source_id, " +
            "delta, resulting_balance) VALUES (?, ?, ?, ?, ?, ?, ?)",
            tenantId,
            kind.name(),
            counterpartyId,
            entryType.name(),
            sourceId,
            amount,
            updated
        );

        log.debug("Balance changed: kind={}, id={}, delta={}, now={}, entryType={}",
                kind, counterpartyId, amount, updated, entryType);
        return new BalanceChange(kind, counterpartyId, previous, updated);
    }

    /**
     * Administrative override: sets the balance to an absolute value and records who did it.
     * No journal entry is written, so afterwards {@link #reconcile} reports the difference as drift.
     *
     * @throws ValidationException if {@code newBalance} is negative
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BalanceOverride setAbsolute(String tenantId, CounterpartyKind kind, UUID counterpartyId,
                                       BigDecimal newBalance, String reason, String userId) {
        if (newBalance == null || newBalance.signum() < 0) {
            throw new ValidationException("Balance must be a non-negative number");
        }
        BigDecimal target = money(newBalance);
        BigDecimal previous = lockBalance(tenantId, kind, counterpartyId);

        writeBalance(tenantId, kind, counterpartyId, target);

        BalanceOverride override = new BalanceOverride(
            UUID.randomUUID(), tenantId, kind, counterpartyId, previous, target, reason, userId, Instant.now());
        jdbcTemplate.update(
            "INSERT INTO balance_overrides (id, tenant_id, counterparty_kind, counterparty_id, previous_balance, " +
            "new_balance, reason, user_id, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
            override.getId(),
            tenantId,
            kind.name(),
            counterpartyId,
            previous,
            target,
            reason,
            userId,
            Timestamp.from(override.getCreatedAt())
        );

        log.info("Balance overridden: kind={}, id={}, from={}, to={}, user={}",
                kind, counterpartyId, previous, target, userId);
        return override;
    }

    @Transactional(readOnly = true)
    public BigDecimal getBalance(String tenantId, CounterpartyKind kind, UUID counterpartyId) {
        List<BigDecimal> rows = jdbcTemplate.query(
            "SELECT balance FROM " + kind.tableName() + " WHERE id = ? AND tenant_id = ?",
            (rs, rowNum) -> rs.getBigDecimal("balance"),
            counterpartyId,
            tenantId
        );
        if (rows.isEmpty()) {
            throw new NotFoundException(kind.displayName(), counterpartyId);
        }
        return rows.get(0);
    }

    @Transactional(readOnly = true)
    public List<BalanceEntry> getEntries(String tenantId, CounterpartyKind kind, UUID counterpartyId) {
        return jdbcTemplate.query(
            "SELECT id, tenant_id, counterparty_kind, counterparty_id, entry_type, source_id, delta, " +
            "resulting_balance, sequence_number, created_at FROM balance_entries " +
            "WHERE tenant_id = ? AND counterparty_kind = ? AND counterparty_id = ? ORDER BY sequence_number",
            entryRowMapper(),
            tenantId,
            kind.name(),
            counterpartyId
        );
    }

    /**
     * Compares the stored balance with the sum of its journal entries.
     */
    @Transactional(readOnly = true)
    public BalanceReconciliation reconcile(String tenantId, CounterpartyKind kind, UUID counterpartyId) {
        BigDecimal balance = money(getBalance(tenantId, kind, counterpartyId));

        BigDecimal journalSum = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(delta), 0) FROM balance_entries " +
            "WHERE tenant_id = ? AND counterparty_kind = ? AND counterparty_id = ?",
            BigDecimal.class,
            tenantId,
            kind.name(),
            counterpartyId
        );
        Integer overrides = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM balance_overrides " +
            "WHERE tenant_id = ? AND counterparty_kind = ? AND counterparty_id = ?",
            Integer.class,
            tenantId,
            kind.name(),
            counterpartyId
        );

        BigDecimal sum = money(journalSum != null ? journalSum : BigDecimal.ZERO);
        return new BalanceReconciliation(
            kind, counterpartyId, balance, sum, balance.subtract(sum), overrides != null && overrides > 0);
    }

    private BigDecimal lockBalance(String tenantId, CounterpartyKind kind, UUID counterpartyId) {
        List<BigDecimal> rows = jdbcTemplate.query(
            "SELECT balance FROM " + kind.tableName() + " WHERE id = ? AND tenant_id = ? FOR UPDATE",
            (rs, rowNum) -> rs.getBigDecimal("balance"),
            counterpartyId,
            tenantId
        );
        if (rows.isEmpty()) {
            throw new NotFoundException(kind.displayName(), counterpartyId);
        }
        return money(rows.get(0));
    }

    private void writeBalance(String tenantId, CounterpartyKind kind, UUID counterpartyId, BigDecimal balance) {
        jdbcTemplate.update(
            "UPDATE " + kind.tableName() + " SET balance = ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND tenant_id = ?",
            balance,
            counterpartyId,
            tenantId
        );
    }

    private static BigDecimal money(BigDecimal amount) {
        return amount.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    private RowMapper<BalanceEntry> entryRowMapper() {
        return (rs, rowNum) -> {
            Timestamp createdAt = rs.getTimestamp("created_at");
            return new BalanceEntry(
                UUID.fromString(rs.getString("id")),
                rs.getString("tenant_id"),
                CounterpartyKind.valueOf(rs.getString("counterparty_kind")),
                UUID.fromString(rs.getString("counterparty_id")),
                BalanceEntryType.valueOf(rs.getString("entry_type")),
                UUID.fromString(rs.getString("source_id")),
                rs.getBigDecimal("delta"),
                rs.getBigDecimal("resulting_balance"),
                rs.getLong("sequence_number"),
                createdAt != null ? createdAt.toInstant() : null
            );
        };
    }
}
