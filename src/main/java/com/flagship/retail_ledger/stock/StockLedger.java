package com.flagship.retail_ledger.stock;

import com.flagship.retail_ledger.exception.InsufficientStockException;
import com.flagship.retail_ledger.exception.NotFoundException;
import com.flagship.retail_ledger.exception.ValidationException;
import com.flagship.retail_ledger.unit.UnitConverter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;

/**
 * The only writer of {@code items.quantity}.
 *
 * Every mutation joins the caller's transaction and appends a row to {@code stock_movements}
 * with the resulting quantity, so the journal replays to the current stock level.
 *
 * Decreases are a single conditional UPDATE ({@code quantity >= ?}). PostgreSQL re-evaluates the
 * condition after waiting on a concurrent writer's row lock, so two sales racing for the last
 * units cannot both succeed. The {@code chk_items_quantity_non_negative} constraint backs this up.
 */
@Service
@Slf4j
public class StockLedger {

    private final JdbcTemplate jdbcTemplate;

    public StockLedger(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Removes {@code quantity} from the item's stock.
     *
     * @throws InsufficientStockException if less than {@code quantity} is on hand
     * @throws NotFoundException          if the item does not exist in this tenant
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public StockChange decrease(String tenantId, UUID itemId, BigDecimal quantity,
                                MovementSource source, UUID sourceId) {
        BigDecimal amount = requirePositive(quantity);

        List<BigDecimal> updated = jdbcTemplate.query(
            "UPDATE items SET quantity = quantity - ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND tenant_id = ? AND quantity >= ? RETURNING quantity",
            (rs, rowNum) -> rs.getBigDecimal("quantity"),
            amount,
            itemId,
            tenantId,
            amount
        );

        if (updated.isEmpty()) {
            throw insufficientOrMissing(tenantId, itemId, amount);
        }

        BigDecimal newQuantity = updated.get(0);
        StockChange change = new StockChange(itemId, newQuantity.add(amount), newQuantity);
        recordMovement(tenantId, itemId, source, sourceId, amount.negate(), newQuantity);
        log.debug("Stock decreased: itemId={}, by={}, now={}, source={}", itemId, amount, newQuantity, source);
        return change;
    }

    /**
     * Adds {@code quantity} to the item's stock.
     *
     * @throws NotFoundException if the item does not exist in this tenant
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public StockChange increase(String tenantId, UUID itemId, BigDecimal quantity,
                                MovementSource source, UUID sourceId) {
        BigDecimal amount = requirePositive(quantity);

        List<BigDecimal> updated = jdbcTemplate.query(
            "UPDATE items SET quantity = quantity + ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND tenant_id = ? RETURNING quantity",
            (rs, rowNum) -> rs.getBigDecimal("quantity"),
            amount,
            itemId,
            tenantId
        );

        if (updated.isEmpty()) {
            throw new NotFoundException("Item", itemId);
        }

        BigDecimal newQuantity = updated.get(0);
        StockChange change = new StockChange(itemId, newQuantity.subtract(amount), newQuantity);
        recordMovement(tenantId, itemId, source, sourceId, amount, newQuantity);
        log.debug("Stock increased: itemId={}, by={}, now={}, source={}", itemId, amount, newQuantity, source);
        return change;
    }

    /**
     * Sets the item's stock to an absolute quantity. The movement records the difference.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public StockChange set(String tenantId, UUID itemId, BigDecimal newQuantity,
                           MovementSource source, UUID sourceId) {
        if (newQuantity == null || newQuantity.signum() < 0) {
            throw new ValidationException("Stock quantity must be zero or greater");
        }
        BigDecimal target = scale(newQuantity);

        List<BigDecimal> current = jdbcTemplate.query(
            "SELECT quantity FROM items WHERE id = ? AND tenant_id = ? FOR UPDATE",
            (rs, rowNum) -> rs.getBigDecimal("quantity"),
            itemId,
            tenantId
        );
        if (current.isEmpty()) {
            throw new NotFoundException("Item", itemId);
        }

        BigDecimal previous = current.get(0);
        jdbcTemplate.update(
            "UPDATE items SET quantity = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ? AND tenant_id = ?",
            target,
            itemId,
            tenantId
        );
        recordMovement(tenantId, itemId, source, sourceId, target.subtract(previous), target);
        log.debug("Stock set: itemId={}, from={}, to={}, source={}", itemId, previous, target, source);
        return new StockChange(itemId, previous, target);
    }

    @Transactional(readOnly = true)
    public BigDecimal getQuantity(String tenantId, UUID itemId) {
        List<BigDecimal> rows = jdbcTemplate.query(
            "SELECT quantity FROM items WHERE id = ? AND tenant_id = ?",
            (rs, rowNum) -> rs.getBigDecimal("quantity"),
            itemId,
            tenantId
        );
        if (rows.isEmpty()) {
            throw new NotFoundException("Item", itemId);
        }
        return rows.get(0);
    }

    /**
     * Movements of an item in the order they were applied.
     */
    @Transactional(readOnly = true)
    public List<StockMovement> getMovements(String tenantId, UUID itemId) {
        return jdbcTemplate.query(
            "SELECT id, tenant_id, item_id, source, source_id, delta, resulting_quantity, sequence_number, created_at " +
            "FROM stock_movements WHERE tenant_id = ? AND item_id = ? ORDER BY sequence_number",
            movementRowMapper(),
            tenantId,
            itemId
        );
    }

    /**
     * Movements written for one source document, e.g. every line of a sale.
     */
    @Transactional(readOnly = true)
    public List<StockMovement> getMovementsForSource(String tenantId, UUID sourceId) {
        return jdbcTemplate.query(
            "SELECT id, tenant_id, item_id, source, source_id, delta, resulting_quantity, sequence_number, created_at " +
            "FROM stock_movements WHERE tenant_id = ? AND source_id = ? ORDER BY sequence_number",
            movementRowMapper(),
            tenantId,
            sourceId
        );
    }

    private RuntimeException insufficientOrMissing(String tenantId, UUID itemId, BigDecimal requested) {
        return jdbcTemplate.query(
                "SELECT name, quantity FROM items WHERE id = ? AND tenant_id = ?",
                (rs, rowNum) -> (RuntimeException) new InsufficientStockException(
                    itemId, rs.getString("name"), rs.getBigDecimal("quantity"), requested),
                itemId,
                tenantId
            ).stream()
            .findFirst()
            .orElseGet(() -> new NotFoundException("Item", itemId));
    }

    private void recordMovement(String tenantId, UUID itemId, MovementSource source, UUID sourceId,
                                BigDecimal delta, BigDecimal resultingQuantity) {
        jdbcTemplate.update(
            "INSERT INTO stock_movements (tenant_id, item_id, source, source_id, delta, resulting_quantity) " +
            "VALUES (?, ?, ?, ?, ?, ?)",
            tenantId,
            itemId,
            source.name(),
            sourceId,
            delta,
            resultingQuantity
        );
    }

    private static BigDecimal requirePositive(BigDecimal quantity) {
        BigDecimal scaled = quantity != null ? scale(quantity) : null;
        if (scaled == null || scaled.signum() <= 0) {
            throw new ValidationException("Stock movement quantity must be greater than zero");
        }
        return scaled;
    }

    private static BigDecimal scale(BigDecimal quantity) {
        return quantity.setScale(UnitConverter.QUANTITY_SCALE, RoundingMode.HALF_UP);
    }

    private RowMapper<StockMovement> movementRowMapper() {
        return (rs, rowNum) -> {
            Timestamp createdAt = rs.getTimestamp("created_at");
            return new StockMovement(
                UUID.fromString(rs.getString("id")),
                rs.getString("tenant_id"),
                UUID.fromString(rs.getString("item_id")),
                MovementSource.valueOf(rs.getString("source")),
                UUID.fromString(rs.getString("source_id")),
                rs.getBigDecimal("delta"),
                rs.getBigDecimal("resulting_quantity"),
                rs.getLong("sequence_number"),
                createdAt != null ? createdAt.toInstant() : null
            );
        };
    }
}
