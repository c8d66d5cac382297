package com.flagship.retail_ledger.catalog;

import com.flagship.retail_ledger.exception.NotFoundException;
import com.flagship.retail_ledger.exception.ValidationException;
import com.flagship.retail_ledger.unit.UnitConverter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Tenant-scoped reads of items, customers and suppliers.
 *
 * Catalog maintenance belongs to another part of the back office; the create methods here exist
 * for seeding and tests. Rows of another tenant are invisible and surface as not found.
 */
@Service
public class CatalogService {

    private static final String ITEM_COLUMNS =
        "id, tenant_id, name, quantity, cost_price, selling_price, retail_price, wholesale_price, " +
        "promo_price, unit_name, pieces_per_unit";

    private final JdbcTemplate jdbcTemplate;

    public CatalogService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<Item> findItem(String tenantId, UUID itemId) {
        List<Item> items = jdbcTemplate.query(
            "SELECT " + ITEM_COLUMNS + " FROM items WHERE id = ? AND tenant_id = ?",
            itemRowMapper(),
            itemId,
            tenantId
        );
        return items.stream().findFirst();
    }

    /**
     * @throws NotFoundException if the item does not exist in this tenant
     */
    public Item getItem(String tenantId, UUID itemId) {
        return findItem(tenantId, itemId)
            .orElseThrow(() -> new NotFoundException("Item", itemId));
    }

    /**
     * Case-insensitive lookup by name, used by bulk adjustments keyed on item names.
     */
    public Optional<Item> findItemByName(String tenantId, String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        List<Item> items = jdbcTemplate.query(
            "SELECT " + ITEM_COLUMNS + " FROM items WHERE tenant_id = ? AND LOWER(name) = LOWER(?) " +
            "ORDER BY created_at LIMIT 1",
            itemRowMapper(),
            tenantId,
            name.trim()
        );
        return items.stream().findFirst();
    }

    public Optional<Counterparty> findCounterparty(String tenantId, CounterpartyKind kind, UUID id) {
        List<Counterparty> rows = jdbcTemplate.query(
            "SELECT id, tenant_id, name, balance FROM " + kind.tableName() + " WHERE id = ? AND tenant_id = ?",
            (rs, rowNum) -> new Counterparty(
                UUID.fromString(rs.getString("id")),
                rs.getString("tenant_id"),
                kind,
                rs.getString("name"),
                rs.getBigDecimal("balance")
            ),
            id,
            tenantId
        );
        return rows.stream().findFirst();
    }

    /**
     * @throws NotFoundException if the counterparty does not exist in this tenant
     */
    public Counterparty getCounterparty(String tenantId, CounterpartyKind kind, UUID id) {
        return findCounterparty(tenantId, kind, id)
            .orElseThrow(() -> new NotFoundException(kind.displayName(), id));
    }

    public UUID createItem(String tenantId, NewItem item) {
        if (item.getSellingPrice() == null) {
            throw new ValidationException("Selling price is required");
        }
        if (item.getPiecesPerUnit() < 1 || item.getPiecesPerUnit() > UnitConverter.MAX_PIECES_PER_UNIT) {
            throw new ValidationException("piecesPerUnit must be between 1 and " + UnitConverter.MAX_PIECES_PER_UNIT);
        }
        UUID itemId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO items (id, tenant_id, name, quantity, cost_price, selling_price, retail_price, " +
            "wholesale_price, promo_price, unit_name, pieces_per_unit) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            itemId,
            tenantId,
            item.getName(),
            item.getQuantity(),
            item.getCostPrice(),
            item.getSellingPrice(),
            item.getRetailPrice(),
            item.getWholesalePrice(),
            item.getPromoPrice(),
            item.getUnitName(),
            item.getPiecesPerUnit()
        );
        return itemId;
    }

    public UUID createCustomer(String tenantId, String name, BigDecimal openingBalance) {
        return createCounterparty(tenantId, CounterpartyKind.CUSTOMER, name, openingBalance);
    }

    public UUID createSupplier(String tenantId, String name, BigDecimal openingBalance) {
        return createCounterparty(tenantId, CounterpartyKind.SUPPLIER, name, openingBalance);
    }

    private UUID createCounterparty(String tenantId, CounterpartyKind kind, String name, BigDecimal openingBalance) {
        UUID id = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO " + kind.tableName() + " (id, tenant_id, name, balance) VALUES (?, ?, ?, ?)",
            id,
            tenantId,
            name,
            openingBalance != null ? openingBalance : BigDecimal.ZERO
        );
        return id;
    }

    private RowMapper<Item> itemRowMapper() {
        return (rs, rowNum) -> new Item(
            UUID.fromString(rs.getString("id")),
            rs.getString("tenant_id"),
            rs.getString("name"),
            rs.getBigDecimal("quantity"),
            rs.getBigDecimal("cost_price"),
            rs.getBigDecimal("selling_price"),
            rs.getBigDecimal("retail_price"),
            rs.getBigDecimal("wholesale_price"),
            rs.getBigDecimal("promo_price"),
            rs.getString("unit_name"),
            rs.getInt("pieces_per_unit")
        );
    }
}
