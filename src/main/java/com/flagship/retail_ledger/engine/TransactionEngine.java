package com.flagship.retail_ledger.engine;

import com.flagship.retail_ledger.balance.BalanceOverride;
import com.flagship.retail_ledger.balance.BalanceOverrideService;
import com.flagship.retail_ledger.balance.OverrideBalanceCommand;
import com.flagship.retail_ledger.catalog.CatalogService;
import com.flagship.retail_ledger.catalog.CounterpartyKind;
import com.flagship.retail_ledger.catalog.Item;
import com.flagship.retail_ledger.config.LedgerProperties;
import com.flagship.retail_ledger.exception.ConcurrencyConflictException;
import com.flagship.retail_ledger.exception.LedgerException;
import com.flagship.retail_ledger.exception.ValidationException;
import com.flagship.retail_ledger.idempotency.IdempotentResult;
import com.flagship.retail_ledger.observability.CorrelationContext;
import com.flagship.retail_ledger.observability.LedgerMetrics;
import com.flagship.retail_ledger.payment.Payment;
import com.flagship.retail_ledger.payment.PaymentService;
import com.flagship.retail_ledger.payment.RecordPaymentCommand;
import com.flagship.retail_ledger.purchase.CreatePurchaseCommand;
import com.flagship.retail_ledger.purchase.Purchase;
import com.flagship.retail_ledger.purchase.PurchaseService;
import com.flagship.retail_ledger.returns.CustomerReturn;
import com.flagship.retail_ledger.returns.CustomerReturnCommand;
import com.flagship.retail_ledger.returns.ReturnService;
import com.flagship.retail_ledger.returns.SupplierReturn;
import com.flagship.retail_ledger.returns.SupplierReturnCommand;
import com.flagship.retail_ledger.sale.CreateSaleCommand;
import com.flagship.retail_ledger.sale.Sale;
import com.flagship.retail_ledger.sale.SaleService;
import com.flagship.retail_ledger.stock.AdjustStockCommand;
import com.flagship.retail_ledger.stock.StockAdjustment;
import com.flagship.retail_ledger.stock.StockAdjustmentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Entry point for every ledger write.
 *
 * Each single operation delegates to a {@code @Transactional} service, so it commits or rolls back
 * as one unit. This facade itself is not transactional: it sets the MDC context, records metrics,
 * turns lock and serialization failures into {@link ConcurrencyConflictException}, and runs each
 * bulk row in its own transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionEngine {

    static final String DEFAULT_BULK_STOCK_REASON = "Bulk adjustment";
    static final String DEFAULT_BULK_BALANCE_REASON = "Bulk balance adjustment";

    private final SaleService saleService;
    private final PurchaseService purchaseService;
    private final ReturnService returnService;
    private final PaymentService paymentService;
    private final StockAdjustmentService stockAdjustmentService;
    private final BalanceOverrideService balanceOverrideService;
    private final CatalogService catalogService;
    private final LedgerProperties ledgerProperties;
    private final LedgerMetrics ledgerMetrics;

    public Sale createSale(CreateSaleCommand command) {
        return execute("create_sale", command.getTenantId(), () -> saleService.createSale(command));
    }

    public Purchase createPurchase(CreatePurchaseCommand command) {
        return execute("create_purchase", command.getTenantId(), () -> purchaseService.createPurchase(command));
    }

    public CustomerReturn processCustomerReturn(CustomerReturnCommand command) {
        return execute("customer_return", command.getTenantId(),
            () -> returnService.processCustomerReturn(command));
    }

    public SupplierReturn processSupplierReturn(SupplierReturnCommand command) {
        return execute("supplier_return", command.getTenantId(),
            () -> returnService.processSupplierReturn(command));
    }

    /**
     * Records a payment. When two requests race on the same idempotency key, the loser's insert
     * hits the unique constraint and it returns the winner's payment as a replay.
     */
    public IdempotentResult<Payment> recordPayment(RecordPaymentCommand command) {
        return execute("record_payment", command.getTenantId(), () -> {
            try {
                return paymentService.recordPayment(command);
            } catch (DataIntegrityViolationException e) {
                if (command.getIdempotencyKey() == null) {
                    throw e;
                }
                Optional<Payment> existing = paymentService.findByIdempotencyKey(
                    command.getTenantId(), command.getIdempotencyKey());
                if (existing.isEmpty()) {
                    throw e;
                }
                log.info("Lost idempotency race, returning committed payment: paymentId={}",
                        existing.get().getId());
                return IdempotentResult.replayed(existing.get());
            }
        });
    }

    public IdempotentResult<StockAdjustment> adjustStock(AdjustStockCommand command) {
        return execute("adjust_stock", command.getTenantId(), () -> adjustStockOnce(command));
    }

    public BalanceOverride overrideBalance(OverrideBalanceCommand command) {
        return execute("override_balance", command.getTenantId(), () -> balanceOverrideService.override(command));
    }

    /**
     * Applies up to {@code ledger.bulk-max-rows} stock adjustments. Row N uses the idempotency key
     * {@code idempotencyKey + ":row" + N}, so resubmitting the same request re-applies nothing that
     * already committed; replayed rows count as updated.
     */
    public BulkResult bulkAdjustStock(String tenantId, String userId, String idempotencyKey, List<BulkStockRow> rows) {
        return execute("bulk_adjust_stock", tenantId, () -> {
            checkBulkSize(rows);
            if (idempotencyKey == null || idempotencyKey.isBlank()) {
                throw new ValidationException("Idempotency key is required for stock adjustments");
            }

            BulkCollector collector = new BulkCollector();
            for (int i = 0; i < rows.size(); i++) {
                int rowNum = i + 1;
                BulkStockRow row = rows.get(i);
                String label = row.getName() != null ? row.getName() : String.valueOf(row.getItemId());

                Optional<Item> item = resolveItem(tenantId, row);
                if (item.isEmpty()) {
                    collector.skip(rowNum, row.getItemId() == null && (row.getName() == null || row.getName().isBlank())
                        ? "item id or name is required"
                        : "item \"" + label + "\" not found");
                    continue;
                }

                AdjustStockCommand command = AdjustStockCommand.builder()
                    .tenantId(tenantId)
                    .userId(userId)
                    .itemId(item.get().getId())
                    .type(row.getType())
                    .quantity(row.getQuantity())
                    .reason(row.getReason() != null && !row.getReason().isBlank()
                        ? row.getReason() : DEFAULT_BULK_STOCK_REASON)
                    .idempotencyKey(idempotencyKey + ":row" + rowNum)
                    .build();
                try {
                    adjustStockOnce(command);
                    collector.update();
                } catch (LedgerException e) {
                    collector.skip(rowNum, "(" + item.get().getName() + ") " + e.getMessage());
                } catch (ConcurrencyFailureException e) {
                    collector.skip(rowNum, "(" + item.get().getName() + ") concurrent modification, retry the row");
                }
            }

            ledgerMetrics.recordBulkRows("bulk_adjust_stock", collector.updated, collector.skipped);
            log.info("Bulk stock adjustment finished: rows={}, updated={}, skipped={}",
                    rows.size(), collector.updated, collector.skipped);
            return collector.result();
        });
    }

    /**
     * Sets absolute balances for up to {@code ledger.bulk-max-rows} counterparties of one kind.
     * Every row is an audited override in its own transaction.
     */
    public BulkResult bulkOverrideBalances(String tenantId, String userId, CounterpartyKind kind,
                                           List<BulkBalanceRow> rows) {
        return execute("bulk_override_balance", tenantId, () -> {
            checkBulkSize(rows);
            if (kind == null) {
                throw new ValidationException("Counterparty kind is required");
            }

            BulkCollector collector = new BulkCollector();
            for (int i = 0; i < rows.size(); i++) {
                int rowNum = i + 1;
                BulkBalanceRow row = rows.get(i);
                if (row.getCounterpartyId() == null) {
                    collector.skip(rowNum, kind.displayName().toLowerCase() + " id required");
                    continue;
                }
                if (row.getBalance() == null || row.getBalance().signum() < 0) {
                    collector.skip(rowNum, "invalid balance");
                    continue;
                }

                OverrideBalanceCommand command = OverrideBalanceCommand.builder()
                    .tenantId(tenantId)
                    .userId(userId)
                    .kind(kind)
                    .counterpartyId(row.getCounterpartyId())
                    .newBalance(row.getBalance())
                    .reason(row.getReason() != null && !row.getReason().isBlank()
                        ? row.getReason() : DEFAULT_BULK_BALANCE_REASON)
                    .build();
                try {
                    balanceOverrideService.override(command);
                    collector.update();
                } catch (LedgerException e) {
                    collector.skip(rowNum, e.getMessage());
                } catch (ConcurrencyFailureException e) {
                    collector.skip(rowNum, "concurrent modification, retry the row");
                }
            }

            ledgerMetrics.recordBulkRows("bulk_override_balance", collector.updated, collector.skipped);
            log.info("Bulk balance override finished: kind={}, rows={}, updated={}, skipped={}",
                    kind, rows.size(), collector.updated, collector.skipped);
            return collector.result();
        });
    }

    private IdempotentResult<StockAdjustment> adjustStockOnce(AdjustStockCommand command) {
        try {
            return stockAdjustmentService.adjust(command);
        } catch (DataIntegrityViolationException e) {
            Optional<StockAdjustment> existing = stockAdjustmentService.findByIdempotencyKey(
                command.getTenantId(), command.getIdempotencyKey());
            if (existing.isEmpty()) {
                throw e;
            }
            log.info("Lost idempotency race, returning committed adjustment: adjustmentId={}",
                    existing.get().getId());
            return IdempotentResult.replayed(existing.get());
        }
    }

    private Optional<Item> resolveItem(String tenantId, BulkStockRow row) {
        if (row.getItemId() != null) {
            return catalogService.findItem(tenantId, row.getItemId());
        }
        if (row.getName() == null || row.getName().isBlank()) {
            return Optional.empty();
        }
        return catalogService.findItemByName(tenantId, row.getName().trim());
    }

    private void checkBulkSize(List<?> rows) {
        if (rows == null || rows.isEmpty()) {
            throw new ValidationException("At least one row is required");
        }
        if (rows.size() > ledgerProperties.getBulkMaxRows()) {
            throw new ValidationException("Maximum " + ledgerProperties.getBulkMaxRows() + " rows per request");
        }
    }

    private <T> T execute(String operation, String tenantId, Supplier<T> action) {
        long startTime = System.nanoTime();
        MDC.put(CorrelationContext.OPERATION_MDC_KEY, operation);
        if (tenantId != null) {
            MDC.put(CorrelationContext.TENANT_ID_MDC_KEY, tenantId);
        }
        try {
            T result = action.get();
            if (result instanceof IdempotentResult<?> idempotent && idempotent.isReplayed()) {
                ledgerMetrics.recordReplay(operation, elapsed(startTime));
            } else {
                if (result instanceof IdempotentResult<?>) {
                    ledgerMetrics.recordIdempotencyMiss();
                }
                ledgerMetrics.recordSuccess(operation, elapsed(startTime));
            }
            return result;
        } catch (LedgerException e) {
            ledgerMetrics.recordFailure(operation, e.getKind(), elapsed(startTime));
            log.warn("Operation rejected: kind={}, message={}", e.getKind(), e.getMessage());
            throw e;
        } catch (ConcurrencyFailureException e) {
            ConcurrencyConflictException conflict = new ConcurrencyConflictException(operation, e);
            ledgerMetrics.recordFailure(operation, conflict.getKind(), elapsed(startTime));
            log.warn("Concurrency conflict: {}", e.getMessage());
            throw conflict;
        } catch (RuntimeException e) {
            ledgerMetrics.recordUnexpectedFailure(operation, elapsed(startTime));
            log.error("Operation failed unexpectedly", e);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.OPERATION_MDC_KEY);
            MDC.remove(CorrelationContext.TENANT_ID_MDC_KEY);
        }
    }

    private static Duration elapsed(long startTime) {
        return Duration.ofNanos(System.nanoTime() - startTime);
    }

    private static final class BulkCollector {
        private int updated;
        private int skipped;
        private final List<String> errors = new ArrayList<>();

        void update() {
            updated++;
        }

        void skip(int rowNum, String message) {
            skipped++;
            errors.add("Row " + rowNum + ": " + message);
        }

        BulkResult result() {
            return new BulkResult(updated, skipped, List.copyOf(errors));
        }
    }
}
