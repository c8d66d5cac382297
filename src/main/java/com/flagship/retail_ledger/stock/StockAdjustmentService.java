package com.flagship.retail_ledger.stock;

import com.flagship.retail_ledger.catalog.CatalogService;
import com.flagship.retail_ledger.event.StockAdjustedEvent;
import com.flagship.retail_ledger.exception.ValidationException;
import com.flagship.retail_ledger.idempotency.IdempotencyService;
import com.flagship.retail_ledger.idempotency.IdempotentResult;
import com.flagship.retail_ledger.outbox.OutboxService;
import com.flagship.retail_ledger.unit.UnitConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Manual stock corrections (damage, shrinkage, stock takes), each keyed by a caller-supplied
 * idempotency key. Replaying a committed key returns the stored adjustment without touching stock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StockAdjustmentService {

    static final String IDEMPOTENCY_SCOPE = "stock-adjustment";

    private final CatalogService catalogService;
    private final StockLedger stockLedger;
    private final StockAdjustmentRepository adjustmentRepository;
    private final IdempotencyService idempotencyService;
    private final OutboxService outboxService;

    /**
     * @throws com.flagship.retail_ledger.exception.InsufficientStockException if a DECREASE exceeds stock
     */
    @Transactional
    public IdempotentResult<StockAdjustment> adjust(AdjustStockCommand command) {
        validate(command);
        String tenantId = command.getTenantId();

        Optional<StockAdjustment> existing = findByIdempotencyKey(tenantId, command.getIdempotencyKey());
        if (existing.isPresent()) {
            log.info("Idempotency key already used, returning existing adjustment: adjustmentId={}",
                    existing.get().getId());
            return IdempotentResult.replayed(existing.get());
        }

        catalogService.getItem(tenantId, command.getItemId());

        UUID adjustmentId = UUID.randomUUID();
        BigDecimal quantity = command.getQuantity().setScale(UnitConverter.QUANTITY_SCALE, RoundingMode.HALF_UP);
        StockChange change = switch (command.getType()) {
            case INCREASE -> stockLedger.increase(tenantId, command.getItemId(), quantity,
                MovementSource.ADJUSTMENT, adjustmentId);
            case DECREASE -> stockLedger.decrease(tenantId, command.getItemId(), quantity,
                MovementSource.ADJUSTMENT, adjustmentId);
            case SET -> stockLedger.set(tenantId, command.getItemId(), quantity,
                MovementSource.ADJUSTMENT, adjustmentId);
        };

        StockAdjustment adjustment = new StockAdjustment(adjustmentId, tenantId, command.getItemId(),
            command.getType(), quantity, change.getPreviousQuantity(), change.getNewQuantity(),
            command.getReason().trim(), command.getUserId(), null);
        StockAdjustment saved = adjustmentRepository
            .save(StockAdjustmentEntity.fromDomain(adjustment, command.getIdempotencyKey()))
            .toDomain();
        outboxService.saveEvent(StockAdjustedEvent.fromAdjustment(saved));
        idempotencyService.remember(IDEMPOTENCY_SCOPE, tenantId, command.getIdempotencyKey(), adjustmentId);

        log.info("Stock adjusted: adjustmentId={}, itemId={}, type={}, quantity={}, from={}, to={}",
                adjustmentId, command.getItemId(), command.getType(), quantity,
                change.getPreviousQuantity(), change.getNewQuantity());
        return IdempotentResult.created(saved);
    }

    @Transactional(readOnly = true)
    public Optional<StockAdjustment> findByIdempotencyKey(String tenantId, String idempotencyKey) {
        Optional<UUID> adjustmentId = idempotencyService.lookup(IDEMPOTENCY_SCOPE, tenantId, idempotencyKey,
            () -> adjustmentRepository.findByTenantIdAndIdempotencyKey(tenantId, idempotencyKey)
                .map(StockAdjustmentEntity::getId));
        if (adjustmentId.isEmpty()) {
            return Optional.empty();
        }
        Optional<StockAdjustment> adjustment = adjustmentRepository.findByIdAndTenantId(adjustmentId.get(), tenantId)
            .map(StockAdjustmentEntity::toDomain);
        if (adjustment.isEmpty()) {
            idempotencyService.forget(IDEMPOTENCY_SCOPE, tenantId, idempotencyKey);
        }
        return adjustment;
    }

    @Transactional(readOnly = true)
    public List<StockAdjustment> getAdjustments(String tenantId, UUID itemId) {
        return adjustmentRepository.findByTenantIdAndItemIdOrderByCreatedAtAsc(tenantId, itemId).stream()
            .map(StockAdjustmentEntity::toDomain)
            .toList();
    }

    private void validate(AdjustStockCommand command) {
        if (command.getTenantId() == null || command.getTenantId().isBlank()) {
            throw new ValidationException("Tenant id is required");
        }
        if (command.getUserId() == null || command.getUserId().isBlank()) {
            throw new ValidationException("User id is required");
        }
        if (command.getIdempotencyKey() == null || command.getIdempotencyKey().isBlank()) {
            throw new ValidationException("Idempotency key is required for stock adjustments");
        }
        if (command.getItemId() == null) {
            throw new ValidationException("Item id is required");
        }
        if (command.getType() == null) {
            throw new ValidationException("Adjustment type is required");
        }
        if (command.getReason() == null || command.getReason().isBlank()) {
            throw new ValidationException("A reason is required for stock adjustments");
        }
        BigDecimal quantity = command.getQuantity();
        if (quantity == null || quantity.signum() < 0) {
            throw new ValidationException("Quantity must be a non-negative number");
        }
        if (command.getType() != AdjustmentType.SET && quantity.signum() == 0) {
            throw new ValidationException("Quantity must be greater than zero for " + command.getType());
        }
    }
}
