package com.flagship.retail_ledger.purchase;

import com.flagship.retail_ledger.balance.BalanceEntryType;
import com.flagship.retail_ledger.balance.BalanceLedger;
import com.flagship.retail_ledger.balance.FloorPolicy;
import com.flagship.retail_ledger.catalog.CatalogService;
import com.flagship.retail_ledger.catalog.CounterpartyKind;
import com.flagship.retail_ledger.catalog.Item;
import com.flagship.retail_ledger.common.PaymentType;
import com.flagship.retail_ledger.event.PurchaseCreatedEvent;
import com.flagship.retail_ledger.exception.NotFoundException;
import com.flagship.retail_ledger.exception.ValidationException;
import com.flagship.retail_ledger.outbox.OutboxService;
import com.flagship.retail_ledger.pricing.PricingResolver;
import com.flagship.retail_ledger.stock.MovementSource;
import com.flagship.retail_ledger.stock.StockLedger;
import com.flagship.retail_ledger.unit.UnitConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Records goods received from a supplier: stock goes up, the unpaid remainder is added to what
 * the shop owes the supplier.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PurchaseService {

    private final CatalogService catalogService;
    private final StockLedger stockLedger;
    private final BalanceLedger balanceLedger;
    private final PurchaseRepository purchaseRepository;
    private final PurchaseLineRepository purchaseLineRepository;
    private final OutboxService outboxService;

    @Transactional
    public Purchase createPurchase(CreatePurchaseCommand command) {
        validate(command);
        String tenantId = command.getTenantId();
        catalogService.getCounterparty(tenantId, CounterpartyKind.SUPPLIER, command.getSupplierId());

        UUID purchaseId = UUID.randomUUID();
        List<PurchaseLine> lines = costLines(purchaseId, command);

        BigDecimal total = lines.stream()
            .map(PurchaseLine::getSubtotal)
            .reduce(BigDecimal.ZERO, BigDecimal::add)
            .setScale(PricingResolver.MONEY_SCALE, RoundingMode.HALF_UP);
        BigDecimal paid = paidAmount(command.getPaymentType(), command.getPaidAmount(), total);

        lines.stream()
            .sorted(Comparator.comparing(PurchaseLine::getItemId).thenComparing(PurchaseLine::getLineNumber))
            .forEach(line -> stockLedger.increase(
                tenantId, line.getItemId(), line.getQuantity(), MovementSource.PURCHASE, purchaseId));

        BigDecimal unpaid = total.subtract(paid);
        if (unpaid.signum() > 0) {
            balanceLedger.applyDelta(tenantId, CounterpartyKind.SUPPLIER, command.getSupplierId(), unpaid,
                BalanceEntryType.CREDIT_PURCHASE, purchaseId, FloorPolicy.ENFORCE_FLOOR);
        }

        Purchase purchase = new Purchase(purchaseId, tenantId, command.getSupplierId(), lines, total, paid,
            command.getPaymentType(), command.getPaymentMethod(), command.getUserId(), null);

        PurchaseEntity saved = purchaseRepository.save(PurchaseEntity.fromDomain(purchase));
        purchaseLineRepository.saveAll(lines.stream()
            .map(line -> PurchaseLineEntity.fromDomain(line, tenantId))
            .toList());

        Purchase created = saved.toDomain(lines);
        outboxService.saveEvent(PurchaseCreatedEvent.fromPurchase(created));

        log.info("Purchase created: purchaseId={}, lines={}, total={}, paid={}, supplierId={}",
                purchaseId, lines.size(), total, paid, command.getSupplierId());
        return created;
    }

    @Transactional(readOnly = true)
    public Purchase getPurchase(String tenantId, UUID purchaseId) {
        PurchaseEntity entity = purchaseRepository.findByIdAndTenantId(purchaseId, tenantId)
            .orElseThrow(() -> new NotFoundException("Purchase", purchaseId));
        List<PurchaseLine> lines = purchaseLineRepository
            .findByPurchaseIdAndTenantIdOrderByLineNumberAsc(purchaseId, tenantId)
            .stream()
            .map(PurchaseLineEntity::toDomain)
            .toList();
        return entity.toDomain(lines);
    }

    private List<PurchaseLine> costLines(UUID purchaseId, CreatePurchaseCommand command) {
        List<PurchaseLine> lines = new ArrayList<>();
        int lineNumber = 1;
        for (PurchaseLineCommand line : command.getLines()) {
            if (line == null || line.getItemId() == null) {
                throw new ValidationException("Line " + lineNumber + ": item id is required");
            }
            Item item = catalogService.getItem(command.getTenantId(), line.getItemId());

            BigDecimal quantity = UnitConverter.resolveLineQuantity(
                line.getQuantity(), line.getCartons(), line.getPieces(), item.getPiecesPerUnit());
            if (quantity.signum() <= 0) {
                throw new ValidationException("Line " + lineNumber + ": quantity must be greater than zero");
            }

            BigDecimal unitCost = line.getUnitCost() != null ? line.getUnitCost() : item.getCostPrice();
            if (unitCost == null || unitCost.signum() < 0) {
                throw new ValidationException("Line " + lineNumber + ": unit cost must not be negative");
            }
            unitCost = unitCost.setScale(PricingResolver.MONEY_SCALE, RoundingMode.HALF_UP);
            BigDecimal subtotal = unitCost.multiply(quantity).setScale(PricingResolver.MONEY_SCALE, RoundingMode.HALF_UP);

            lines.add(new PurchaseLine(UUID.randomUUID(), purchaseId, item.getId(), lineNumber, quantity, unitCost, subtotal));
            lineNumber++;
        }
        return lines;
    }

    private static BigDecimal paidAmount(PaymentType paymentType, BigDecimal paidAmount, BigDecimal total) {
        if (paymentType == PaymentType.CASH) {
            return total;
        }
        BigDecimal tendered = paidAmount != null ? paidAmount : BigDecimal.ZERO;
        return tendered.max(BigDecimal.ZERO).min(total).setScale(PricingResolver.MONEY_SCALE, RoundingMode.HALF_UP);
    }

    private void validate(CreatePurchaseCommand command) {
        if (command.getTenantId() == null || command.getTenantId().isBlank()) {
            throw new ValidationException("Tenant id is required");
        }
        if (command.getUserId() == null || command.getUserId().isBlank()) {
            throw new ValidationException("User id is required");
        }
        if (command.getSupplierId() == null) {
            throw new ValidationException("A purchase needs a supplier");
        }
        if (command.getLines() == null || command.getLines().isEmpty()) {
            throw new ValidationException("A purchase needs at least one line");
        }
        if (command.getPaymentType() == null) {
            throw new ValidationException("Payment type is required");
        }
        if (command.getPaymentMethod() == null) {
            throw new ValidationException("Payment method is required");
        }
    }
}
