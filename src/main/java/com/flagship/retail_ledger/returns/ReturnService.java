package com.flagship.retail_ledger.returns;

import com.flagship.retail_ledger.balance.BalanceEntryType;
import com.flagship.retail_ledger.balance.BalanceLedger;
import com.flagship.retail_ledger.balance.FloorPolicy;
import com.flagship.retail_ledger.catalog.CounterpartyKind;
import com.flagship.retail_ledger.config.LedgerProperties;
import com.flagship.retail_ledger.event.ReturnProcessedEvent;
import com.flagship.retail_ledger.exception.NotFoundException;
import com.flagship.retail_ledger.exception.ReturnExceedsOriginalException;
import com.flagship.retail_ledger.exception.ValidationException;
import com.flagship.retail_ledger.outbox.OutboxService;
import com.flagship.retail_ledger.pricing.PricingResolver;
import com.flagship.retail_ledger.purchase.PurchaseEntity;
import com.flagship.retail_ledger.purchase.PurchaseLineEntity;
import com.flagship.retail_ledger.purchase.PurchaseLineRepository;
import com.flagship.retail_ledger.purchase.PurchaseRepository;
import com.flagship.retail_ledger.sale.SaleEntity;
import com.flagship.retail_ledger.sale.SaleLineEntity;
import com.flagship.retail_ledger.sale.SaleLineRepository;
import com.flagship.retail_ledger.sale.SaleRepository;
import com.flagship.retail_ledger.stock.MovementSource;
import com.flagship.retail_ledger.stock.StockLedger;
import com.flagship.retail_ledger.unit.UnitConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.UUID;
import java.util.function.Function;

/**
 * Customer and supplier returns against a recorded sale or purchase line.
 *
 * The original line is locked (PESSIMISTIC_WRITE) before the remaining returnable quantity is
 * computed, so two returns racing on the same line cannot together exceed it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReturnService {

    private final SaleRepository saleRepository;
    private final SaleLineRepository saleLineRepository;
    private final PurchaseRepository purchaseRepository;
    private final PurchaseLineRepository purchaseLineRepository;
    private final CustomerReturnRepository customerReturnRepository;
    private final SupplierReturnRepository supplierReturnRepository;
    private final StockLedger stockLedger;
    private final BalanceLedger balanceLedger;
    private final OutboxService outboxService;
    private final LedgerProperties ledgerProperties;

    /**
     * Takes goods back into stock. CREDIT reduces the customer balance by {@code amount}; CASH and
     * EXCHANGE leave it alone.
     *
     * @throws ReturnExceedsOriginalException if more than the remaining line quantity is returned
     * @throws ValidationException            for CREDIT on a walk-in sale or an ambiguous line
     */
    @Transactional
    public CustomerReturn processCustomerReturn(CustomerReturnCommand command) {
        BigDecimal quantity = validQuantity(command.getQuantity());
        BigDecimal amount = validAmount(command.getAmount());
        requireType(command.getType());
        if (command.getSaleId() == null) {
            throw new ValidationException("Sale id is required");
        }
        String tenantId = command.getTenantId();

        SaleEntity sale = saleRepository.findByIdAndTenantId(command.getSaleId(), tenantId)
            .orElseThrow(() -> new NotFoundException("Sale", command.getSaleId()));
        if (command.getType() == ReturnType.CREDIT && sale.getCustomerId() == null) {
            throw new ValidationException("A walk-in sale cannot be returned for credit");
        }

        UUID lineId = resolveLineId(command.getLineId(), command.getItemId(),
            itemId -> saleLineRepository.findBySaleIdAndTenantIdAndItemId(sale.getId(), tenantId, itemId)
                .stream().map(SaleLineEntity::getId).toList(),
            "Sale");
        SaleLineEntity line = saleLineRepository.findForUpdate(lineId, sale.getId(), tenantId)
            .orElseThrow(() -> new NotFoundException("Sale line", lineId));
        requireMatchingItem(command.getItemId(), line.getItemId());

        BigDecimal returned = customerReturnRepository.sumQuantityBySaleLineId(line.getId());
        checkRemaining(line.getId(), line.getQuantity(), returned, quantity);

        UUID returnId = UUID.randomUUID();
        stockLedger.increase(tenantId, line.getItemId(), quantity, MovementSource.CUSTOMER_RETURN, returnId);

        if (command.getType() == ReturnType.CREDIT) {
            balanceLedger.applyDelta(tenantId, CounterpartyKind.CUSTOMER, sale.getCustomerId(), amount.negate(),
                BalanceEntryType.RETURN_CREDIT, returnId, returnCreditPolicy());
        }

        CustomerReturn customerReturn = new CustomerReturn(returnId, tenantId, sale.getId(), line.getId(),
            line.getItemId(), quantity, command.getType(), amount, command.getReason(), command.getUserId(), null);
        CustomerReturn saved = customerReturnRepository.save(CustomerReturnEntity.fromDomain(customerReturn)).toDomain();
        outboxService.saveEvent(ReturnProcessedEvent.fromCustomerReturn(saved));

        log.info("Customer return processed: returnId={}, saleId={}, lineId={}, quantity={}, type={}, amount={}",
                returnId, sale.getId(), line.getId(), quantity, command.getType(), amount);
        return saved;
    }

    /**
     * Sends goods back to the supplier. Stock must cover the quantity. CREDIT reduces what the
     * shop owes the supplier.
     */
    @Transactional
    public SupplierReturn processSupplierReturn(SupplierReturnCommand command) {
        BigDecimal quantity = validQuantity(command.getQuantity());
        BigDecimal amount = validAmount(command.getAmount());
        requireType(command.getType());
        if (command.getPurchaseId() == null) {
            throw new ValidationException("Purchase id is required");
        }
        String tenantId = command.getTenantId();

        PurchaseEntity purchase = purchaseRepository.findByIdAndTenantId(command.getPurchaseId(), tenantId)
            .orElseThrow(() -> new NotFoundException("Purchase", command.getPurchaseId()));

        UUID lineId = resolveLineId(command.getLineId(), command.getItemId(),
            itemId -> purchaseLineRepository.findByPurchaseIdAndTenantIdAndItemId(purchase.getId(), tenantId, itemId)
                .stream().map(PurchaseLineEntity::getId).toList(),
            "Purchase");
        PurchaseLineEntity line = purchaseLineRepository.findForUpdate(lineId, purchase.getId(), tenantId)
            .orElseThrow(() -> new NotFoundException("Purchase line", lineId));
        requireMatchingItem(command.getItemId(), line.getItemId());

        BigDecimal returned = supplierReturnRepository.sumQuantityByPurchaseLineId(line.getId());
        checkRemaining(line.getId(), line.getQuantity(), returned, quantity);

        UUID returnId = UUID.randomUUID();
        stockLedger.decrease(tenantId, line.getItemId(), quantity, MovementSource.SUPPLIER_RETURN, returnId);

        if (command.getType() == ReturnType.CREDIT) {
            balanceLedger.applyDelta(tenantId, CounterpartyKind.SUPPLIER, purchase.getSupplierId(), amount.negate(),
                BalanceEntryType.RETURN_CREDIT, returnId, returnCreditPolicy());
        }

        SupplierReturn supplierReturn = new SupplierReturn(returnId, tenantId, purchase.getId(), line.getId(),
            line.getItemId(), quantity, command.getType(), amount, command.getReason(), command.getUserId(), null);
        SupplierReturn saved = supplierReturnRepository.save(SupplierReturnEntity.fromDomain(supplierReturn)).toDomain();
        outboxService.saveEvent(ReturnProcessedEvent.fromSupplierReturn(saved));

        log.info("Supplier return processed: returnId={}, purchaseId={}, lineId={}, quantity={}, type={}, amount={}",
                returnId, purchase.getId(), line.getId(), quantity, command.getType(), amount);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<ReturnableLine> getReturnableSaleLines(String tenantId, UUID saleId) {
        saleRepository.findByIdAndTenantId(saleId, tenantId)
            .orElseThrow(() -> new NotFoundException("Sale", saleId));
        return saleLineRepository.findBySaleIdAndTenantIdOrderByLineNumberAsc(saleId, tenantId).stream()
            .map(line -> new ReturnableLine(line.getId(), line.getItemId(), line.getLineNumber(), line.getQuantity(),
                customerReturnRepository.sumQuantityBySaleLineId(line.getId())))
            .toList();
    }

    @Transactional(readOnly = true)
    public List<ReturnableLine> getReturnablePurchaseLines(String tenantId, UUID purchaseId) {
        purchaseRepository.findByIdAndTenantId(purchaseId, tenantId)
            .orElseThrow(() -> new NotFoundException("Purchase", purchaseId));
        return purchaseLineRepository.findByPurchaseIdAndTenantIdOrderByLineNumberAsc(purchaseId, tenantId).stream()
            .map(line -> new ReturnableLine(line.getId(), line.getItemId(), line.getLineNumber(), line.getQuantity(),
                supplierReturnRepository.sumQuantityByPurchaseLineId(line.getId())))
            .toList();
    }

    @Transactional(readOnly = true)
    public List<CustomerReturn> getCustomerReturns(String tenantId, UUID saleId) {
        return customerReturnRepository.findBySaleIdAndTenantIdOrderByCreatedAtAsc(saleId, tenantId).stream()
            .map(CustomerReturnEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<SupplierReturn> getSupplierReturns(String tenantId, UUID purchaseId) {
        return supplierReturnRepository.findByPurchaseIdAndTenantIdOrderByCreatedAtAsc(purchaseId, tenantId).stream()
            .map(SupplierReturnEntity::toDomain)
            .toList();
    }

    private FloorPolicy returnCreditPolicy() {
        return ledgerProperties.isAllowNegativeReturnCredit() ? FloorPolicy.ALLOW_NEGATIVE : FloorPolicy.ENFORCE_FLOOR;
    }

    private static UUID resolveLineId(UUID lineId, UUID itemId, Function<UUID, List<UUID>> linesForItem,
                                      String document) {
        if (lineId != null) {
            return lineId;
        }
        if (itemId == null) {
            throw new ValidationException("Either a line id or an item id is required");
        }
        List<UUID> matches = linesForItem.apply(itemId);
        if (matches.isEmpty()) {
            throw new NotFoundException(document + " line for item", itemId);
        }
        if (matches.size() > 1) {
            throw new ValidationException(document + " has " + matches.size()
                + " lines for item " + itemId + "; give the line id");
        }
        return matches.get(0);
    }

    private static void requireMatchingItem(UUID requestedItemId, UUID lineItemId) {
        if (requestedItemId != null && !requestedItemId.equals(lineItemId)) {
            throw new ValidationException("Item " + requestedItemId + " does not match the selected line");
        }
    }

    private static void checkRemaining(UUID lineId, BigDecimal lineQuantity, BigDecimal alreadyReturned,
                                       BigDecimal requested) {
        BigDecimal remaining = lineQuantity.subtract(alreadyReturned != null ? alreadyReturned : BigDecimal.ZERO);
        if (requested.compareTo(remaining) > 0) {
            throw new ReturnExceedsOriginalException(lineId, requested, remaining);
        }
    }

    private static BigDecimal validQuantity(BigDecimal quantity) {
        if (quantity == null || quantity.signum() <= 0) {
            throw new ValidationException("Return quantity must be greater than zero");
        }
        return quantity.setScale(UnitConverter.QUANTITY_SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal validAmount(BigDecimal amount) {
        BigDecimal value = amount != null ? amount : BigDecimal.ZERO;
        if (value.signum() < 0) {
            throw new ValidationException("Return amount must not be negative");
        }
        return value.setScale(PricingResolver.MONEY_SCALE, RoundingMode.HALF_UP);
    }

    private static void requireType(ReturnType type) {
        if (type == null) {
            throw new ValidationException("Return type is required");
        }
    }
}
