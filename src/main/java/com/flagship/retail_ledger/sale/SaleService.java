package com.flagship.retail_ledger.sale;

import com.flagship.retail_ledger.balance.BalanceEntryType;
import com.flagship.retail_ledger.balance.BalanceLedger;
import com.flagship.retail_ledger.balance.FloorPolicy;
import com.flagship.retail_ledger.catalog.CatalogService;
import com.flagship.retail_ledger.catalog.CounterpartyKind;
import com.flagship.retail_ledger.catalog.Item;
import com.flagship.retail_ledger.common.PaymentType;
import com.flagship.retail_ledger.event.SaleCreatedEvent;
import com.flagship.retail_ledger.exception.NotFoundException;
import com.flagship.retail_ledger.exception.ValidationException;
import com.flagship.retail_ledger.outbox.OutboxService;
import com.flagship.retail_ledger.pricing.DiscountType;
import com.flagship.retail_ledger.pricing.LineAmount;
import com.flagship.retail_ledger.pricing.OrderDiscount;
import com.flagship.retail_ledger.pricing.PricingResolver;
import com.flagship.retail_ledger.pricing.ResolvedPrice;
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
 * Records a sale as one atomic unit: stock leaves the shelf, the unpaid remainder lands on the
 * customer's balance, and the sale with its lines is written. Any failure rolls back all of it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SaleService {

    private final CatalogService catalogService;
    private final PricingResolver pricingResolver;
    private final StockLedger stockLedger;
    private final BalanceLedger balanceLedger;
    private final SaleRepository saleRepository;
    private final SaleLineRepository saleLineRepository;
    private final OutboxService outboxService;

    /**
     * Prices the lines from the catalog, decrements stock in item-id order, and puts
     * {@code total - paid} on the customer balance.
     *
     * @throws com.flagship.retail_ledger.exception.InsufficientStockException on the first line that cannot be covered
     * @throws ValidationException                                           for malformed commands
     * @throws NotFoundException                                             for unknown items or customer
     */
    @Transactional
    public Sale createSale(CreateSaleCommand command) {
        validate(command);
        String tenantId = command.getTenantId();

        if (command.getCustomerId() != null) {
            catalogService.getCounterparty(tenantId, CounterpartyKind.CUSTOMER, command.getCustomerId());
        }

        UUID saleId = UUID.randomUUID();
        List<SaleLine> lines = priceLines(saleId, command);

        BigDecimal subtotal = lines.stream()
            .map(SaleLine::getSubtotal)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        OrderDiscount discount = command.getDiscount();
        DiscountType discountType = discount != null ? discount.getType() : null;
        BigDecimal discountValue = discount != null && discount.getValue() != null ? discount.getValue() : BigDecimal.ZERO;
        BigDecimal orderDiscount = pricingResolver.orderDiscountAmount(subtotal, discountType, discountValue);
        BigDecimal total = pricingResolver.applyOrderDiscount(subtotal, discountType, discountValue);
        BigDecimal paid = settledAmount(command.getPaymentType(), command.getPaidAmount(), total);

        // stable lock order across concurrent sales touching the same items
        lines.stream()
            .sorted(Comparator.comparing(SaleLine::getItemId).thenComparing(SaleLine::getLineNumber))
            .forEach(line -> stockLedger.decrease(
                tenantId, line.getItemId(), line.getQuantity(), MovementSource.SALE, saleId));

        BigDecimal unpaid = total.subtract(paid);
        if (unpaid.signum() > 0) {
            balanceLedger.applyDelta(tenantId, CounterpartyKind.CUSTOMER, command.getCustomerId(), unpaid,
                BalanceEntryType.CREDIT_SALE, saleId, FloorPolicy.ENFORCE_FLOOR);
        }

        Sale sale = new Sale(
            saleId,
            tenantId,
            command.getCustomerId(),
            lines,
            subtotal,
            discountType,
            discountValue,
            orderDiscount,
            total,
            paid,
            command.getPaymentType(),
            command.getPaymentMethod(),
            command.getUserId(),
            null
        );

        SaleEntity saved = saleRepository.save(SaleEntity.fromDomain(sale));
        saleLineRepository.saveAll(lines.stream()
            .map(line -> SaleLineEntity.fromDomain(line, tenantId))
            .toList());

        Sale created = saved.toDomain(lines);
        outboxService.saveEvent(SaleCreatedEvent.fromSale(created));

        log.info("Sale created: saleId={}, lines={}, total={}, paid={}, customerId={}",
                saleId, lines.size(), total, paid, command.getCustomerId());
        return created;
    }

    @Transactional(readOnly = true)
    public Sale getSale(String tenantId, UUID saleId) {
        SaleEntity entity = saleRepository.findByIdAndTenantId(saleId, tenantId)
            .orElseThrow(() -> new NotFoundException("Sale", saleId));
        List<SaleLine> lines = saleLineRepository.findBySaleIdAndTenantIdOrderByLineNumberAsc(saleId, tenantId)
            .stream()
            .map(SaleLineEntity::toDomain)
            .toList();
        return entity.toDomain(lines);
    }

    private List<SaleLine> priceLines(UUID saleId, CreateSaleCommand command) {
        List<SaleLine> lines = new ArrayList<>();
        int lineNumber = 1;
        for (SaleLineCommand line : command.getLines()) {
            if (line == null || line.getItemId() == null) {
                throw new ValidationException("Line " + lineNumber + ": item id is required");
            }
            Item item = catalogService.getItem(command.getTenantId(), line.getItemId());

            BigDecimal quantity = UnitConverter.resolveLineQuantity(
                line.getQuantity(), line.getCartons(), line.getPieces(), item.getPiecesPerUnit());
            if (quantity.signum() <= 0) {
                throw new ValidationException("Line " + lineNumber + ": quantity must be greater than zero");
            }

            ResolvedPrice price = pricingResolver.resolveUnitPriceOrDefault(item, line.getPriceTier());
            BigDecimal lineDiscount = line.getLineDiscount() != null
                ? line.getLineDiscount().setScale(PricingResolver.MONEY_SCALE, RoundingMode.HALF_UP)
                : BigDecimal.ZERO.setScale(PricingResolver.MONEY_SCALE);
            LineAmount amount = pricingResolver.priceLine(price.getUnitPrice(), quantity, lineDiscount);

            if (line.getPriceTier() != null && price.isFallback(line.getPriceTier())) {
                log.debug("Tier {} not priced for item {}, charged at {}", line.getPriceTier(), item.getId(), price.getTier());
            }

            lines.add(new SaleLine(
                UUID.randomUUID(),
                saleId,
                item.getId(),
                lineNumber,
                quantity,
                price.getUnitPrice(),
                price.getTier(),
                amount.getDiscount(),
                amount.getSubtotal()
            ));
            lineNumber++;
        }
        return lines;
    }

    /**
     * CASH is always paid in full. CREDIT keeps what was tendered, clamped to {@code [0, total]}.
     */
    static BigDecimal settledAmount(PaymentType paymentType, BigDecimal paidAmount, BigDecimal total) {
        if (paymentType == PaymentType.CASH) {
            return total;
        }
        BigDecimal tendered = paidAmount != null ? paidAmount : BigDecimal.ZERO;
        return tendered.max(BigDecimal.ZERO).min(total).setScale(PricingResolver.MONEY_SCALE, RoundingMode.HALF_UP);
    }

    private void validate(CreateSaleCommand command) {
        if (command.getTenantId() == null || command.getTenantId().isBlank()) {
            throw new ValidationException("Tenant id is required");
        }
        if (command.getUserId() == null || command.getUserId().isBlank()) {
            throw new ValidationException("User id is required");
        }
        if (command.getLines() == null || command.getLines().isEmpty()) {
            throw new ValidationException("A sale needs at least one line");
        }
        if (command.getPaymentType() == null) {
            throw new ValidationException("Payment type is required");
        }
        if (command.getPaymentMethod() == null) {
            throw new ValidationException("Payment method is required");
        }
        if (command.getPaymentType() == PaymentType.CREDIT && command.getCustomerId() == null) {
            throw new ValidationException("A credit sale needs a customer");
        }
    }
}
