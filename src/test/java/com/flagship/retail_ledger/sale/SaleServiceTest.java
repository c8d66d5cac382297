package com.flagship.retail_ledger.sale;

import com.flagship.retail_ledger.balance.BalanceEntry;
import com.flagship.retail_ledger.balance.BalanceEntryType;
import com.flagship.retail_ledger.balance.BalanceLedger;
import com.flagship.retail_ledger.catalog.CounterpartyKind;
import com.flagship.retail_ledger.catalog.NewItem;
import com.flagship.retail_ledger.common.PaymentMethod;
import com.flagship.retail_ledger.common.PaymentType;
import com.flagship.retail_ledger.event.SaleCreatedEvent;
import com.flagship.retail_ledger.exception.InsufficientStockException;
import com.flagship.retail_ledger.exception.InvalidUnitInputException;
import com.flagship.retail_ledger.exception.NotFoundException;
import com.flagship.retail_ledger.exception.ValidationException;
import com.flagship.retail_ledger.outbox.OutboxEvent;
import com.flagship.retail_ledger.outbox.OutboxService;
import com.flagship.retail_ledger.pricing.OrderDiscount;
import com.flagship.retail_ledger.pricing.PriceTier;
import com.flagship.retail_ledger.stock.StockLedger;
import com.flagship.retail_ledger.support.LedgerIntegrationSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Sale creation: pricing, settlement, stock and balance effects, and all-or-nothing rollback.
 */
class SaleServiceTest extends LedgerIntegrationSupport {

    @Autowired
    private SaleService saleService;

    @Autowired
    private BalanceLedger balanceLedger;

    @Autowired
    private StockLedger stockLedger;

    @Autowired
    private OutboxService outboxService;

    private SaleLineCommand line(UUID itemId, String quantity) {
        return SaleLineCommand.builder().itemId(itemId).quantity(new BigDecimal(quantity)).build();
    }

    @Test
    @DisplayName("Cash sale decrements stock, settles in full and leaves the balance alone")
    void testCashSale() {
        printTestHeader("Cash Sale");
        UUID itemId = createItem("Milo 400g", "10", "25.00");
        UUID customerId = createCustomer("Abena");

        Sale sale = saleService.createSale(CreateSaleCommand.builder()
            .tenantId(tenantId)
            .userId(userId)
            .customerId(customerId)
            .line(line(itemId, "3"))
            .paymentType(PaymentType.CASH)
            .paymentMethod(PaymentMethod.MOMO)
            .paidAmount(BigDecimal.ZERO)
            .build());

        printOutput("Sale", sale.getId());
        assertAmount("75", sale.getTotalAmount());
        assertAmount("75", sale.getPaidAmount());
        assertAmount("7", stockOf(itemId));
        assertAmount("0", balanceLedger.getBalance(tenantId, CounterpartyKind.CUSTOMER, customerId));

        List<OutboxEvent> events = outboxService.getEventsForAggregate(SaleCreatedEvent.AGGREGATE_TYPE, sale.getId());
        assertEquals(1, events.size());
        assertEquals(SaleCreatedEvent.EVENT_TYPE, events.get(0).getEventType());
        printSuccess("Stock 10 -> 7, balance untouched, SaleCreated in outbox");
    }

    @Test
    @DisplayName("Credit sale puts the unpaid remainder on the customer and journals it")
    void testCreditSale() {
        printTestHeader("Credit Sale");
        UUID itemId = createItem("Rice 5kg", "20", "80.00");
        UUID customerId = createCustomer("Kwame");

        Sale sale = saleService.createSale(CreateSaleCommand.builder()
            .tenantId(tenantId)
            .userId(userId)
            .customerId(customerId)
            .line(line(itemId, "2"))
            .paymentType(PaymentType.CREDIT)
            .paymentMethod(PaymentMethod.CASH)
            .paidAmount(new BigDecimal("50"))
            .discount(OrderDiscount.amount(new BigDecimal("10")))
            .build());

        assertAmount("160", sale.getSubtotal());
        assertAmount("10", sale.getOrderDiscount());
        assertAmount("150", sale.getTotalAmount());
        assertAmount("50", sale.getPaidAmount());
        assertAmount("100", balanceLedger.getBalance(tenantId, CounterpartyKind.CUSTOMER, customerId));

        List<BalanceEntry> entries = balanceLedger.getEntries(tenantId, CounterpartyKind.CUSTOMER, customerId);
        assertEquals(1, entries.size());
        assertEquals(BalanceEntryType.CREDIT_SALE, entries.get(0).getEntryType());
        assertEquals(sale.getId(), entries.get(0).getSourceId());
        printSuccess("Customer owes 100");
    }

    @Test
    @DisplayName("Overpaid credit sale is clamped to the total")
    void testCreditPaidClamped() {
        UUID itemId = createItem("Soap", "10", "5.00");
        UUID customerId = createCustomer("Efua");

        Sale sale = saleService.createSale(CreateSaleCommand.builder()
            .tenantId(tenantId).userId(userId).customerId(customerId)
            .line(line(itemId, "2"))
            .paymentType(PaymentType.CREDIT).paymentMethod(PaymentMethod.CASH)
            .paidAmount(new BigDecimal("500"))
            .build());

        assertAmount("10", sale.getPaidAmount());
        assertAmount("0", balanceLedger.getBalance(tenantId, CounterpartyKind.CUSTOMER, customerId));
    }

    @Test
    @DisplayName("Carton lines and tier fallback are priced from the catalog")
    void testCartonsAndTierFallback() {
        printTestHeader("Cartons And Tier Fallback");
        UUID cartonItem = catalogService.createItem(tenantId, NewItem.builder()
            .name("Malt 24x330ml")
            .quantity(new BigDecimal("5"))
            .sellingPrice(new BigDecimal("120.00"))
            .wholesalePrice(new BigDecimal("100.00"))
            .piecesPerUnit(24)
            .build());
        UUID plainItem = createItem("Matches", "50", "1.00");

        Sale sale = saleService.createSale(CreateSaleCommand.builder()
            .tenantId(tenantId).userId(userId)
            .line(SaleLineCommand.builder().itemId(cartonItem).cartons(1L).pieces(12)
                .priceTier(PriceTier.WHOLESALE).build())
            .line(SaleLineCommand.builder().itemId(plainItem).quantity(new BigDecimal("4"))
                .priceTier(PriceTier.PROMO).lineDiscount(new BigDecimal("1")).build())
            .paymentType(PaymentType.CASH).paymentMethod(PaymentMethod.CASH)
            .build());

        SaleLine cartonLine = sale.getLines().get(0);
        assertAmount("1.5", cartonLine.getQuantity());
        assertEquals(PriceTier.WHOLESALE, cartonLine.getPriceTier());
        assertAmount("150", cartonLine.getSubtotal());

        SaleLine plainLine = sale.getLines().get(1);
        assertEquals(PriceTier.DEFAULT, plainLine.getPriceTier());
        assertAmount("3", plainLine.getSubtotal());

        assertAmount("153", sale.getTotalAmount());
        assertAmount("3.5", stockOf(cartonItem));
        printSuccess("1 carton + 12 pieces = 1.5 units at wholesale");
    }

    @Test
    @DisplayName("One carton and six pieces of a 12-piece carton leave 8.5 in stock")
    void testCartonAndPiecesOfTwelve() {
        printTestHeader("Carton Of Twelve");
        UUID itemId = catalogService.createItem(tenantId, NewItem.builder()
            .name("Eggs Tray")
            .quantity(new BigDecimal("10"))
            .sellingPrice(new BigDecimal("24.00"))
            .unitName("carton")
            .piecesPerUnit(12)
            .build());

        Sale sale = saleService.createSale(CreateSaleCommand.builder()
            .tenantId(tenantId).userId(userId)
            .line(SaleLineCommand.builder().itemId(itemId).cartons(1L).pieces(6).build())
            .paymentType(PaymentType.CASH).paymentMethod(PaymentMethod.CASH)
            .build());

        assertAmount("1.5", sale.getLines().get(0).getQuantity());
        assertAmount("36", sale.getTotalAmount());
        assertAmount("8.5", stockOf(itemId));
        printSuccess("10 - 1.5 = 8.5");
    }

    @Test
    @DisplayName("A line discount above the line value is stored as the discount actually taken")
    void testOversizedLineDiscountIsStoredCapped() {
        printTestHeader("Oversized Line Discount");
        UUID cheap = createItem("Candles", "10", "5.00");
        UUID dear = createItem("Lantern", "10", "10.00");

        Sale created = saleService.createSale(CreateSaleCommand.builder()
            .tenantId(tenantId).userId(userId)
            .line(SaleLineCommand.builder().itemId(cheap).quantity(new BigDecimal("2"))
                .lineDiscount(new BigDecimal("25")).build())
            .line(line(dear, "3"))
            .paymentType(PaymentType.CASH).paymentMethod(PaymentMethod.CASH)
            .discount(OrderDiscount.amount(new BigDecimal("5")))
            .build());

        Sale stored = saleService.getSale(tenantId, created.getId());
        SaleLine discounted = stored.getLines().get(0);
        printOutput("Discounted line", discounted);
        assertAmount("10", discounted.getLineDiscount());
        assertAmount("0", discounted.getSubtotal());

        BigDecimal recomputed = BigDecimal.ZERO;
        for (SaleLine saleLine : stored.getLines()) {
            BigDecimal lineValue = saleLine.getUnitPrice().multiply(saleLine.getQuantity())
                .subtract(saleLine.getLineDiscount());
            assertTrue(lineValue.signum() >= 0, "stored line value must not be negative");
            assertAmount(lineValue.toPlainString(), saleLine.getSubtotal());
            recomputed = recomputed.add(lineValue);
        }
        recomputed = recomputed.subtract(stored.getOrderDiscount()).max(BigDecimal.ZERO);
        assertAmount(recomputed.toPlainString(), stored.getTotalAmount());
        assertAmount("25", stored.getTotalAmount());
        printSuccess("Stored lines add up to the stored total");
    }

    @Test
    @DisplayName("Insufficient stock on any line rolls back the whole sale")
    void testRollbackOnInsufficientStock() {
        printTestHeader("Rollback On Insufficient Stock");
        UUID plenty = createItem("Bread", "10", "10.00");
        UUID scarce = createItem("Butter", "1", "15.00");
        UUID customerId = createCustomer("Akosua");

        InsufficientStockException e = assertThrows(InsufficientStockException.class,
            () -> saleService.createSale(CreateSaleCommand.builder()
                .tenantId(tenantId).userId(userId).customerId(customerId)
                .line(line(plenty, "2"))
                .line(line(scarce, "3"))
                .paymentType(PaymentType.CREDIT).paymentMethod(PaymentMethod.CASH)
                .build()));

        printExpectedException("InsufficientStockException", e.getMessage());
        assertEquals(scarce, e.getItemId());
        assertAmount("10", stockOf(plenty));
        assertAmount("1", stockOf(scarce));
        assertAmount("0", balanceLedger.getBalance(tenantId, CounterpartyKind.CUSTOMER, customerId));
        assertTrue(stockLedger.getMovements(tenantId, plenty).isEmpty());
        printSuccess("No stock, balance or movement survived the failed sale");
    }

    @Test
    @DisplayName("Malformed sales are rejected before anything is written")
    void testValidation() {
        UUID itemId = createItem("Tea", "10", "4.00");

        assertThrows(ValidationException.class, () -> saleService.createSale(CreateSaleCommand.builder()
            .tenantId(tenantId).userId(userId)
            .line(line(itemId, "1"))
            .paymentType(PaymentType.CREDIT).paymentMethod(PaymentMethod.CASH)
            .build()));
        assertThrows(ValidationException.class, () -> saleService.createSale(CreateSaleCommand.builder()
            .tenantId(tenantId).userId(userId)
            .paymentType(PaymentType.CASH).paymentMethod(PaymentMethod.CASH)
            .build()));
        assertThrows(ValidationException.class, () -> saleService.createSale(CreateSaleCommand.builder()
            .tenantId(tenantId).userId(userId)
            .line(line(itemId, "0"))
            .paymentType(PaymentType.CASH).paymentMethod(PaymentMethod.CASH)
            .build()));
        assertThrows(InvalidUnitInputException.class, () -> saleService.createSale(CreateSaleCommand.builder()
            .tenantId(tenantId).userId(userId)
            .line(SaleLineCommand.builder().itemId(itemId).quantity(BigDecimal.ONE).cartons(1L).build())
            .paymentType(PaymentType.CASH).paymentMethod(PaymentMethod.CASH)
            .build()));
        assertThrows(NotFoundException.class, () -> saleService.createSale(CreateSaleCommand.builder()
            .tenantId(tenantId).userId(userId)
            .line(line(UUID.randomUUID(), "1"))
            .paymentType(PaymentType.CASH).paymentMethod(PaymentMethod.CASH)
            .build()));

        assertAmount("10", stockOf(itemId));
    }

    @Test
    @DisplayName("Concurrent sales never oversell an item")
    void testConcurrentSalesDoNotOversell() throws InterruptedException {
        printTestHeader("Concurrent Sales Do Not Oversell");
        UUID itemId = createItem("Phone Card", "10", "10.00");
        int attempts = 20;

        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(attempts);
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();

        for (int i = 0; i < attempts; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    saleService.createSale(CreateSaleCommand.builder()
                        .tenantId(tenantId).userId(userId)
                        .line(line(itemId, "1"))
                        .paymentType(PaymentType.CASH).paymentMethod(PaymentMethod.CASH)
                        .build());
                    succeeded.incrementAndGet();
                } catch (InsufficientStockException e) {
                    rejected.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertTrue(done.await(60, TimeUnit.SECONDS));
        executor.shutdown();

        printOutput("Succeeded", succeeded.get());
        printOutput("Rejected", rejected.get());
        assertEquals(10, succeeded.get());
        assertEquals(10, rejected.get());
        assertAmount("0", stockOf(itemId));
        printSuccess("Exactly the available stock was sold");
    }
}
