package com.flagship.retail_ledger.payment;

import com.flagship.retail_ledger.balance.BalanceEntryType;
import com.flagship.retail_ledger.balance.BalanceLedger;
import com.flagship.retail_ledger.catalog.CounterpartyKind;
import com.flagship.retail_ledger.common.PaymentMethod;
import com.flagship.retail_ledger.common.PaymentType;
import com.flagship.retail_ledger.exception.ErrorKind;
import com.flagship.retail_ledger.exception.OverpaymentNotAllowedException;
import com.flagship.retail_ledger.exception.ValidationException;
import com.flagship.retail_ledger.idempotency.IdempotentResult;
import com.flagship.retail_ledger.sale.CreateSaleCommand;
import com.flagship.retail_ledger.sale.SaleLineCommand;
import com.flagship.retail_ledger.sale.SaleService;
import com.flagship.retail_ledger.support.LedgerIntegrationSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class PaymentServiceTest extends LedgerIntegrationSupport {

    @Autowired
    private PaymentService paymentService;

    @Autowired
    private SaleService saleService;

    @Autowired
    private BalanceLedger balanceLedger;

    private UUID customerId;

    @BeforeEach
    void customerOwingOneHundred() {
        UUID itemId = createItem("Generator Oil", "10", "50.00");
        customerId = createCustomer("Nana");
        saleService.createSale(CreateSaleCommand.builder()
            .tenantId(tenantId).userId(userId).customerId(customerId)
            .line(SaleLineCommand.builder().itemId(itemId).quantity(new BigDecimal("2")).build())
            .paymentType(PaymentType.CREDIT).paymentMethod(PaymentMethod.CASH)
            .build());
    }

    private RecordPaymentCommand.RecordPaymentCommandBuilder payment(String amount) {
        return RecordPaymentCommand.builder()
            .tenantId(tenantId)
            .userId(userId)
            .kind(CounterpartyKind.CUSTOMER)
            .counterpartyId(customerId)
            .amount(new BigDecimal(amount))
            .method(PaymentMethod.MOMO);
    }

    @Test
    @DisplayName("Payment reduces the balance and is journaled")
    void testPaymentReducesBalance() {
        printTestHeader("Payment Reduces Balance");

        IdempotentResult<Payment> result = paymentService.recordPayment(payment("60").reference("MOMO-123").build());

        printOutput("Payment", result.getValue().getId());
        assertFalse(result.isReplayed());
        assertAmount("40", balanceLedger.getBalance(tenantId, CounterpartyKind.CUSTOMER, customerId));
        assertEquals(BalanceEntryType.PAYMENT,
            balanceLedger.getEntries(tenantId, CounterpartyKind.CUSTOMER, customerId).get(1).getEntryType());
        assertEquals("MOMO-123", paymentService.getPayment(tenantId, result.getValue().getId()).getReference());
        printSuccess("Balance 100 -> 40");
    }

    @Test
    @DisplayName("Paying more than is owed is rejected")
    void testOverpayment() {
        printTestHeader("Overpayment");

        OverpaymentNotAllowedException e = assertThrows(OverpaymentNotAllowedException.class,
            () -> paymentService.recordPayment(payment("100.01").build()));

        printExpectedException("OverpaymentNotAllowedException", e.getMessage());
        assertEquals(ErrorKind.OVERPAYMENT_NOT_ALLOWED, e.getKind());
        assertAmount("100", balanceLedger.getBalance(tenantId, CounterpartyKind.CUSTOMER, customerId));

        paymentService.recordPayment(payment("100").build());
        assertAmount("0", balanceLedger.getBalance(tenantId, CounterpartyKind.CUSTOMER, customerId));
        printSuccess("Exact settlement accepted, overpayment rejected");
    }

    @Test
    @DisplayName("Replaying an idempotency key returns the original payment without paying twice")
    void testIdempotentReplay() {
        printTestHeader("Idempotent Replay");
        String key = "pay-" + UUID.randomUUID();

        IdempotentResult<Payment> first = paymentService.recordPayment(payment("30").idempotencyKey(key).build());
        IdempotentResult<Payment> second = paymentService.recordPayment(payment("30").idempotencyKey(key).build());

        assertFalse(first.isReplayed());
        assertTrue(second.isReplayed());
        assertEquals(first.getValue().getId(), second.getValue().getId());
        assertAmount("70", balanceLedger.getBalance(tenantId, CounterpartyKind.CUSTOMER, customerId));
        printSuccess("Second call replayed, balance only reduced once");
    }

    @Test
    @DisplayName("Non-positive amounts are rejected")
    void testNonPositiveAmount() {
        assertThrows(ValidationException.class, () -> paymentService.recordPayment(payment("0").build()));
        assertThrows(ValidationException.class, () -> paymentService.recordPayment(payment("-5").build()));
        assertAmount("100", balanceLedger.getBalance(tenantId, CounterpartyKind.CUSTOMER, customerId));
    }
}
