package com.flagship.retail_ledger.api;

import com.flagship.retail_ledger.balance.BalanceLedger;
import com.flagship.retail_ledger.catalog.CounterpartyKind;
import com.flagship.retail_ledger.common.PaymentMethod;
import com.flagship.retail_ledger.config.JacksonConfig;
import com.flagship.retail_ledger.engine.BulkResult;
import com.flagship.retail_ledger.engine.TransactionEngine;
import com.flagship.retail_ledger.exception.ConcurrencyConflictException;
import com.flagship.retail_ledger.exception.InsufficientStockException;
import com.flagship.retail_ledger.exception.NotFoundException;
import com.flagship.retail_ledger.idempotency.IdempotentResult;
import com.flagship.retail_ledger.payment.Payment;
import com.flagship.retail_ledger.payment.PaymentService;
import com.flagship.retail_ledger.purchase.PurchaseService;
import com.flagship.retail_ledger.returns.ReturnService;
import com.flagship.retail_ledger.sale.SaleService;
import com.flagship.retail_ledger.stock.StockAdjustmentService;
import com.flagship.retail_ledger.stock.StockLedger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * HTTP mapping of the ledger: status codes, headers and error bodies.
 */
@WebMvcTest
@Import(JacksonConfig.class)
class LedgerApiTest {

    private static final String TENANT = "tenant-api";
    private static final String USER = "cashier-1";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TransactionEngine transactionEngine;
    @MockBean
    private SaleService saleService;
    @MockBean
    private PurchaseService purchaseService;
    @MockBean
    private ReturnService returnService;
    @MockBean
    private PaymentService paymentService;
    @MockBean
    private StockAdjustmentService stockAdjustmentService;
    @MockBean
    private StockLedger stockLedger;
    @MockBean
    private BalanceLedger balanceLedger;

    private Payment payment(UUID customerId) {
        return new Payment(UUID.randomUUID(), TENANT, CounterpartyKind.CUSTOMER, customerId,
            new BigDecimal("40.00"), PaymentMethod.MOMO, "MM-1", USER, Instant.now());
    }

    private String paymentBody(UUID customerId, String amount) {
        return """
            {"counterparty_kind": "CUSTOMER", "counterparty_id": "%s", "amount": %s, "method": "MOMO", "reference": "MM-1"}
            """.formatted(customerId, amount);
    }

    @Test
    @DisplayName("A new payment returns 201 with snake_case fields and a correlation id")
    void testPaymentCreated() throws Exception {
        UUID customerId = UUID.randomUUID();
        when(transactionEngine.recordPayment(any())).thenReturn(IdempotentResult.created(payment(customerId)));

        mockMvc.perform(post("/api/payments")
                .header(ApiHeaders.TENANT_ID, TENANT)
                .header(ApiHeaders.USER_ID, USER)
                .header(ApiHeaders.IDEMPOTENCY_KEY, "pay-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(paymentBody(customerId, "40.00")))
            .andExpect(status().isCreated())
            .andExpect(header().exists("X-Correlation-ID"))
            .andExpect(jsonPath("$.counterparty_id").value(customerId.toString()))
            .andExpect(jsonPath("$.amount").value(40.00))
            .andExpect(jsonPath("$.created_by").value(USER));
    }

    @Test
    @DisplayName("A replayed payment returns 200")
    void testPaymentReplayed() throws Exception {
        UUID customerId = UUID.randomUUID();
        when(transactionEngine.recordPayment(any())).thenReturn(IdempotentResult.replayed(payment(customerId)));

        mockMvc.perform(post("/api/payments")
                .header(ApiHeaders.TENANT_ID, TENANT)
                .header(ApiHeaders.USER_ID, USER)
                .header(ApiHeaders.IDEMPOTENCY_KEY, "pay-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(paymentBody(customerId, "40.00")))
            .andExpect(status().isOk());
    }

    @Test
    @DisplayName("Missing tenant header is a 400 and reaches no service")
    void testMissingTenantHeader() throws Exception {
        mockMvc.perform(post("/api/payments")
                .header(ApiHeaders.USER_ID, USER)
                .contentType(MediaType.APPLICATION_JSON)
                .content(paymentBody(UUID.randomUUID(), "10")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.kind").value("VALIDATION_ERROR"));

        verify(transactionEngine, never()).recordPayment(any());
    }

    @Test
    @DisplayName("Body validation failures list the offending fields")
    void testBodyValidation() throws Exception {
        mockMvc.perform(post("/api/payments")
                .header(ApiHeaders.TENANT_ID, TENANT)
                .header(ApiHeaders.USER_ID, USER)
                .contentType(MediaType.APPLICATION_JSON)
                .content(paymentBody(UUID.randomUUID(), "0")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.amount").exists());
    }

    @Test
    @DisplayName("Stock adjustments require an Idempotency-Key")
    void testAdjustmentNeedsKey() throws Exception {
        mockMvc.perform(post("/api/stock/adjustments")
                .header(ApiHeaders.TENANT_ID, TENANT)
                .header(ApiHeaders.USER_ID, USER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"item_id": "%s", "type": "INCREASE", "quantity": 3, "reason": "Recount"}
                    """.formatted(UUID.randomUUID())))
            .andExpect(status().isBadRequest());

        verify(transactionEngine, never()).adjustStock(any());
    }

    @Test
    @DisplayName("Insufficient stock is a 422 carrying availability details")
    void testInsufficientStock() throws Exception {
        UUID itemId = UUID.randomUUID();
        when(transactionEngine.adjustStock(any())).thenThrow(
            new InsufficientStockException(itemId, "Rice 5kg", new BigDecimal("2"), new BigDecimal("5")));

        mockMvc.perform(post("/api/stock/adjustments")
                .header(ApiHeaders.TENANT_ID, TENANT)
                .header(ApiHeaders.USER_ID, USER)
                .header(ApiHeaders.IDEMPOTENCY_KEY, "adj-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"item_id": "%s", "type": "DECREASE", "quantity": 5, "reason": "Damaged"}
                    """.formatted(itemId)))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.kind").value("INSUFFICIENT_STOCK"))
            .andExpect(jsonPath("$.retryable").value(false));
    }

    @Test
    @DisplayName("Concurrency conflicts are a retryable 409")
    void testConcurrencyConflict() throws Exception {
        when(transactionEngine.recordPayment(any())).thenThrow(
            new ConcurrencyConflictException("record_payment", new OptimisticLockingFailureException("stale")));

        mockMvc.perform(post("/api/payments")
                .header(ApiHeaders.TENANT_ID, TENANT)
                .header(ApiHeaders.USER_ID, USER)
                .contentType(MediaType.APPLICATION_JSON)
                .content(paymentBody(UUID.randomUUID(), "10")))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.kind").value("CONCURRENCY_CONFLICT"))
            .andExpect(jsonPath("$.retryable").value(true));
    }

    @Test
    @DisplayName("Unknown records are a 404")
    void testNotFound() throws Exception {
        UUID saleId = UUID.randomUUID();
        when(saleService.getSale(TENANT, saleId)).thenThrow(new NotFoundException("Sale", saleId));

        mockMvc.perform(get("/api/sales/{id}", saleId).header(ApiHeaders.TENANT_ID, TENANT))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.kind").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("Bulk balance overrides return the row summary")
    void testBulkBalances() throws Exception {
        when(transactionEngine.bulkOverrideBalances(eq(TENANT), eq(USER), eq(CounterpartyKind.SUPPLIER), anyList()))
            .thenReturn(new BulkResult(1, 1, List.of("Row 2: invalid balance")));

        mockMvc.perform(post("/api/balances/bulk")
                .header(ApiHeaders.TENANT_ID, TENANT)
                .header(ApiHeaders.USER_ID, USER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"counterparty_kind": "SUPPLIER", "adjustments": [
                      {"counterparty_id": "%s", "balance": 120},
                      {"counterparty_id": "%s", "balance": -1}
                    ]}
                    """.formatted(UUID.randomUUID(), UUID.randomUUID())))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.updated").value(1))
            .andExpect(jsonPath("$.skipped").value(1))
            .andExpect(jsonPath("$.errors[0]").value("Row 2: invalid balance"));
    }

    @Test
    @DisplayName("An unknown counterparty kind in the path is a 400")
    void testUnknownKind() throws Exception {
        mockMvc.perform(get("/api/balances/{kind}/{id}/reconciliation", "vendors", UUID.randomUUID())
                .header(ApiHeaders.TENANT_ID, TENANT))
            .andExpect(status().isBadRequest());
    }
}
