package com.flagship.retail_ledger.api;

import com.flagship.retail_ledger.api.dto.PaymentResponse;
import com.flagship.retail_ledger.api.dto.RecordPaymentRequest;
import com.flagship.retail_ledger.engine.TransactionEngine;
import com.flagship.retail_ledger.idempotency.IdempotentResult;
import com.flagship.retail_ledger.payment.Payment;
import com.flagship.retail_ledger.payment.PaymentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Payments received from customers and paid to suppliers.
 *
 * The Idempotency-Key header is optional. With it, a repeated request returns the original
 * payment with 200 instead of 201 and moves no money.
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
public class PaymentController {

    private final TransactionEngine transactionEngine;
    private final PaymentService paymentService;

    @PostMapping
    public ResponseEntity<PaymentResponse> recordPayment(
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId,
            @RequestHeader(ApiHeaders.USER_ID) String userId,
            @RequestHeader(value = ApiHeaders.IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @Valid @RequestBody RecordPaymentRequest request) {

        log.info("Received payment: kind={}, counterpartyId={}, amount={}, idempotencyKey={}",
                request.getCounterpartyKind(), request.getCounterpartyId(), request.getAmount(), idempotencyKey);

        IdempotentResult<Payment> result = transactionEngine.recordPayment(
            request.toCommand(tenantId, userId, idempotencyKey));
        HttpStatus status = result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(PaymentResponse.from(result.getValue()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<PaymentResponse> getPayment(
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId,
            @PathVariable("id") UUID id) {
        return ResponseEntity.ok(PaymentResponse.from(paymentService.getPayment(tenantId, id)));
    }
}
