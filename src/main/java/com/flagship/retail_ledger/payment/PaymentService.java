package com.flagship.retail_ledger.payment;

import com.flagship.retail_ledger.balance.BalanceEntryType;
import com.flagship.retail_ledger.balance.BalanceLedger;
import com.flagship.retail_ledger.balance.FloorPolicy;
import com.flagship.retail_ledger.event.PaymentRecordedEvent;
import com.flagship.retail_ledger.exception.NegativeBalanceGuardException;
import com.flagship.retail_ledger.exception.NotFoundException;
import com.flagship.retail_ledger.exception.OverpaymentNotAllowedException;
import com.flagship.retail_ledger.exception.ValidationException;
import com.flagship.retail_ledger.idempotency.IdempotencyService;
import com.flagship.retail_ledger.idempotency.IdempotentResult;
import com.flagship.retail_ledger.outbox.OutboxService;
import com.flagship.retail_ledger.pricing.PricingResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.UUID;

/**
 * Records payments against customer and supplier balances.
 *
 * A payment may settle the balance but never overshoot it. With an idempotency key, a repeated
 * request returns the payment recorded the first time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentService {

    static final String IDEMPOTENCY_SCOPE = "payment";

    private final BalanceLedger balanceLedger;
    private final PaymentRepository paymentRepository;
    private final IdempotencyService idempotencyService;
    private final OutboxService outboxService;

    /**
     * @throws OverpaymentNotAllowedException if the amount exceeds the outstanding balance
     */
    @Transactional
    public IdempotentResult<Payment> recordPayment(RecordPaymentCommand command) {
        validate(command);
        String tenantId = command.getTenantId();
        String idempotencyKey = command.getIdempotencyKey();

        if (idempotencyKey != null) {
            Optional<Payment> existing = findByIdempotencyKey(tenantId, idempotencyKey);
            if (existing.isPresent()) {
                log.info("Idempotency key already used, returning existing payment: paymentId={}",
                        existing.get().getId());
                return IdempotentResult.replayed(existing.get());
            }
        }

        BigDecimal amount = command.getAmount().setScale(PricingResolver.MONEY_SCALE, RoundingMode.HALF_UP);
        if (amount.signum() <= 0) {
            throw new ValidationException("Payment amount must be at least 0.01");
        }
        UUID paymentId = UUID.randomUUID();

        try {
            balanceLedger.applyDelta(tenantId, command.getKind(), command.getCounterpartyId(), amount.negate(),
                BalanceEntryType.PAYMENT, paymentId, FloorPolicy.ENFORCE_FLOOR);
        } catch (NegativeBalanceGuardException e) {
            throw new OverpaymentNotAllowedException(e.getCurrentBalance(), amount);
        }

        Payment payment = new Payment(paymentId, tenantId, command.getKind(), command.getCounterpartyId(), amount,
            command.getMethod(), command.getReference(), command.getUserId(), null);
        Payment saved = paymentRepository.save(PaymentEntity.fromDomain(payment, idempotencyKey)).toDomain();
        outboxService.saveEvent(PaymentRecordedEvent.fromPayment(saved));

        if (idempotencyKey != null) {
            idempotencyService.remember(IDEMPOTENCY_SCOPE, tenantId, idempotencyKey, paymentId);
        }

        log.info("Payment recorded: paymentId={}, kind={}, counterpartyId={}, amount={}, method={}",
                paymentId, command.getKind(), command.getCounterpartyId(), amount, command.getMethod());
        return IdempotentResult.created(saved);
    }

    /**
     * Looks up the payment created by an earlier request with this key.
     */
    @Transactional(readOnly = true)
    public Optional<Payment> findByIdempotencyKey(String tenantId, String idempotencyKey) {
        Optional<UUID> paymentId = idempotencyService.lookup(IDEMPOTENCY_SCOPE, tenantId, idempotencyKey,
            () -> paymentRepository.findByTenantIdAndIdempotencyKey(tenantId, idempotencyKey)
                .map(PaymentEntity::getId));
        if (paymentId.isEmpty()) {
            return Optional.empty();
        }
        Optional<Payment> payment = paymentRepository.findByIdAndTenantId(paymentId.get(), tenantId)
            .map(PaymentEntity::toDomain);
        if (payment.isEmpty()) {
            idempotencyService.forget(IDEMPOTENCY_SCOPE, tenantId, idempotencyKey);
        }
        return payment;
    }

    @Transactional(readOnly = true)
    public Payment getPayment(String tenantId, UUID paymentId) {
        return paymentRepository.findByIdAndTenantId(paymentId, tenantId)
            .map(PaymentEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("Payment", paymentId));
    }

    private void validate(RecordPaymentCommand command) {
        if (command.getTenantId() == null || command.getTenantId().isBlank()) {
            throw new ValidationException("Tenant id is required");
        }
        if (command.getUserId() == null || command.getUserId().isBlank()) {
            throw new ValidationException("User id is required");
        }
        if (command.getKind() == null || command.getCounterpartyId() == null) {
            throw new ValidationException("A payment needs a customer or a supplier");
        }
        if (command.getAmount() == null || command.getAmount().signum() <= 0) {
            throw new ValidationException("Payment amount must be greater than zero");
        }
        if (command.getMethod() == null) {
            throw new ValidationException("Payment method is required");
        }
        if (command.getIdempotencyKey() != null && command.getIdempotencyKey().isBlank()) {
            throw new ValidationException("Idempotency key cannot be blank");
        }
    }
}
