package com.flagship.retail_ledger.balance;

import com.flagship.retail_ledger.event.BalanceOverriddenEvent;
import com.flagship.retail_ledger.exception.ValidationException;
import com.flagship.retail_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Administrative balance corrections. Every override is audited and published; ordinary flows
 * never call this.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceOverrideService {

    private final BalanceLedger balanceLedger;
    private final OutboxService outboxService;

    @Transactional
    public BalanceOverride override(OverrideBalanceCommand command) {
        if (command.getTenantId() == null || command.getTenantId().isBlank()) {
            throw new ValidationException("Tenant id is required");
        }
        if (command.getUserId() == null || command.getUserId().isBlank()) {
            throw new ValidationException("User id is required");
        }
        if (command.getKind() == null || command.getCounterpartyId() == null) {
            throw new ValidationException("Counterparty kind and id are required");
        }
        if (command.getReason() == null || command.getReason().isBlank()) {
            throw new ValidationException("A reason is required for balance overrides");
        }

        BalanceOverride override = balanceLedger.setAbsolute(
            command.getTenantId(),
            command.getKind(),
            command.getCounterpartyId(),
            command.getNewBalance(),
            command.getReason().trim(),
            command.getUserId()
        );
        outboxService.saveEvent(BalanceOverriddenEvent.fromOverride(override));

        log.warn("Manual balance override applied: kind={}, id={}, previous={}, new={}, user={}",
                override.getKind(), override.getCounterpartyId(), override.getPreviousBalance(),
                override.getNewBalance(), override.getUserId());
        return override;
    }
}
