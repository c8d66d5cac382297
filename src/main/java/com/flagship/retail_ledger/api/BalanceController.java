package com.flagship.retail_ledger.api;

import com.flagship.retail_ledger.api.dto.BalanceEntryResponse;
import com.flagship.retail_ledger.api.dto.BalanceOverrideResponse;
import com.flagship.retail_ledger.api.dto.BulkBalanceRequest;
import com.flagship.retail_ledger.api.dto.OverrideBalanceRequest;
import com.flagship.retail_ledger.api.dto.ReconciliationResponse;
import com.flagship.retail_ledger.balance.BalanceLedger;
import com.flagship.retail_ledger.balance.BalanceOverride;
import com.flagship.retail_ledger.balance.OverrideBalanceCommand;
import com.flagship.retail_ledger.catalog.CounterpartyKind;
import com.flagship.retail_ledger.engine.BulkResult;
import com.flagship.retail_ledger.engine.TransactionEngine;
import com.flagship.retail_ledger.exception.ValidationException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Balance overrides and balance audit views. {@code kind} is {@code customers} or {@code suppliers}.
 */
@RestController
@RequestMapping("/api/balances")
@RequiredArgsConstructor
@Slf4j
public class BalanceController {

    private final TransactionEngine transactionEngine;
    private final BalanceLedger balanceLedger;

    @PutMapping("/{kind}/{id}")
    public ResponseEntity<BalanceOverrideResponse> overrideBalance(
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId,
            @RequestHeader(ApiHeaders.USER_ID) String userId,
            @PathVariable("kind") String kind,
            @PathVariable("id") UUID id,
            @Valid @RequestBody OverrideBalanceRequest request) {

        CounterpartyKind counterpartyKind = parseKind(kind);
        log.info("Received balance override: kind={}, id={}, balance={}", counterpartyKind, id, request.getBalance());

        BalanceOverride override = transactionEngine.overrideBalance(OverrideBalanceCommand.builder()
            .tenantId(tenantId)
            .userId(userId)
            .kind(counterpartyKind)
            .counterpartyId(id)
            .newBalance(request.getBalance())
            .reason(request.getReason())
            .build());
        return ResponseEntity.ok(BalanceOverrideResponse.from(override));
    }

    @PostMapping("/bulk")
    public ResponseEntity<BulkResult> bulkOverride(
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId,
            @RequestHeader(ApiHeaders.USER_ID) String userId,
            @Valid @RequestBody BulkBalanceRequest request) {

        log.info("Received bulk balance override: kind={}, rows={}",
                request.getCounterpartyKind(), request.getAdjustments().size());

        return ResponseEntity.ok(transactionEngine.bulkOverrideBalances(
            tenantId, userId, request.getCounterpartyKind(), request.toRows()));
    }

    @GetMapping("/{kind}/{id}/reconciliation")
    public ResponseEntity<ReconciliationResponse> reconcile(
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId,
            @PathVariable("kind") String kind,
            @PathVariable("id") UUID id) {
        return ResponseEntity.ok(ReconciliationResponse.from(balanceLedger.reconcile(tenantId, parseKind(kind), id)));
    }

    @GetMapping("/{kind}/{id}/entries")
    public ResponseEntity<List<BalanceEntryResponse>> getEntries(
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId,
            @PathVariable("kind") String kind,
            @PathVariable("id") UUID id) {
        return ResponseEntity.ok(balanceLedger.getEntries(tenantId, parseKind(kind), id).stream()
            .map(BalanceEntryResponse::from)
            .toList());
    }

    static CounterpartyKind parseKind(String kind) {
        for (CounterpartyKind candidate : CounterpartyKind.values()) {
            if (candidate.tableName().equalsIgnoreCase(kind) || candidate.name().equalsIgnoreCase(kind)) {
                return candidate;
            }
        }
        throw new ValidationException("Unknown counterparty kind: " + kind);
    }
}
