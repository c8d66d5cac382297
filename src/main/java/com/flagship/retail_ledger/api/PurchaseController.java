package com.flagship.retail_ledger.api;

import com.flagship.retail_ledger.api.dto.CreatePurchaseRequest;
import com.flagship.retail_ledger.api.dto.PurchaseResponse;
import com.flagship.retail_ledger.api.dto.ReturnResponse;
import com.flagship.retail_ledger.api.dto.ReturnableLineResponse;
import com.flagship.retail_ledger.engine.TransactionEngine;
import com.flagship.retail_ledger.purchase.Purchase;
import com.flagship.retail_ledger.purchase.PurchaseService;
import com.flagship.retail_ledger.returns.ReturnService;
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

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/purchases")
@RequiredArgsConstructor
@Slf4j
public class PurchaseController {

    private final TransactionEngine transactionEngine;
    private final PurchaseService purchaseService;
    private final ReturnService returnService;

    @PostMapping
    public ResponseEntity<PurchaseResponse> createPurchase(
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId,
            @RequestHeader(ApiHeaders.USER_ID) String userId,
            @Valid @RequestBody CreatePurchaseRequest request) {

        log.info("Received purchase request: lines={}, paymentType={}, supplierId={}",
                request.getLines().size(), request.getPaymentType(), request.getSupplierId());

        Purchase purchase = transactionEngine.createPurchase(request.toCommand(tenantId, userId));
        return ResponseEntity.status(HttpStatus.CREATED).body(PurchaseResponse.from(purchase));
    }

    @GetMapping("/{id}")
    public ResponseEntity<PurchaseResponse> getPurchase(
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId,
            @PathVariable("id") UUID id) {
        return ResponseEntity.ok(PurchaseResponse.from(purchaseService.getPurchase(tenantId, id)));
    }

    @GetMapping("/{id}/returnable")
    public ResponseEntity<List<ReturnableLineResponse>> getReturnableLines(
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId,
            @PathVariable("id") UUID id) {
        return ResponseEntity.ok(returnService.getReturnablePurchaseLines(tenantId, id).stream()
            .map(ReturnableLineResponse::from)
            .toList());
    }

    @GetMapping("/{id}/returns")
    public ResponseEntity<List<ReturnResponse>> getReturns(
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId,
            @PathVariable("id") UUID id) {
        return ResponseEntity.ok(returnService.getSupplierReturns(tenantId, id).stream()
            .map(ReturnResponse::from)
            .toList());
    }
}
