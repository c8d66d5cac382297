package com.flagship.retail_ledger.api;

import com.flagship.retail_ledger.api.dto.CreateSaleRequest;
import com.flagship.retail_ledger.api.dto.ReturnResponse;
import com.flagship.retail_ledger.api.dto.ReturnableLineResponse;
import com.flagship.retail_ledger.api.dto.SaleResponse;
import com.flagship.retail_ledger.engine.TransactionEngine;
import com.flagship.retail_ledger.returns.ReturnService;
import com.flagship.retail_ledger.sale.Sale;
import com.flagship.retail_ledger.sale.SaleService;
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
@RequestMapping("/api/sales")
@RequiredArgsConstructor
@Slf4j
public class SaleController {

    private final TransactionEngine transactionEngine;
    private final SaleService saleService;
    private final ReturnService returnService;

    @PostMapping
    public ResponseEntity<SaleResponse> createSale(
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId,
            @RequestHeader(ApiHeaders.USER_ID) String userId,
            @Valid @RequestBody CreateSaleRequest request) {

        log.info("Received sale request: lines={}, paymentType={}, customerId={}",
                request.getLines().size(), request.getPaymentType(), request.getCustomerId());

        Sale sale = transactionEngine.createSale(request.toCommand(tenantId, userId));
        return ResponseEntity.status(HttpStatus.CREATED).body(SaleResponse.from(sale));
    }

    @GetMapping("/{id}")
    public ResponseEntity<SaleResponse> getSale(
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId,
            @PathVariable("id") UUID id) {
        return ResponseEntity.ok(SaleResponse.from(saleService.getSale(tenantId, id)));
    }

    /**
     * Lines of the sale with the quantity that can still be returned.
     */
    @GetMapping("/{id}/returnable")
    public ResponseEntity<List<ReturnableLineResponse>> getReturnableLines(
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId,
            @PathVariable("id") UUID id) {
        return ResponseEntity.ok(returnService.getReturnableSaleLines(tenantId, id).stream()
            .map(ReturnableLineResponse::from)
            .toList());
    }

    @GetMapping("/{id}/returns")
    public ResponseEntity<List<ReturnResponse>> getReturns(
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId,
            @PathVariable("id") UUID id) {
        return ResponseEntity.ok(returnService.getCustomerReturns(tenantId, id).stream()
            .map(ReturnResponse::from)
            .toList());
    }
}
