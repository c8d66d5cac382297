package com.flagship.retail_ledger.api;

import com.flagship.retail_ledger.api.dto.ReturnRequest;
import com.flagship.retail_ledger.api.dto.ReturnResponse;
import com.flagship.retail_ledger.engine.TransactionEngine;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/returns")
@RequiredArgsConstructor
@Slf4j
public class ReturnController {

    private final TransactionEngine transactionEngine;

    @PostMapping("/customers")
    public ResponseEntity<ReturnResponse> processCustomerReturn(
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId,
            @RequestHeader(ApiHeaders.USER_ID) String userId,
            @Valid @RequestBody ReturnRequest request) {

        log.info("Received customer return: saleId={}, itemId={}, quantity={}, type={}",
                request.getSourceId(), request.getItemId(), request.getQuantity(), request.getType());

        ReturnResponse response = ReturnResponse.from(
            transactionEngine.processCustomerReturn(request.toCustomerCommand(tenantId, userId)));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/suppliers")
    public ResponseEntity<ReturnResponse> processSupplierReturn(
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId,
            @RequestHeader(ApiHeaders.USER_ID) String userId,
            @Valid @RequestBody ReturnRequest request) {

        log.info("Received supplier return: purchaseId={}, itemId={}, quantity={}, type={}",
                request.getSourceId(), request.getItemId(), request.getQuantity(), request.getType());

        ReturnResponse response = ReturnResponse.from(
            transactionEngine.processSupplierReturn(request.toSupplierCommand(tenantId, userId)));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }
}
