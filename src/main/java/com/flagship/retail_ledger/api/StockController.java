package com.flagship.retail_ledger.api;

import com.flagship.retail_ledger.api.dto.AdjustStockRequest;
import com.flagship.retail_ledger.api.dto.BulkStockAdjustmentRequest;
import com.flagship.retail_ledger.api.dto.StockAdjustmentResponse;
import com.flagship.retail_ledger.api.dto.StockMovementResponse;
import com.flagship.retail_ledger.engine.BulkResult;
import com.flagship.retail_ledger.engine.TransactionEngine;
import com.flagship.retail_ledger.idempotency.IdempotentResult;
import com.flagship.retail_ledger.stock.StockAdjustment;
import com.flagship.retail_ledger.stock.StockAdjustmentService;
import com.flagship.retail_ledger.stock.StockLedger;
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
@RequestMapping("/api/stock")
@RequiredArgsConstructor
@Slf4j
public class StockController {

    private final TransactionEngine transactionEngine;
    private final StockAdjustmentService stockAdjustmentService;
    private final StockLedger stockLedger;

    /**
     * Manual adjustment. Idempotency-Key is required; a repeated key returns the stored
     * adjustment with 200.
     */
    @PostMapping("/adjustments")
    public ResponseEntity<StockAdjustmentResponse> adjustStock(
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId,
            @RequestHeader(ApiHeaders.USER_ID) String userId,
            @RequestHeader(ApiHeaders.IDEMPOTENCY_KEY) String idempotencyKey,
            @Valid @RequestBody AdjustStockRequest request) {

        log.info("Received stock adjustment: itemId={}, type={}, quantity={}, idempotencyKey={}",
                request.getItemId(), request.getType(), request.getQuantity(), idempotencyKey);

        IdempotentResult<StockAdjustment> result = transactionEngine.adjustStock(
            request.toCommand(tenantId, userId, idempotencyKey));
        HttpStatus status = result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(StockAdjustmentResponse.from(result.getValue()));
    }

    @PostMapping("/adjustments/bulk")
    public ResponseEntity<BulkResult> bulkAdjustStock(
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId,
            @RequestHeader(ApiHeaders.USER_ID) String userId,
            @RequestHeader(ApiHeaders.IDEMPOTENCY_KEY) String idempotencyKey,
            @Valid @RequestBody BulkStockAdjustmentRequest request) {

        log.info("Received bulk stock adjustment: rows={}, idempotencyKey={}",
                request.getAdjustments().size(), idempotencyKey);

        return ResponseEntity.ok(transactionEngine.bulkAdjustStock(
            tenantId, userId, idempotencyKey, request.toRows()));
    }

    @GetMapping("/items/{itemId}/movements")
    public ResponseEntity<List<StockMovementResponse>> getMovements(
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId,
            @PathVariable("itemId") UUID itemId) {
        return ResponseEntity.ok(stockLedger.getMovements(tenantId, itemId).stream()
            .map(StockMovementResponse::from)
            .toList());
    }

    @GetMapping("/items/{itemId}/adjustments")
    public ResponseEntity<List<StockAdjustmentResponse>> getAdjustments(
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId,
            @PathVariable("itemId") UUID itemId) {
        return ResponseEntity.ok(stockAdjustmentService.getAdjustments(tenantId, itemId).stream()
            .map(StockAdjustmentResponse::from)
            .toList());
    }
}
