package com.flagship.retail_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.stock.AdjustStockCommand;
import com.flagship.retail_ledger.stock.AdjustmentType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class AdjustStockRequest {

    @NotNull(message = "Item ID is required")
    @JsonProperty("item_id")
    UUID itemId;

    @NotNull(message = "Adjustment type is required")
    @JsonProperty("type")
    AdjustmentType type;

    @NotNull(message = "Quantity is required")
    @DecimalMin(value = "0", message = "Quantity cannot be negative")
    @JsonProperty("quantity")
    BigDecimal quantity;

    @NotBlank(message = "Reason is required")
    @Size(max = 500, message = "Reason must be at most 500 characters")
    @JsonProperty("reason")
    String reason;

    public AdjustStockCommand toCommand(String tenantId, String userId, String idempotencyKey) {
        return AdjustStockCommand.builder()
            .tenantId(tenantId)
            .userId(userId)
            .itemId(itemId)
            .type(type)
            .quantity(quantity)
            .reason(reason)
            .idempotencyKey(idempotencyKey)
            .build();
    }
}
