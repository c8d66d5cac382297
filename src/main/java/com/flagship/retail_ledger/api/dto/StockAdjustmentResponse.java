package com.flagship.retail_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.stock.AdjustmentType;
import com.flagship.retail_ledger.stock.StockAdjustment;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class StockAdjustmentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("item_id")
    UUID itemId;

    @JsonProperty("type")
    AdjustmentType type;

    @JsonProperty("quantity")
    BigDecimal quantity;

    @JsonProperty("previous_quantity")
    BigDecimal previousQuantity;

    @JsonProperty("new_quantity")
    BigDecimal newQuantity;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("created_at")
    Instant createdAt;

    public static StockAdjustmentResponse from(StockAdjustment adjustment) {
        return StockAdjustmentResponse.builder()
            .id(adjustment.getId())
            .itemId(adjustment.getItemId())
            .type(adjustment.getType())
            .quantity(adjustment.getQuantity())
            .previousQuantity(adjustment.getPreviousQuantity())
            .newQuantity(adjustment.getNewQuantity())
            .reason(adjustment.getReason())
            .userId(adjustment.getUserId())
            .createdAt(adjustment.getCreatedAt())
            .build();
    }
}
