package com.flagship.retail_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.stock.MovementSource;
import com.flagship.retail_ledger.stock.StockMovement;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class StockMovementResponse {

    @JsonProperty("source")
    MovementSource source;

    @JsonProperty("source_id")
    UUID sourceId;

    @JsonProperty("delta")
    BigDecimal delta;

    @JsonProperty("resulting_quantity")
    BigDecimal resultingQuantity;

    @JsonProperty("created_at")
    Instant createdAt;

    public static StockMovementResponse from(StockMovement movement) {
        return new StockMovementResponse(movement.getSource(), movement.getSourceId(), movement.getDelta(),
            movement.getResultingQuantity(), movement.getCreatedAt());
    }
}
