package com.flagship.retail_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.engine.BulkStockRow;
import com.flagship.retail_ledger.stock.AdjustmentType;
import jakarta.validation.constraints.NotEmpty;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Rows are validated one by one by the engine, so a bad row is reported in the result instead of
 * rejecting the whole request.
 */
@Value
public class BulkStockAdjustmentRequest {

    @NotEmpty(message = "adjustments array is required")
    @JsonProperty("adjustments")
    List<Row> adjustments;

    public List<BulkStockRow> toRows() {
        return adjustments.stream()
            .map(row -> BulkStockRow.builder()
                .itemId(row.getItemId())
                .name(row.getName())
                .type(row.getType())
                .quantity(row.getQuantity())
                .reason(row.getReason())
                .build())
            .toList();
    }

    @Value
    public static class Row {
        @JsonProperty("item_id")
        UUID itemId;

        @JsonProperty("name")
        String name;

        @JsonProperty("type")
        AdjustmentType type;

        @JsonProperty("quantity")
        BigDecimal quantity;

        @JsonProperty("reason")
        String reason;
    }
}
