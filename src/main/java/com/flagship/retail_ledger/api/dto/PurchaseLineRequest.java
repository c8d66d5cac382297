package com.flagship.retail_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.purchase.PurchaseLineCommand;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class PurchaseLineRequest {

    @NotNull(message = "Item ID is required")
    @JsonProperty("item_id")
    UUID itemId;

    @JsonProperty("quantity")
    BigDecimal quantity;

    @JsonProperty("cartons")
    Long cartons;

    @JsonProperty("pieces")
    Integer pieces;

    /**
     * Invoice cost per unit; the item's cost price when absent.
     */
    @DecimalMin(value = "0", message = "Unit cost cannot be negative")
    @JsonProperty("unit_cost")
    BigDecimal unitCost;

    public PurchaseLineCommand toCommand() {
        return PurchaseLineCommand.builder()
            .itemId(itemId)
            .quantity(quantity)
            .cartons(cartons)
            .pieces(pieces)
            .unitCost(unitCost)
            .build();
    }
}
