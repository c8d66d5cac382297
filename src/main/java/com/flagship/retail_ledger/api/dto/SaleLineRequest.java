package com.flagship.retail_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.pricing.PriceTier;
import com.flagship.retail_ledger.sale.SaleLineCommand;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One sale line. Quantity is given either as {@code quantity} or as {@code cartons} plus
 * {@code pieces}, never both.
 */
@Value
public class SaleLineRequest {

    @NotNull(message = "Item ID is required")
    @JsonProperty("item_id")
    UUID itemId;

    @JsonProperty("quantity")
    BigDecimal quantity;

    @JsonProperty("cartons")
    Long cartons;

    @JsonProperty("pieces")
    Integer pieces;

    @JsonProperty("price_tier")
    PriceTier priceTier;

    @JsonProperty("line_discount")
    BigDecimal lineDiscount;

    public SaleLineCommand toCommand() {
        return SaleLineCommand.builder()
            .itemId(itemId)
            .quantity(quantity)
            .cartons(cartons)
            .pieces(pieces)
            .priceTier(priceTier)
            .lineDiscount(lineDiscount)
            .build();
    }
}
