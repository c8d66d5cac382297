package com.flagship.retail_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.returns.ReturnableLine;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class ReturnableLineResponse {

    @JsonProperty("line_id")
    UUID lineId;

    @JsonProperty("item_id")
    UUID itemId;

    @JsonProperty("line_number")
    int lineNumber;

    @JsonProperty("quantity")
    BigDecimal quantity;

    @JsonProperty("returned_quantity")
    BigDecimal returnedQuantity;

    @JsonProperty("remaining_quantity")
    BigDecimal remainingQuantity;

    public static ReturnableLineResponse from(ReturnableLine line) {
        return new ReturnableLineResponse(line.getLineId(), line.getItemId(), line.getLineNumber(),
            line.getQuantity(), line.getReturnedQuantity(), line.getRemainingQuantity());
    }
}
