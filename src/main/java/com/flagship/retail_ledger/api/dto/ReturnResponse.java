package com.flagship.retail_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.returns.CustomerReturn;
import com.flagship.retail_ledger.returns.ReturnType;
import com.flagship.retail_ledger.returns.SupplierReturn;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ReturnResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("source_id")
    UUID sourceId;

    @JsonProperty("line_id")
    UUID lineId;

    @JsonProperty("item_id")
    UUID itemId;

    @JsonProperty("quantity")
    BigDecimal quantity;

    @JsonProperty("type")
    ReturnType type;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("created_at")
    Instant createdAt;

    public static ReturnResponse from(CustomerReturn customerReturn) {
        return ReturnResponse.builder()
            .id(customerReturn.getId())
            .sourceId(customerReturn.getSaleId())
            .lineId(customerReturn.getSaleLineId())
            .itemId(customerReturn.getItemId())
            .quantity(customerReturn.getQuantity())
            .type(customerReturn.getType())
            .amount(customerReturn.getAmount())
            .reason(customerReturn.getReason())
            .createdBy(customerReturn.getCreatedBy())
            .createdAt(customerReturn.getCreatedAt())
            .build();
    }

    public static ReturnResponse from(SupplierReturn supplierReturn) {
        return ReturnResponse.builder()
            .id(supplierReturn.getId())
            .sourceId(supplierReturn.getPurchaseId())
            .lineId(supplierReturn.getPurchaseLineId())
            .itemId(supplierReturn.getItemId())
            .quantity(supplierReturn.getQuantity())
            .type(supplierReturn.getType())
            .amount(supplierReturn.getAmount())
            .reason(supplierReturn.getReason())
            .createdBy(supplierReturn.getCreatedBy())
            .createdAt(supplierReturn.getCreatedAt())
            .build();
    }
}
