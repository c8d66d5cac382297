package com.flagship.retail_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.returns.CustomerReturnCommand;
import com.flagship.retail_ledger.returns.ReturnType;
import com.flagship.retail_ledger.returns.SupplierReturnCommand;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Return against a sale ({@code /customers}) or a purchase ({@code /suppliers}). {@code source_id}
 * is the sale or purchase id; {@code line_id} is needed only when the item appears on more than
 * one line.
 */
@Value
public class ReturnRequest {

    @NotNull(message = "Source ID is required")
    @JsonProperty("source_id")
    UUID sourceId;

    @NotNull(message = "Item ID is required")
    @JsonProperty("item_id")
    UUID itemId;

    @JsonProperty("line_id")
    UUID lineId;

    @NotNull(message = "Quantity is required")
    @DecimalMin(value = "0", inclusive = false, message = "Quantity must be greater than 0")
    @JsonProperty("quantity")
    BigDecimal quantity;

    @NotNull(message = "Return type is required")
    @JsonProperty("type")
    ReturnType type;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0", message = "Amount cannot be negative")
    @JsonProperty("amount")
    BigDecimal amount;

    @Size(max = 500, message = "Reason must be at most 500 characters")
    @JsonProperty("reason")
    String reason;

    public CustomerReturnCommand toCustomerCommand(String tenantId, String userId) {
        return CustomerReturnCommand.builder()
            .tenantId(tenantId)
            .userId(userId)
            .saleId(sourceId)
            .itemId(itemId)
            .lineId(lineId)
            .quantity(quantity)
            .type(type)
            .amount(amount)
            .reason(reason)
            .build();
    }

    public SupplierReturnCommand toSupplierCommand(String tenantId, String userId) {
        return SupplierReturnCommand.builder()
            .tenantId(tenantId)
            .userId(userId)
            .purchaseId(sourceId)
            .itemId(itemId)
            .lineId(lineId)
            .quantity(quantity)
            .type(type)
            .amount(amount)
            .reason(reason)
            .build();
    }
}
