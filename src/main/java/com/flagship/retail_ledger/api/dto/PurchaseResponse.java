package com.flagship.retail_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.common.PaymentMethod;
import com.flagship.retail_ledger.common.PaymentType;
import com.flagship.retail_ledger.purchase.Purchase;
import com.flagship.retail_ledger.purchase.PurchaseLine;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class PurchaseResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("supplier_id")
    UUID supplierId;

    @JsonProperty("lines")
    List<Line> lines;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("paid_amount")
    BigDecimal paidAmount;

    @JsonProperty("payment_type")
    PaymentType paymentType;

    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("created_at")
    Instant createdAt;

    public static PurchaseResponse from(Purchase purchase) {
        return PurchaseResponse.builder()
            .id(purchase.getId())
            .supplierId(purchase.getSupplierId())
            .lines(purchase.getLines().stream().map(Line::from).toList())
            .totalAmount(purchase.getTotalAmount())
            .paidAmount(purchase.getPaidAmount())
            .paymentType(purchase.getPaymentType())
            .paymentMethod(purchase.getPaymentMethod())
            .createdBy(purchase.getCreatedBy())
            .createdAt(purchase.getCreatedAt())
            .build();
    }

    @Value
    public static class Line {
        @JsonProperty("id")
        UUID id;

        @JsonProperty("item_id")
        UUID itemId;

        @JsonProperty("quantity")
        BigDecimal quantity;

        @JsonProperty("unit_cost")
        BigDecimal unitCost;

        @JsonProperty("subtotal")
        BigDecimal subtotal;

        static Line from(PurchaseLine line) {
            return new Line(line.getId(), line.getItemId(), line.getQuantity(), line.getUnitCost(),
                line.getSubtotal());
        }
    }
}
