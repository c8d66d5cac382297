package com.flagship.retail_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.common.PaymentMethod;
import com.flagship.retail_ledger.common.PaymentType;
import com.flagship.retail_ledger.pricing.DiscountType;
import com.flagship.retail_ledger.pricing.PriceTier;
import com.flagship.retail_ledger.sale.Sale;
import com.flagship.retail_ledger.sale.SaleLine;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class SaleResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("lines")
    List<Line> lines;

    @JsonProperty("subtotal")
    BigDecimal subtotal;

    @JsonProperty("discount_type")
    DiscountType discountType;

    @JsonProperty("discount_value")
    BigDecimal discountValue;

    @JsonProperty("order_discount")
    BigDecimal orderDiscount;

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

    public static SaleResponse from(Sale sale) {
        return SaleResponse.builder()
            .id(sale.getId())
            .customerId(sale.getCustomerId())
            .lines(sale.getLines().stream().map(Line::from).toList())
            .subtotal(sale.getSubtotal())
            .discountType(sale.getDiscountType())
            .discountValue(sale.getDiscountValue())
            .orderDiscount(sale.getOrderDiscount())
            .totalAmount(sale.getTotalAmount())
            .paidAmount(sale.getPaidAmount())
            .paymentType(sale.getPaymentType())
            .paymentMethod(sale.getPaymentMethod())
            .createdBy(sale.getCreatedBy())
            .createdAt(sale.getCreatedAt())
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

        @JsonProperty("unit_price")
        BigDecimal unitPrice;

        @JsonProperty("price_tier")
        PriceTier priceTier;

        @JsonProperty("line_discount")
        BigDecimal lineDiscount;

        @JsonProperty("subtotal")
        BigDecimal subtotal;

        static Line from(SaleLine line) {
            return new Line(line.getId(), line.getItemId(), line.getQuantity(), line.getUnitPrice(),
                line.getPriceTier(), line.getLineDiscount(), line.getSubtotal());
        }
    }
}
