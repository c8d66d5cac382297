package com.flagship.retail_ledger.pricing;

import com.flagship.retail_ledger.catalog.Item;
import com.flagship.retail_ledger.exception.TierUnavailableException;
import com.flagship.retail_ledger.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Price selection and discount arithmetic for sale lines and orders.
 *
 * Pure: no persistence and no state. All amounts are rounded to {@link #MONEY_SCALE} places.
 */
@Component
public class PricingResolver {

    public static final int MONEY_SCALE = 2;

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    /**
     * Returns the item's price for the given tier.
     *
     * @throws TierUnavailableException if the item carries no price for that tier
     */
    public BigDecimal resolveUnitPrice(Item item, PriceTier tier) {
        BigDecimal price = switch (tier) {
            case DEFAULT -> item.getSellingPrice();
            case RETAIL -> item.getRetailPrice();
            case WHOLESALE -> item.getWholesalePrice();
            case PROMO -> item.getPromoPrice();
        };
        if (price == null) {
            throw new TierUnavailableException(item.getId(), tier);
        }
        return money(price);
    }

    /**
     * Resolves the requested tier, falling back to {@link PriceTier#DEFAULT} when the item has
     * no price for it.
     */
    public ResolvedPrice resolveUnitPriceOrDefault(Item item, PriceTier tier) {
        PriceTier requested = tier != null ? tier : PriceTier.DEFAULT;
        try {
            return new ResolvedPrice(requested, resolveUnitPrice(item, requested));
        } catch (TierUnavailableException e) {
            return new ResolvedPrice(PriceTier.DEFAULT, resolveUnitPrice(item, PriceTier.DEFAULT));
        }
    }

    /**
     * Line subtotal {@code unitPrice * quantity - discount}. The discount is capped at the gross
     * line value so the subtotal never goes below zero.
     */
    public BigDecimal applyLineDiscount(BigDecimal unitPrice, BigDecimal quantity, BigDecimal discountAmount) {
        return priceLine(unitPrice, quantity, discountAmount).getSubtotal();
    }

    /**
     * Prices a line and reports the discount that was actually applied. A discount larger than
     * the gross line value is cut down to it.
     */
    public LineAmount priceLine(BigDecimal unitPrice, BigDecimal quantity, BigDecimal discountAmount) {
        BigDecimal discount = discountAmount != null ? discountAmount : BigDecimal.ZERO;
        if (discount.signum() < 0) {
            throw new ValidationException("Line discount must not be negative");
        }
        BigDecimal gross = money(unitPrice.multiply(quantity));
        BigDecimal effective = money(discount).min(gross);
        return new LineAmount(effective, gross.subtract(effective));
    }

    /**
     * Discount amount an order discount takes off the given subtotal.
     */
    public BigDecimal orderDiscountAmount(BigDecimal subtotalSum, DiscountType type, BigDecimal value) {
        if (type == null || value == null) {
            return money(BigDecimal.ZERO);
        }
        if (value.signum() < 0) {
            throw new ValidationException("Order discount must not be negative");
        }
        BigDecimal subtotal = subtotalSum.max(BigDecimal.ZERO);
        BigDecimal discount = switch (type) {
            case PERCENT -> subtotal.multiply(value).divide(ONE_HUNDRED, MONEY_SCALE, RoundingMode.HALF_UP).min(subtotal);
            case AMOUNT -> value.min(subtotal);
        };
        return money(discount.max(BigDecimal.ZERO));
    }

    /**
     * Order total after the order discount, floored at zero.
     */
    public BigDecimal applyOrderDiscount(BigDecimal subtotalSum, DiscountType type, BigDecimal value) {
        BigDecimal total = subtotalSum.subtract(orderDiscountAmount(subtotalSum, type, value));
        return money(total.max(BigDecimal.ZERO));
    }

    static BigDecimal money(BigDecimal amount) {
        return amount.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
