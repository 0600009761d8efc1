package com.orderly.orderservice.service;

import com.orderly.orderservice.model.OrderItem;
import com.orderly.orderservice.model.Pricing;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Immutable result of {@link PricingCalculator}. New entities are cut from it
 * on demand, so one quote can back several persistence attempts.
 */
@Getter
@RequiredArgsConstructor
public class PriceQuote {

    private final List<PricedLine> lines;
    private final BigDecimal subtotal;
    private final BigDecimal shippingFee;
    private final BigDecimal discount;
    private final BigDecimal totalAmount;
    private final String currency;

    public Pricing toPricing() {
        Pricing pricing = new Pricing();
        pricing.setSubtotal(subtotal);
        pricing.setShippingFee(shippingFee);
        pricing.setDiscount(discount);
        pricing.setTotalAmount(totalAmount);
        pricing.setCurrency(currency);
        return pricing;
    }

    @Getter
    @RequiredArgsConstructor
    public static class PricedLine {
        private final String productId;
        private final String productName;
        private final int quantity;
        private final BigDecimal unitPrice;
        private final BigDecimal totalPrice;

        public OrderItem toOrderItem() {
            OrderItem item = new OrderItem();
            item.setProductId(productId);
            item.setProductName(productName);
            item.setQuantity(quantity);
            item.setUnitPrice(unitPrice);
            item.setTotalPrice(totalPrice);
            return item;
        }
    }
}
