package com.orderly.orderservice.service;

import com.orderly.orderservice.model.Product;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Server-side pricing of an order.
 * <ul>
 * <li>unit price is the product's current price, whatever the client sent</li>
 * <li>subtotal is the sum of quantity x unit price</li>
 * <li>total = subtotal + shipping fee - discount, not clamped at zero</li>
 * </ul>
 */
@Component
public class PricingCalculator {

    public PriceQuote quote(List<OrderLine> lines, BigDecimal shippingFee, BigDecimal discount, String currency) {
        List<PriceQuote.PricedLine> priced = lines.stream()
                .map(PricingCalculator::price)
                .collect(Collectors.toList());

        BigDecimal subtotal = priced.stream()
                .map(PriceQuote.PricedLine::getTotalPrice)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal fee = shippingFee == null ? BigDecimal.ZERO : shippingFee;
        BigDecimal off = discount == null ? BigDecimal.ZERO : discount;

        // A discount larger than subtotal + fee gives a negative total; passed through as is
        BigDecimal total = subtotal.add(fee).subtract(off);

        return new PriceQuote(priced, subtotal, fee, off, total, currency);
    }

    private static PriceQuote.PricedLine price(OrderLine line) {
        Product product = line.getProduct();
        BigDecimal unitPrice = product.getPrice();
        BigDecimal lineTotal = unitPrice.multiply(BigDecimal.valueOf(line.getQuantity()));
        return new PriceQuote.PricedLine(product.getId(), product.getName(), line.getQuantity(), unitPrice, lineTotal);
    }
}
