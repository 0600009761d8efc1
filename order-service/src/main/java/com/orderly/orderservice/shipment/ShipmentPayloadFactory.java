package com.orderly.orderservice.shipment;

import com.orderly.orderservice.config.ShipmentProperties;
import com.orderly.orderservice.model.Order;
import com.orderly.orderservice.model.OrderItem;
import com.orderly.orderservice.model.PaymentMethod;
import com.orderly.orderservice.model.ShippingAddress;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Translates an order aggregate into the provider's shipment payload.
 */
@Component
@RequiredArgsConstructor
public class ShipmentPayloadFactory {

    private final ShipmentProperties properties;

    public ShipmentRequest build(Order order) {
        ShippingAddress receiver = order.getReceiver();
        String receiverAddress = isBlank(receiver.getFullAddress())
                ? properties.getDefaultReceiverAddress()
                : receiver.getFullAddress();
        ParsedAddress parsed = AddressParser.parse(receiverAddress);

        List<ShipmentItemPayload> items = order.getItems().stream()
                .map(item -> ShipmentItemPayload.builder()
                        .productId(item.getProductId())
                        .productName(item.getProductName())
                        .productSku(item.getProductId())
                        .quantity(item.getQuantity())
                        .unitPrice(item.getUnitPrice())
                        .build())
                .collect(Collectors.toList());

        BigDecimal dimension = properties.getPackageDimensionCm();

        return ShipmentRequest.builder()
                .orderCode(order.getOrderCode())
                .senderName(nullToEmpty(order.getCustomer().getName()))
                .senderPhone(nullToEmpty(order.getCustomer().getPhone()))
                .senderAddress(receiverAddress)
                .senderCity(parsed.getCity())
                .senderDistrict(parsed.getDistrict())
                .senderWard(parsed.getWard())
                .receiverName(nullToEmpty(receiver.getReceiverName()))
                .receiverPhone(nullToEmpty(receiver.getReceiverPhone()))
                .receiverAddress(receiverAddress)
                .receiverCity(parsed.getCity())
                .receiverDistrict(parsed.getDistrict())
                .receiverWard(parsed.getWard())
                .packageWeight(packageWeight(order.getItems()))
                .packageLength(dimension)
                .packageWidth(dimension)
                .packageHeight(dimension)
                .packageValue(order.getPricing().getSubtotal())
                .packageDescription(describe(order.getItems()))
                .shippingFee(order.getPricing().getShippingFee())
                .codAmount(codAmount(order))
                .estimatedDeliveryTime(order.getEstimatedDeliveryTime())
                .actualDeliveryTime(order.getDeliveredAt())
                .carrierCode("")
                .serviceType(properties.getServiceType())
                .createdBy(nullToEmpty(order.getCustomer().getCustomerId()))
                .items(items)
                .build();
    }

    /**
     * Nominal weight per unit times quantity, floored at the configured minimum.
     */
    BigDecimal packageWeight(List<OrderItem> items) {
        BigDecimal total = items.stream()
                .map(item -> properties.getItemWeightKg().multiply(BigDecimal.valueOf(item.getQuantity())))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return total.max(properties.getMinimumWeightKg());
    }

    // Cash is collected on delivery only for COD orders
    BigDecimal codAmount(Order order) {
        return order.getPaymentMethod() == PaymentMethod.COD
                ? order.getPricing().getTotalAmount()
                : BigDecimal.ZERO;
    }

    private static String describe(List<OrderItem> items) {
        return items.stream()
                .map(item -> item.getProductName() + " x" + item.getQuantity())
                .collect(Collectors.joining(", "));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
