package com.orderly.orderservice.service;

import com.orderly.common.exception.ResourceNotFoundException;
import com.orderly.orderservice.config.OrderProperties;
import com.orderly.orderservice.config.ShipmentProperties;
import com.orderly.orderservice.dto.CustomerDto;
import com.orderly.orderservice.dto.ExternalStatusUpdateRequest;
import com.orderly.orderservice.dto.OrderItemRequest;
import com.orderly.orderservice.dto.OrderRequest;
import com.orderly.orderservice.dto.OrderResponse;
import com.orderly.orderservice.dto.OrderUpdateRequest;
import com.orderly.orderservice.dto.PaymentMethodResponse;
import com.orderly.orderservice.dto.PricingRequest;
import com.orderly.orderservice.dto.ShippingAddressDto;
import com.orderly.orderservice.exception.ExternalServiceException;
import com.orderly.orderservice.exception.OrderCodeGenerationException;
import com.orderly.orderservice.exception.OrderPersistenceException;
import com.orderly.orderservice.exception.OrderValidationException;
import com.orderly.orderservice.mapper.OrderMapper;
import com.orderly.orderservice.model.Order;
import com.orderly.orderservice.model.OrderStatus;
import com.orderly.orderservice.model.PaymentMethod;
import com.orderly.orderservice.model.PaymentStatus;
import com.orderly.orderservice.model.Product;
import com.orderly.orderservice.model.ShippingAddress;
import com.orderly.orderservice.model.ShippingStatus;
import com.orderly.orderservice.repository.OrderRepository;
import com.orderly.orderservice.repository.ProductRepository;
import com.orderly.orderservice.shipment.ShipmentGatewayClient;
import com.orderly.orderservice.shipment.ShipmentResponse;
import com.orderly.orderservice.shipment.ShipmentResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class OrderServiceImpl implements OrderService {

    static final String CREATE_SHIPMENT_FAILED =
            "Failed to create shipment. Order was not created. Please try again.";
    static final String CANCEL_SHIPMENT_FAILED =
            "Failed to cancel shipment. Order status was not updated. Please try again.";

    private final OrderRepository orderRepository;
    private final ProductRepository productRepository;
    private final PricingCalculator pricingCalculator;
    private final BusinessKeyGenerator keyGenerator;
    private final ShipmentGatewayClient shipmentGatewayClient;
    private final OrderPersistenceService orderPersistenceService;
    private final OrderMapper orderMapper;
    private final OrderProperties orderProperties;
    private final ShipmentProperties shipmentProperties;

    // Deliberately not @Transactional: the provider call must not hold a database transaction open.
    @Override
    public OrderResponse createOrder(OrderRequest request) {
        log.info("Order creation process started. customerPhone={}, items={}",
                request.getCustomer().getPhone(), request.getItems().size());

        // 1. Resolve products and price the cart. Client-sent prices are never used.
        List<OrderLine> lines = resolveLines(request.getItems());
        PricingRequest pricing = request.getPricing();
        PriceQuote quote = pricingCalculator.quote(
                lines,
                pricing != null ? pricing.getShippingFee() : null,
                pricing != null ? pricing.getDiscount() : null,
                pricing != null && pricing.getCurrency() != null ? pricing.getCurrency() : orderProperties.getDefaultCurrency());
        log.info("Cart validated. subtotal={}, totalAmount={}, currency={}",
                quote.getSubtotal(), quote.getTotalAmount(), quote.getCurrency());

        int maxAttempts = orderProperties.getCodeMaxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            // 2. Allocate an order code
            String orderCode = keyGenerator.nextOrderCode();
            if (isOrderCodeTaken(orderCode)) {
                log.warn("Generated order code already in use, regenerating. orderCode={}, attempt={}", orderCode, attempt);
                continue;
            }

            // 3. Register the shipment. Entities are rebuilt on every attempt.
            Order order = buildOrder(orderCode, request, quote);
            ShipmentResult shipment = shipmentGatewayClient.createShipment(order);
            requireShipmentSuccess(shipment, orderCode, CREATE_SHIPMENT_FAILED);
            applyShipmentResponse(order, shipment.getResponse());

            // 4. Persist
            try {
                OrderResponse response = orderPersistenceService.insert(order);
                log.info("Order created successfully. orderId={}, orderCode={}, shippingOrderCode={}",
                        response.getId(), orderCode, order.getShippingOrderCode());
                return response;
            } catch (DataIntegrityViolationException e) {
                if (!collidedOnOrderCode(orderCode, e)) {
                    throw persistenceFailure(order, e);
                }
                log.warn("Order code taken by a concurrent request after shipment creation. " +
                                "RECONCILIATION REQUIRED: shippingOrderCode={} has no local order. orderCode={}, attempt={}",
                        order.getShippingOrderCode(), orderCode, attempt);
            } catch (DataAccessException e) {
                throw persistenceFailure(order, e);
            }
        }

        log.error("Order code allocation exhausted after {} attempts", maxAttempts);
        throw new OrderCodeGenerationException("Could not allocate a unique order code after " + maxAttempts + " attempts");
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderResponse> getOrders(Integer skip, Integer limit) {
        PageWindow window = PageWindow.of(skip, limit, orderProperties);

        List<UUID> ids = orderRepository.findPageIds(window.getSkip(), window.getLimit());
        if (ids.isEmpty()) {
            return List.of();
        }

        // the fetch join loses the ordering, restore it from the id page
        Map<UUID, Order> byId = orderRepository.findAllByIdIn(ids).stream()
                .collect(Collectors.toMap(Order::getId, Function.identity()));
        List<OrderResponse> page = new ArrayList<>(ids.size());
        for (UUID id : ids) {
            Order order = byId.get(id);
            if (order != null) {
                page.add(orderMapper.toOrderResponse(order));
            }
        }
        return page;
    }

    @Override
    @Transactional(readOnly = true)
    public OrderResponse getOrderById(UUID id) {
        Order order = orderRepository.findWithItemsById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Order with ID " + id + " not found."));
        return orderMapper.toOrderResponse(order);
    }

    @Override
    @Transactional(readOnly = true)
    public OrderResponse getOrderByCode(String orderCode) {
        return orderMapper.toOrderResponse(findByCode(orderCode));
    }

    @Override
    public OrderResponse updateOrder(String orderCode, OrderUpdateRequest request) {
        log.info("Order update requested. orderCode={}, orderStatus={}", orderCode, request.getOrderStatus());
        return transition(findByCode(orderCode), request);
    }

    @Override
    public OrderResponse cancelOrder(String orderCode) {
        log.info("Order cancellation requested. orderCode={}", orderCode);
        Order order = findByCode(orderCode);

        if (order.getOrderStatus() == OrderStatus.CANCELLED) {
            log.warn("Order is already cancelled. orderCode={}", orderCode);
            throw OrderValidationException.forField("orderStatus", "Order is already cancelled.");
        }

        OrderUpdateRequest cancellation = new OrderUpdateRequest();
        cancellation.setOrderStatus(OrderStatus.CANCELLED);
        return transition(order, cancellation);
    }

    @Override
    public OrderResponse applyExternalStatusUpdate(String orderCode, ExternalStatusUpdateRequest request) {
        log.info("External status update received. orderCode={}, orderStatus={}, shippingStatus={}",
                orderCode, request.getOrderStatus(), request.getShippingStatus());
        Order order = findByCode(orderCode);

        if (request.getOrderCode() != null && !request.getOrderCode().equals(orderCode)) {
            throw OrderValidationException.forField("orderCode", "Order code in body does not match the path.");
        }
        if (request.getOrderId() != null && !request.getOrderId().equals(order.getId())) {
            throw OrderValidationException.forField("orderId", "Order ID in body does not match the order.");
        }

        // the provider is the source of this change, so it is never called back
        return orderPersistenceService.applyUpdate(orderCode, request, null);
    }

    @Override
    public List<PaymentMethodResponse> getPaymentMethods() {
        return Arrays.stream(PaymentMethod.values())
                .map(method -> new PaymentMethodResponse(method.name(), method.getDisplayName()))
                .collect(Collectors.toList());
    }

    private OrderResponse transition(Order order, OrderUpdateRequest update) {
        String orderCode = order.getOrderCode();

        if (order.getOrderStatus() == OrderStatus.PENDING && update.getOrderStatus() == OrderStatus.CANCELLED) {
            log.info("Cancelling shipment before cancelling order. orderCode={}", orderCode);
            ShipmentResult result = shipmentGatewayClient.cancelShipment(orderCode);
            requireShipmentSuccess(result, orderCode, CANCEL_SHIPMENT_FAILED);
            try {
                // pinned version: a concurrent change since the check fails the write
                return orderPersistenceService.applyUpdate(orderCode, update, order.getVersion());
            } catch (DataAccessException e) {
                log.error("RECONCILIATION REQUIRED: shipment for order {} was cancelled at the provider " +
                        "but the order could not be updated. shippingOrderCode={}", orderCode, order.getShippingOrderCode(), e);
                throw new OrderPersistenceException(
                        "Shipment was cancelled but the order could not be updated. Please contact support.",
                        order.getShippingOrderCode(), e);
            }
        }

        return orderPersistenceService.applyUpdate(orderCode, update, null);
    }

    private Order findByCode(String orderCode) {
        return orderRepository.findByOrderCode(orderCode)
                .orElseThrow(() -> new ResourceNotFoundException("Order with code " + orderCode + " not found."));
    }

    private List<OrderLine> resolveLines(List<OrderItemRequest> items) {
        List<String> productIds = items.stream()
                .map(OrderItemRequest::getProductId)
                .distinct()
                .collect(Collectors.toList());

        // one query for all products (avoids N+1)
        Map<String, Product> products = productRepository.findAllById(productIds).stream()
                .collect(Collectors.toMap(Product::getId, Function.identity()));

        List<OrderLine> lines = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            OrderItemRequest item = items.get(i);
            Product product = products.get(item.getProductId());
            if (product == null) {
                log.warn("Order rejected, unknown product. productId={}", item.getProductId());
                throw new ResourceNotFoundException("Product with ID " + item.getProductId() + " not found.");
            }
            if (!product.isActive()) {
                log.warn("Order rejected, product not active. productId={}, status={}", product.getId(), product.getStatus());
                throw OrderValidationException.forField("items[" + i + "].productId",
                        "Product " + product.getId() + " is not active.");
            }
            lines.add(new OrderLine(product, item.getQuantity()));
        }
        return lines;
    }

    private Order buildOrder(String orderCode, OrderRequest request, PriceQuote quote) {
        Order order = new Order();
        order.setOrderCode(orderCode);
        order.setCustomer(orderMapper.toCustomer(request.getCustomer()));
        order.setReceiver(resolveReceiver(request));
        order.setPricing(quote.toPricing());
        quote.getLines().forEach(line -> order.addItem(line.toOrderItem()));
        order.setPaymentMethod(request.getPaymentMethod() != null ? request.getPaymentMethod() : PaymentMethod.COD);
        order.setPaymentStatus(request.getPaymentStatus() != null ? request.getPaymentStatus() : PaymentStatus.PENDING);
        order.setShippingStatus(ShippingStatus.NOT_CREATED);
        order.setOrderStatus(OrderStatus.CONFIRMED);
        return order;
    }

    // Missing receiver details fall back to the customer and the configured default address
    private ShippingAddress resolveReceiver(OrderRequest request) {
        CustomerDto customer = request.getCustomer();
        ShippingAddressDto address = request.getShipping() != null ? request.getShipping().getAddress() : null;

        ShippingAddress receiver = new ShippingAddress();
        receiver.setReceiverName(firstNonBlank(address != null ? address.getReceiverName() : null, customer.getName()));
        receiver.setReceiverPhone(firstNonBlank(address != null ? address.getReceiverPhone() : null, customer.getPhone()));
        receiver.setFullAddress(firstNonBlank(address != null ? address.getFullAddress() : null,
                shipmentProperties.getDefaultReceiverAddress()));
        return receiver;
    }

    private void applyShipmentResponse(Order order, ShipmentResponse response) {
        if (response == null) {
            order.setShippingStatus(ShippingStatus.CREATED);
            return;
        }

        if (response.getShippingOrderCode() != null && !response.getShippingOrderCode().isBlank()) {
            order.setShippingOrderCode(response.getShippingOrderCode());
        }

        ShippingStatus status = ShippingStatus.fromProvider(response.getStatus());
        if (status != null && !ShippingStatus.isKnownProviderStatus(response.getStatus())) {
            log.warn("Unknown shipping status from shipment provider, treating as CREATED. orderCode={}, status={}",
                    order.getOrderCode(), response.getStatus());
        }
        order.setShippingStatus(status != null ? status : ShippingStatus.CREATED);

        if (response.getShipper() != null) {
            order.setShipper(orderMapper.toShipper(response.getShipper()));
        }

        if (response.getEstimatedDeliveryTime() != null) {
            order.setEstimatedDeliveryTime(parseDeliveryTime(order.getOrderCode(), response.getEstimatedDeliveryTime()));
        }

        if (response.getOrderStatus() != null) {
            try {
                order.setOrderStatus(OrderStatus.valueOf(response.getOrderStatus().trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring unknown order status from shipment provider. orderCode={}, orderStatus={}",
                        order.getOrderCode(), response.getOrderStatus());
            }
        }
    }

    // ISO-8601 with or without offset; values without one are read as UTC
    private Instant parseDeliveryTime(String orderCode, String value) {
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException withOffset) {
            try {
                return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException withoutOffset) {
                log.warn("Ignoring unparseable estimated delivery time. orderCode={}, value={}", orderCode, value);
                return null;
            }
        }
    }

    private void requireShipmentSuccess(ShipmentResult result, String orderCode, String failureMessage) {
        switch (result.getOutcome()) {
            case SUCCESS:
                return;
            case FAILURE:
                log.error("Shipment provider rejected the request. orderCode={}, httpStatus={}, detail={}",
                        orderCode, result.getHttpStatus(), result.getDetail());
                break;
            case TIMEOUT:
                log.error("Shipment provider timed out. orderCode={}, timeout={}", orderCode, shipmentProperties.getTimeout());
                break;
            case TRANSPORT_ERROR:
                log.error("Shipment provider unreachable. orderCode={}, detail={}", orderCode, result.getDetail());
                break;
            default:
                throw new IllegalStateException("Unhandled shipment outcome: " + result.getOutcome());
        }
        throw new ExternalServiceException(failureMessage);
    }

    private boolean isOrderCodeTaken(String orderCode) {
        return orderRepository.existsByOrderCode(orderCode);
    }

    // true when the violation was the order code unique constraint, i.e. another request took the code
    private boolean collidedOnOrderCode(String orderCode, DataIntegrityViolationException violation) {
        try {
            return isOrderCodeTaken(orderCode);
        } catch (DataAccessException lookupFailure) {
            violation.addSuppressed(lookupFailure);
            return false;
        }
    }

    private OrderPersistenceException persistenceFailure(Order order, DataAccessException cause) {
        log.error("RECONCILIATION REQUIRED: shipment {} was created at the provider but order {} could not be stored",
                order.getShippingOrderCode(), order.getOrderCode(), cause);
        return new OrderPersistenceException(
                "Order could not be saved after the shipment was created. Please contact support.",
                order.getShippingOrderCode(), cause);
    }

    private static String firstNonBlank(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }
}
