package com.orderly.orderservice.service;

import com.orderly.common.exception.ResourceNotFoundException;
import com.orderly.orderservice.OrderFixtures;
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
import com.orderly.orderservice.model.ProductStatus;
import com.orderly.orderservice.model.ShippingStatus;
import com.orderly.orderservice.repository.OrderRepository;
import com.orderly.orderservice.repository.ProductRepository;
import com.orderly.orderservice.shipment.ShipmentGatewayClient;
import com.orderly.orderservice.shipment.ShipmentResponse;
import com.orderly.orderservice.shipment.ShipmentResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OrderServiceImplTest {

    @Mock
    private OrderRepository orderRepository;
    @Mock
    private ProductRepository productRepository;
    @Mock
    private BusinessKeyGenerator keyGenerator;
    @Mock
    private ShipmentGatewayClient shipmentGatewayClient;
    @Mock
    private OrderPersistenceService orderPersistenceService;
    @Mock
    private OrderMapper orderMapper;
    @Spy
    private PricingCalculator pricingCalculator = new PricingCalculator();
    @Spy
    private OrderProperties orderProperties = new OrderProperties();
    @Spy
    private ShipmentProperties shipmentProperties = new ShipmentProperties();

    @InjectMocks
    private OrderServiceImpl orderService;

    private Product coffee;
    private OrderRequest request;

    @BeforeEach
    void setUp() {
        coffee = OrderFixtures.product("p-1", "25000.00");

        OrderItemRequest item = new OrderItemRequest();
        item.setProductId("p-1");
        item.setQuantity(2);

        PricingRequest pricing = new PricingRequest();
        pricing.setShippingFee(new BigDecimal("15000"));
        pricing.setDiscount(new BigDecimal("5000"));

        request = new OrderRequest();
        request.setCustomer(new CustomerDto("cust-1", "Nguyen Van A", "0900000001", null));
        request.setItems(List.of(item));
        request.setPricing(pricing);
    }

    private static ShipmentResult accepted(String shippingOrderCode, String status) {
        ShipmentResponse response = new ShipmentResponse();
        response.setShippingOrderCode(shippingOrderCode);
        response.setStatus(status);
        return ShipmentResult.success(201, response);
    }

    private void stubPersistenceEcho() {
        when(orderPersistenceService.insert(any(Order.class))).thenAnswer(invocation -> {
            Order order = invocation.getArgument(0);
            return OrderResponse.builder().orderCode(order.getOrderCode()).orderStatus(order.getOrderStatus()).build();
        });
    }

    @Test
    void createOrder_Success() {
        // Arrange
        when(productRepository.findAllById(any())).thenReturn(List.of(coffee));
        when(keyGenerator.nextOrderCode()).thenReturn("ORD-20240101-120000-0001");
        when(orderRepository.existsByOrderCode("ORD-20240101-120000-0001")).thenReturn(false);
        when(shipmentGatewayClient.createShipment(any(Order.class))).thenReturn(accepted("GHN-1", "PENDING"));
        stubPersistenceEcho();

        // Act
        OrderResponse response = orderService.createOrder(request);

        // Assert
        ArgumentCaptor<Order> captor = ArgumentCaptor.forClass(Order.class);
        verify(orderPersistenceService).insert(captor.capture());
        Order saved = captor.getValue();

        assertThat(response.getOrderCode()).isEqualTo("ORD-20240101-120000-0001");
        assertThat(saved.getOrderStatus()).isEqualTo(OrderStatus.CONFIRMED);
        assertThat(saved.getShippingOrderCode()).isEqualTo("GHN-1");
        assertThat(saved.getShippingStatus()).isEqualTo(ShippingStatus.CREATED);
        assertThat(saved.getPaymentMethod()).isEqualTo(PaymentMethod.COD);
        assertThat(saved.getPaymentStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(saved.getPricing().getSubtotal()).isEqualByComparingTo("50000.00");
        assertThat(saved.getPricing().getTotalAmount()).isEqualByComparingTo("60000.00");
        assertThat(saved.getPricing().getCurrency()).isEqualTo("VND");
        assertThat(saved.getItems()).hasSize(1);
        assertThat(saved.getItems().get(0).getUnitPrice()).isEqualByComparingTo("25000.00");
        assertThat(saved.getItems().get(0).getOrder()).isSameAs(saved);
        // receiver falls back to customer and default address
        assertThat(saved.getReceiver().getReceiverName()).isEqualTo("Nguyen Van A");
        assertThat(saved.getReceiver().getFullAddress()).isEqualTo("Ho Chi Minh City, Vietnam");
    }

    @Test
    void createOrder_TwoItemsWithoutFees_TotalEqualsSubtotal() {
        OrderItemRequest three = new OrderItemRequest();
        three.setProductId("p-100");
        three.setQuantity(3);
        OrderItemRequest one = new OrderItemRequest();
        one.setProductId("p-50");
        one.setQuantity(1);
        request.setItems(List.of(three, one));
        request.setPricing(null);

        when(productRepository.findAllById(any()))
                .thenReturn(List.of(OrderFixtures.product("p-50", "50"), OrderFixtures.product("p-100", "100")));
        when(keyGenerator.nextOrderCode()).thenReturn("ORD-A");
        when(orderRepository.existsByOrderCode("ORD-A")).thenReturn(false);
        when(shipmentGatewayClient.createShipment(any(Order.class))).thenReturn(accepted("GHN-1", "IN_TRANSIT"));
        stubPersistenceEcho();

        orderService.createOrder(request);

        ArgumentCaptor<Order> captor = ArgumentCaptor.forClass(Order.class);
        verify(orderPersistenceService).insert(captor.capture());
        Order saved = captor.getValue();
        assertThat(saved.getPricing().getSubtotal()).isEqualByComparingTo("350");
        assertThat(saved.getPricing().getTotalAmount()).isEqualByComparingTo("350");
        assertThat(saved.getShippingStatus()).isEqualTo(ShippingStatus.DELIVERING);
        // line order follows the request, not the repository result
        assertThat(saved.getItems()).extracting(item -> item.getProductId()).containsExactly("p-100", "p-50");
    }

    @Test
    void createOrder_ProviderFieldsOverrideDefaults() {
        ShipmentResponse response = new ShipmentResponse();
        response.setShippingOrderCode("GHN-2");
        response.setStatus("PICKED");
        response.setOrderStatus("pending");
        response.setEstimatedDeliveryTime("2024-01-03T10:00:00");

        when(productRepository.findAllById(any())).thenReturn(List.of(coffee));
        when(keyGenerator.nextOrderCode()).thenReturn("ORD-A");
        when(orderRepository.existsByOrderCode("ORD-A")).thenReturn(false);
        when(shipmentGatewayClient.createShipment(any(Order.class))).thenReturn(ShipmentResult.success(200, response));
        stubPersistenceEcho();

        orderService.createOrder(request);

        ArgumentCaptor<Order> captor = ArgumentCaptor.forClass(Order.class);
        verify(orderPersistenceService).insert(captor.capture());
        assertThat(captor.getValue().getOrderStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(captor.getValue().getShippingStatus()).isEqualTo(ShippingStatus.PICKED);
        assertThat(captor.getValue().getEstimatedDeliveryTime()).isEqualTo(Instant.parse("2024-01-03T10:00:00Z"));
    }

    @Test
    void createOrder_UnparseableDeliveryTime_IsIgnored() {
        ShipmentResponse response = new ShipmentResponse();
        response.setEstimatedDeliveryTime("next tuesday");

        when(productRepository.findAllById(any())).thenReturn(List.of(coffee));
        when(keyGenerator.nextOrderCode()).thenReturn("ORD-A");
        when(orderRepository.existsByOrderCode("ORD-A")).thenReturn(false);
        when(shipmentGatewayClient.createShipment(any(Order.class))).thenReturn(ShipmentResult.success(200, response));
        stubPersistenceEcho();

        orderService.createOrder(request);

        ArgumentCaptor<Order> captor = ArgumentCaptor.forClass(Order.class);
        verify(orderPersistenceService).insert(captor.capture());
        assertThat(captor.getValue().getEstimatedDeliveryTime()).isNull();
        assertThat(captor.getValue().getShippingStatus()).isEqualTo(ShippingStatus.CREATED);
    }

    @Test
    void createOrder_GatewayRejects_NothingPersisted() {
        when(productRepository.findAllById(any())).thenReturn(List.of(coffee));
        when(keyGenerator.nextOrderCode()).thenReturn("ORD-A");
        when(orderRepository.existsByOrderCode("ORD-A")).thenReturn(false);
        when(shipmentGatewayClient.createShipment(any(Order.class))).thenReturn(ShipmentResult.failure(422, "bad address"));

        assertThatThrownBy(() -> orderService.createOrder(request))
                .isInstanceOf(ExternalServiceException.class)
                .hasMessage("Failed to create shipment. Order was not created. Please try again.");

        verify(orderPersistenceService, never()).insert(any());
    }

    @Test
    void createOrder_GatewayTimeout_NothingPersisted() {
        when(productRepository.findAllById(any())).thenReturn(List.of(coffee));
        when(keyGenerator.nextOrderCode()).thenReturn("ORD-A");
        when(orderRepository.existsByOrderCode("ORD-A")).thenReturn(false);
        when(shipmentGatewayClient.createShipment(any(Order.class))).thenReturn(ShipmentResult.timeout("30s"));

        assertThatThrownBy(() -> orderService.createOrder(request)).isInstanceOf(ExternalServiceException.class);

        verify(orderPersistenceService, never()).insert(any());
        verify(shipmentGatewayClient, times(1)).createShipment(any());
    }

    @Test
    void createOrder_UnknownProduct_NotFound() {
        when(productRepository.findAllById(any())).thenReturn(List.of());

        assertThatThrownBy(() -> orderService.createOrder(request))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("p-1");

        verifyNoInteractions(shipmentGatewayClient, orderPersistenceService, keyGenerator);
    }

    @Test
    void createOrder_InactiveProduct_Rejected() {
        coffee.setStatus(ProductStatus.INACTIVE);
        when(productRepository.findAllById(any())).thenReturn(List.of(coffee));

        assertThatThrownBy(() -> orderService.createOrder(request))
                .isInstanceOf(OrderValidationException.class)
                .satisfies(e -> assertThat(((OrderValidationException) e).getErrors())
                        .containsEntry("items[0].productId", "Product p-1 is not active."));

        verifyNoInteractions(shipmentGatewayClient);
    }

    @Test
    void createOrder_CodeAlreadyTaken_Regenerates() {
        when(productRepository.findAllById(any())).thenReturn(List.of(coffee));
        when(keyGenerator.nextOrderCode()).thenReturn("ORD-A", "ORD-B");
        when(orderRepository.existsByOrderCode("ORD-A")).thenReturn(true);
        when(orderRepository.existsByOrderCode("ORD-B")).thenReturn(false);
        when(shipmentGatewayClient.createShipment(any(Order.class))).thenReturn(accepted("GHN-1", null));
        stubPersistenceEcho();

        OrderResponse response = orderService.createOrder(request);

        assertThat(response.getOrderCode()).isEqualTo("ORD-B");
        verify(shipmentGatewayClient, times(1)).createShipment(any());
    }

    @Test
    void createOrder_CodeCollisionOnInsert_RetriesWithFreshEntities() {
        when(productRepository.findAllById(any())).thenReturn(List.of(coffee));
        when(keyGenerator.nextOrderCode()).thenReturn("ORD-A", "ORD-B");
        // free when checked, taken by a concurrent request by the time we insert
        when(orderRepository.existsByOrderCode("ORD-A")).thenReturn(false, true);
        when(orderRepository.existsByOrderCode("ORD-B")).thenReturn(false);
        when(shipmentGatewayClient.createShipment(any(Order.class)))
                .thenReturn(accepted("GHN-1", null), accepted("GHN-2", null));
        when(orderPersistenceService.insert(any(Order.class)))
                .thenThrow(new DataIntegrityViolationException("uq_order_code"))
                .thenAnswer(invocation -> OrderResponse.builder()
                        .orderCode(((Order) invocation.getArgument(0)).getOrderCode()).build());

        OrderResponse response = orderService.createOrder(request);

        assertThat(response.getOrderCode()).isEqualTo("ORD-B");
        ArgumentCaptor<Order> captor = ArgumentCaptor.forClass(Order.class);
        verify(orderPersistenceService, times(2)).insert(captor.capture());
        assertThat(captor.getAllValues().get(0)).isNotSameAs(captor.getAllValues().get(1));
        assertThat(captor.getAllValues().get(1).getShippingOrderCode()).isEqualTo("GHN-2");
        assertThat(captor.getAllValues().get(1).getItems()).hasSize(1);
    }

    @Test
    void createOrder_AllCodesTaken_Exhausted() {
        orderProperties.setCodeMaxAttempts(3);
        when(productRepository.findAllById(any())).thenReturn(List.of(coffee));
        when(keyGenerator.nextOrderCode()).thenReturn("ORD-A");
        when(orderRepository.existsByOrderCode("ORD-A")).thenReturn(true);

        assertThatThrownBy(() -> orderService.createOrder(request))
                .isInstanceOf(OrderCodeGenerationException.class);

        verify(keyGenerator, times(3)).nextOrderCode();
        verifyNoInteractions(shipmentGatewayClient, orderPersistenceService);
    }

    @Test
    void createOrder_InsertFailsForOtherReason_ReconciliationError() {
        when(productRepository.findAllById(any())).thenReturn(List.of(coffee));
        when(keyGenerator.nextOrderCode()).thenReturn("ORD-A");
        when(orderRepository.existsByOrderCode("ORD-A")).thenReturn(false);
        when(shipmentGatewayClient.createShipment(any(Order.class))).thenReturn(accepted("GHN-1", null));
        when(orderPersistenceService.insert(any(Order.class))).thenThrow(new DataIntegrityViolationException("not null"));

        assertThatThrownBy(() -> orderService.createOrder(request))
                .isInstanceOf(OrderPersistenceException.class)
                .satisfies(e -> assertThat(((OrderPersistenceException) e).getShippingOrderCode()).isEqualTo("GHN-1"));

        verify(shipmentGatewayClient, times(1)).createShipment(any());
    }

    @Test
    void createOrder_DatabaseDown_ReconciliationError() {
        when(productRepository.findAllById(any())).thenReturn(List.of(coffee));
        when(keyGenerator.nextOrderCode()).thenReturn("ORD-A");
        when(orderRepository.existsByOrderCode("ORD-A")).thenReturn(false);
        when(shipmentGatewayClient.createShipment(any(Order.class))).thenReturn(accepted("GHN-1", null));
        when(orderPersistenceService.insert(any(Order.class))).thenThrow(new QueryTimeoutException("db down"));

        assertThatThrownBy(() -> orderService.createOrder(request)).isInstanceOf(OrderPersistenceException.class);
    }

    @Test
    void updateOrder_CancelPending_CancelsShipmentFirst() {
        Order order = OrderFixtures.order("ORD-A", OrderStatus.PENDING);
        order.setVersion(3L);
        OrderUpdateRequest update = new OrderUpdateRequest();
        update.setOrderStatus(OrderStatus.CANCELLED);
        OrderResponse cancelled = OrderResponse.builder().orderCode("ORD-A").orderStatus(OrderStatus.CANCELLED).build();

        when(orderRepository.findByOrderCode("ORD-A")).thenReturn(Optional.of(order));
        when(shipmentGatewayClient.cancelShipment("ORD-A")).thenReturn(ShipmentResult.success(200, new ShipmentResponse()));
        when(orderPersistenceService.applyUpdate("ORD-A", update, 3L)).thenReturn(cancelled);

        OrderResponse response = orderService.updateOrder("ORD-A", update);

        assertThat(response.getOrderStatus()).isEqualTo(OrderStatus.CANCELLED);
        InOrder inOrder = inOrder(shipmentGatewayClient, orderPersistenceService);
        inOrder.verify(shipmentGatewayClient).cancelShipment("ORD-A");
        inOrder.verify(orderPersistenceService).applyUpdate("ORD-A", update, 3L);
    }

    @Test
    void updateOrder_CancelPending_GatewayFails_OrderUntouched() {
        Order order = OrderFixtures.order("ORD-A", OrderStatus.PENDING);
        OrderUpdateRequest update = new OrderUpdateRequest();
        update.setOrderStatus(OrderStatus.CANCELLED);

        when(orderRepository.findByOrderCode("ORD-A")).thenReturn(Optional.of(order));
        when(shipmentGatewayClient.cancelShipment("ORD-A")).thenReturn(ShipmentResult.transportError("Connection refused"));

        assertThatThrownBy(() -> orderService.updateOrder("ORD-A", update))
                .isInstanceOf(ExternalServiceException.class)
                .hasMessage("Failed to cancel shipment. Order status was not updated. Please try again.");

        verifyNoInteractions(orderPersistenceService);
    }

    @Test
    void updateOrder_CancelPending_StorageFailsAfterGateway_PersistenceError() {
        Order order = OrderFixtures.order("ORD-A", OrderStatus.PENDING);
        order.setVersion(3L);
        order.setShippingOrderCode("GHN-1");
        OrderUpdateRequest update = new OrderUpdateRequest();
        update.setOrderStatus(OrderStatus.CANCELLED);

        when(orderRepository.findByOrderCode("ORD-A")).thenReturn(Optional.of(order));
        when(shipmentGatewayClient.cancelShipment("ORD-A")).thenReturn(ShipmentResult.success(200, new ShipmentResponse()));
        when(orderPersistenceService.applyUpdate("ORD-A", update, 3L)).thenThrow(new QueryTimeoutException("db down"));

        assertThatThrownBy(() -> orderService.updateOrder("ORD-A", update))
                .isInstanceOf(OrderPersistenceException.class)
                .hasCauseInstanceOf(QueryTimeoutException.class)
                .satisfies(e -> assertThat(((OrderPersistenceException) e).getShippingOrderCode()).isEqualTo("GHN-1"));
    }

    @Test
    void cancelOrder_Pending_ConcurrentChangeAfterGateway_PersistenceError() {
        Order order = OrderFixtures.order("ORD-A", OrderStatus.PENDING);
        order.setVersion(3L);

        when(orderRepository.findByOrderCode("ORD-A")).thenReturn(Optional.of(order));
        when(shipmentGatewayClient.cancelShipment("ORD-A")).thenReturn(ShipmentResult.success(200, new ShipmentResponse()));
        when(orderPersistenceService.applyUpdate(eq("ORD-A"), any(OrderUpdateRequest.class), eq(3L)))
                .thenThrow(new ObjectOptimisticLockingFailureException(Order.class, order.getId()));

        assertThatThrownBy(() -> orderService.cancelOrder("ORD-A"))
                .isInstanceOf(OrderPersistenceException.class)
                .hasCauseInstanceOf(ObjectOptimisticLockingFailureException.class);
    }

    @Test
    void updateOrder_CancelConfirmed_NoGatewayCall() {
        Order order = OrderFixtures.order("ORD-A", OrderStatus.CONFIRMED);
        OrderUpdateRequest update = new OrderUpdateRequest();
        update.setOrderStatus(OrderStatus.CANCELLED);

        when(orderRepository.findByOrderCode("ORD-A")).thenReturn(Optional.of(order));
        when(orderPersistenceService.applyUpdate(eq("ORD-A"), eq(update), isNull()))
                .thenReturn(OrderResponse.builder().orderStatus(OrderStatus.CANCELLED).build());

        orderService.updateOrder("ORD-A", update);

        verifyNoInteractions(shipmentGatewayClient);
    }

    @Test
    void updateOrder_UnknownCode_NotFound() {
        when(orderRepository.findByOrderCode("ORD-X")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> orderService.updateOrder("ORD-X", new OrderUpdateRequest()))
                .isInstanceOf(ResourceNotFoundException.class);

        verifyNoInteractions(shipmentGatewayClient, orderPersistenceService);
    }

    @Test
    void cancelOrder_AlreadyCancelled_Rejected() {
        when(orderRepository.findByOrderCode("ORD-A"))
                .thenReturn(Optional.of(OrderFixtures.order("ORD-A", OrderStatus.CANCELLED)));

        assertThatThrownBy(() -> orderService.cancelOrder("ORD-A"))
                .isInstanceOf(OrderValidationException.class)
                .hasMessage("Order is already cancelled.");

        verifyNoInteractions(shipmentGatewayClient, orderPersistenceService);
    }

    @Test
    void cancelOrder_Pending_GoesThroughGateway() {
        when(orderRepository.findByOrderCode("ORD-A"))
                .thenReturn(Optional.of(OrderFixtures.order("ORD-A", OrderStatus.PENDING)));
        when(shipmentGatewayClient.cancelShipment("ORD-A")).thenReturn(ShipmentResult.failure(500, "boom"));

        assertThatThrownBy(() -> orderService.cancelOrder("ORD-A")).isInstanceOf(ExternalServiceException.class);

        verifyNoInteractions(orderPersistenceService);
    }

    @Test
    void applyExternalStatusUpdate_NeverCallsGateway() {
        Order order = OrderFixtures.order("ORD-A", OrderStatus.PENDING);
        ExternalStatusUpdateRequest update = new ExternalStatusUpdateRequest();
        update.setOrderCode("ORD-A");
        update.setOrderId(order.getId());
        update.setOrderStatus(OrderStatus.CANCELLED);

        when(orderRepository.findByOrderCode("ORD-A")).thenReturn(Optional.of(order));
        when(orderPersistenceService.applyUpdate(eq("ORD-A"), eq(update), isNull()))
                .thenReturn(OrderResponse.builder().orderStatus(OrderStatus.CANCELLED).build());

        OrderResponse response = orderService.applyExternalStatusUpdate("ORD-A", update);

        assertThat(response.getOrderStatus()).isEqualTo(OrderStatus.CANCELLED);
        verifyNoInteractions(shipmentGatewayClient);
    }

    @Test
    void applyExternalStatusUpdate_MismatchedIdentity_Rejected() {
        Order order = OrderFixtures.order("ORD-A", OrderStatus.CONFIRMED);
        ExternalStatusUpdateRequest wrongCode = new ExternalStatusUpdateRequest();
        wrongCode.setOrderCode("ORD-B");
        ExternalStatusUpdateRequest wrongId = new ExternalStatusUpdateRequest();
        wrongId.setOrderId(UUID.randomUUID());

        when(orderRepository.findByOrderCode("ORD-A")).thenReturn(Optional.of(order));

        assertThatThrownBy(() -> orderService.applyExternalStatusUpdate("ORD-A", wrongCode))
                .isInstanceOf(OrderValidationException.class);
        assertThatThrownBy(() -> orderService.applyExternalStatusUpdate("ORD-A", wrongId))
                .isInstanceOf(OrderValidationException.class);

        verifyNoInteractions(orderPersistenceService);
    }

    @Test
    void getOrders_KeepsRecencyOrder() {
        Order older = OrderFixtures.order("ORD-OLD", OrderStatus.CONFIRMED);
        Order newer = OrderFixtures.order("ORD-NEW", OrderStatus.CONFIRMED);
        when(orderRepository.findPageIds(0, 50)).thenReturn(List.of(newer.getId(), older.getId()));
        when(orderRepository.findAllByIdIn(List.of(newer.getId(), older.getId()))).thenReturn(List.of(older, newer));
        when(orderMapper.toOrderResponse(any(Order.class))).thenAnswer(invocation ->
                OrderResponse.builder().orderCode(((Order) invocation.getArgument(0)).getOrderCode()).build());

        List<OrderResponse> page = orderService.getOrders(null, null);

        assertThat(page).extracting(OrderResponse::getOrderCode).containsExactly("ORD-NEW", "ORD-OLD");
    }

    @Test
    void getOrders_InvalidPaging_Rejected() {
        assertThatThrownBy(() -> orderService.getOrders(-1, 10))
                .isInstanceOf(OrderValidationException.class)
                .satisfies(e -> assertThat(((OrderValidationException) e).getErrors()).containsKey("skip"));
        assertThatThrownBy(() -> orderService.getOrders(0, 101))
                .isInstanceOf(OrderValidationException.class);
        assertThatThrownBy(() -> orderService.getOrders(0, 0))
                .isInstanceOf(OrderValidationException.class);

        verifyNoInteractions(orderRepository);
    }

    @Test
    void getPaymentMethods_ListsAllWithDisplayNames() {
        List<PaymentMethodResponse> methods = orderService.getPaymentMethods();

        assertThat(methods).hasSize(PaymentMethod.values().length);
        assertThat(methods.get(0).getId()).isEqualTo("COD");
        assertThat(methods.get(0).getName()).isEqualTo("Cash on Delivery");
    }
}
