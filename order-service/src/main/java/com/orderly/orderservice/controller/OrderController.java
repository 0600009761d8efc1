package com.orderly.orderservice.controller;

import com.orderly.orderservice.dto.ExternalStatusUpdateRequest;
import com.orderly.orderservice.dto.OrderRequest;
import com.orderly.orderservice.dto.OrderResponse;
import com.orderly.orderservice.dto.OrderUpdateRequest;
import com.orderly.orderservice.dto.PaymentMethodResponse;
import com.orderly.orderservice.service.OrderService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderService orderService;

    @PostMapping
    public ResponseEntity<OrderResponse> createOrder(@Valid @RequestBody OrderRequest orderRequest) {
        OrderResponse orderResponse = orderService.createOrder(orderRequest);
        return new ResponseEntity<>(orderResponse, HttpStatus.CREATED);
    }

    // Most recently updated first
    @GetMapping
    public ResponseEntity<List<OrderResponse>> getOrders(
            @RequestParam(required = false) Integer skip,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(orderService.getOrders(skip, limit));
    }

    @GetMapping("/payment-methods")
    public ResponseEntity<List<PaymentMethodResponse>> getPaymentMethods() {
        return ResponseEntity.ok(orderService.getPaymentMethods());
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<OrderResponse> getOrderById(@PathVariable UUID orderId) {
        return ResponseEntity.ok(orderService.getOrderById(orderId));
    }

    @GetMapping("/by-code/{orderCode}")
    public ResponseEntity<OrderResponse> getOrderByCode(@PathVariable String orderCode) {
        return ResponseEntity.ok(orderService.getOrderByCode(orderCode));
    }

    @PatchMapping("/by-code/{orderCode}")
    public ResponseEntity<OrderResponse> updateOrder(
            @PathVariable String orderCode,
            @Valid @RequestBody OrderUpdateRequest request) {
        return ResponseEntity.ok(orderService.updateOrder(orderCode, request));
    }

    // Soft cancel, the order row is kept
    @DeleteMapping("/by-code/{orderCode}")
    public ResponseEntity<OrderResponse> cancelOrder(@PathVariable String orderCode) {
        return ResponseEntity.ok(orderService.cancelOrder(orderCode));
    }

    // Pushed by the shipment provider or an operator tool
    @PostMapping({"/by-code/{orderCode}/status-update", "/by-code/status-update/{orderCode}"})
    public ResponseEntity<OrderResponse> applyExternalStatusUpdate(
            @PathVariable String orderCode,
            @Valid @RequestBody ExternalStatusUpdateRequest request) {
        return ResponseEntity.ok(orderService.applyExternalStatusUpdate(orderCode, request));
    }
}
