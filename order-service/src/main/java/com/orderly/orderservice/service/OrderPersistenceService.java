package com.orderly.orderservice.service;

import com.orderly.common.exception.ResourceNotFoundException;
import com.orderly.orderservice.dto.OrderResponse;
import com.orderly.orderservice.dto.OrderUpdateRequest;
import com.orderly.orderservice.mapper.OrderMapper;
import com.orderly.orderservice.model.Order;
import com.orderly.orderservice.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Transactional writes for orders. Kept apart from {@link OrderServiceImpl} so that
 * provider calls never run while a database transaction is open.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderPersistenceService {

    private final OrderRepository orderRepository;
    private final OrderStatusProjector statusProjector;
    private final OrderMapper orderMapper;

    /**
     * Inserts a new order with its items. The flush makes a duplicate order code
     * surface here as DataIntegrityViolationException.
     */
    @Transactional
    public OrderResponse insert(Order order) {
        Order saved = orderRepository.saveAndFlush(order);
        log.debug("Order row inserted: id={}, orderCode={}", saved.getId(), saved.getOrderCode());
        return orderMapper.toOrderResponse(saved);
    }

    /**
     * Re-reads the order and applies the update in one transaction.
     *
     * @param expectedVersion version the caller based its decision on, or null to accept any
     */
    @Transactional
    public OrderResponse applyUpdate(String orderCode, OrderUpdateRequest update, Long expectedVersion) {
        Order order = orderRepository.findByOrderCode(orderCode)
                .orElseThrow(() -> new ResourceNotFoundException("Order with code " + orderCode + " not found."));

        if (expectedVersion != null && !expectedVersion.equals(order.getVersion())) {
            log.warn("Order changed since it was checked: orderCode={}, expectedVersion={}, actualVersion={}",
                    orderCode, expectedVersion, order.getVersion());
            throw new ObjectOptimisticLockingFailureException(Order.class, order.getId());
        }

        List<String> applied = statusProjector.apply(order, update);
        Order saved = orderRepository.saveAndFlush(order);

        log.info("Order updated: orderCode={}, fields={}, orderStatus={}, shippingStatus={}",
                orderCode, applied, saved.getOrderStatus(), saved.getShippingStatus());
        return orderMapper.toOrderResponse(saved);
    }
}
