package com.orderly.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "orders", uniqueConstraints = @UniqueConstraint(name = Order.ORDER_CODE_CONSTRAINT, columnNames = "order_code"))
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class Order {

    public static final String ORDER_CODE_CONSTRAINT = "uq_order_code";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @ToString.Include
    private UUID id;

    // Human readable business key: ORD-yyyyMMdd-HHmmss-NNNN
    @Column(name = "order_code", length = 50, nullable = false, updatable = false)
    @ToString.Include
    private String orderCode;

    @Embedded
    private Customer customer;

    // Items are written once together with the order and never touched again.
    // Deleting the order deletes its items (CascadeType.ALL)
    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderColumn(name = "line_number")
    private List<OrderItem> items = new ArrayList<>();

    @Embedded
    private Pricing pricing;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", length = 30)
    private PaymentMethod paymentMethod;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", length = 30, nullable = false)
    private PaymentStatus paymentStatus;

    // Shipment side, filled from the provider response and later status pushes
    @Column(name = "shipping_order_code", length = 100)
    private String shippingOrderCode;

    @Enumerated(EnumType.STRING)
    @Column(name = "shipping_status", length = 30, nullable = false)
    @ToString.Include
    private ShippingStatus shippingStatus;

    @Embedded
    private ShippingAddress receiver;

    @Embedded
    private Shipper shipper;

    @Column(name = "estimated_delivery_time")
    private Instant estimatedDeliveryTime;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    @Column(name = "failed_reason", length = 500)
    private String failedReason;

    @Enumerated(EnumType.STRING)
    @Column(name = "order_status", length = 30, nullable = false)
    @ToString.Include
    private OrderStatus orderStatus;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    // Two concurrent status updates on the same order: the second one fails
    // with OptimisticLockingFailureException instead of overwriting the first
    @Version
    @Column(name = "version")
    private Long version;

    public void addItem(OrderItem item) {
        item.setOrder(this);
        items.add(item);
    }
}
