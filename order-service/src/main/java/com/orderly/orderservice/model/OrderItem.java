package com.orderly.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(name = "order_items")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class OrderItem {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    // Which order this item belongs to
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false, updatable = false)
    private Order order;

    // Plain reference, the product may be edited or deleted later
    @Column(nullable = false, length = 50, updatable = false)
    @ToString.Include
    private String productId;

    // Snapshot of the product name at order time
    @Column(nullable = false, updatable = false)
    private String productName;

    @Column(nullable = false, updatable = false)
    @ToString.Include
    private Integer quantity;

    // Snapshot of the product price at order time, never recomputed
    @Column(nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal unitPrice;

    @Column(nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal totalPrice;
}
