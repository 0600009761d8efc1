package com.orderly.orderservice.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Data;

// Set once at creation, there is no update path for it
@Data
@Embeddable
public class Customer {

    // Caller-side customer reference, empty when the client has none
    @Column(name = "customer_id", length = 50, nullable = false)
    private String customerId = "";

    @Column(name = "customer_name", nullable = false)
    private String name;

    @Column(name = "customer_phone", length = 30, nullable = false)
    private String phone;

    @Column(name = "customer_email")
    private String email;
}
