package com.orderly.orderservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

// Scans com.orderly.common too for the shared Jackson configuration
@SpringBootApplication(scanBasePackages = {"com.orderly.orderservice", "com.orderly.common"})
public class OrderServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrderServiceApplication.class, args);
    }
}
