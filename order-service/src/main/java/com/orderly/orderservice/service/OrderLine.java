package com.orderly.orderservice.service;

import com.orderly.orderservice.model.Product;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

// A requested quantity of a product that has already been checked as orderable
@Getter
@RequiredArgsConstructor
public class OrderLine {
    private final Product product;
    private final int quantity;
}
