package com.orderly.orderservice.service;

import com.orderly.orderservice.dto.ProductRequest;
import com.orderly.orderservice.dto.ProductResponse;
import com.orderly.orderservice.dto.ProductUpdateRequest;

import java.util.List;

public interface ProductService {

    ProductResponse createProduct(ProductRequest request);

    ProductResponse getProductById(String productId);

    List<ProductResponse> getProducts(Integer skip, Integer limit);

    ProductResponse updateProduct(String productId, ProductUpdateRequest request);

    void deleteProduct(String productId);
}
