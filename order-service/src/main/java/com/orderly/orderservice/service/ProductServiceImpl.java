package com.orderly.orderservice.service;

import com.orderly.common.exception.ResourceNotFoundException;
import com.orderly.orderservice.config.OrderProperties;
import com.orderly.orderservice.dto.ProductRequest;
import com.orderly.orderservice.dto.ProductResponse;
import com.orderly.orderservice.dto.ProductUpdateRequest;
import com.orderly.orderservice.exception.ProductIdGenerationException;
import com.orderly.orderservice.mapper.ProductMapper;
import com.orderly.orderservice.model.Product;
import com.orderly.orderservice.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class ProductServiceImpl implements ProductService {

    private final ProductRepository productRepository;
    private final ProductMapper productMapper;
    private final BusinessKeyGenerator keyGenerator;
    private final OrderProperties orderProperties;

    // Not @Transactional: each attempt is its own insert, a failed one must not poison the next
    @Override
    public ProductResponse createProduct(ProductRequest request) {
        int maxAttempts = orderProperties.getProductIdMaxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Product product = productMapper.toProduct(request);
            product.setId(keyGenerator.nextProductId());
            if (product.getCurrency() == null) {
                product.setCurrency(orderProperties.getDefaultCurrency());
            }

            try {
                Product saved = productRepository.saveAndFlush(product);
                log.info("Product created. productId={}, name={}", saved.getId(), saved.getName());
                return productMapper.toProductResponse(saved);
            } catch (DataIntegrityViolationException e) {
                if (!productRepository.existsById(product.getId())) {
                    throw e;
                }
                log.warn("Generated product ID already in use, regenerating. productId={}, attempt={}",
                        product.getId(), attempt);
            }
        }
        throw new ProductIdGenerationException("Could not allocate a unique product ID after " + maxAttempts + " attempts");
    }

    @Override
    @Transactional(readOnly = true)
    public ProductResponse getProductById(String productId) {
        return productMapper.toProductResponse(findProduct(productId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<ProductResponse> getProducts(Integer skip, Integer limit) {
        PageWindow window = PageWindow.of(skip, limit, orderProperties);
        return productRepository.findPage(window.getSkip(), window.getLimit()).stream()
                .map(productMapper::toProductResponse)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional
    public ProductResponse updateProduct(String productId, ProductUpdateRequest request) {
        Product product = findProduct(productId);
        productMapper.updateProductFromRequest(request, product);
        Product saved = productRepository.saveAndFlush(product);
        log.info("Product updated. productId={}, status={}", productId, saved.getStatus());
        return productMapper.toProductResponse(saved);
    }

    // Orders keep their own snapshot of product data, so deleting is always allowed
    @Override
    @Transactional
    public void deleteProduct(String productId) {
        Product product = findProduct(productId);
        productRepository.delete(product);
        log.info("Product deleted. productId={}", productId);
    }

    private Product findProduct(String productId) {
        return productRepository.findById(productId)
                .orElseThrow(() -> new ResourceNotFoundException("Product with ID " + productId + " not found."));
    }
}
