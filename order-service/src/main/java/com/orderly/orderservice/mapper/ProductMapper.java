package com.orderly.orderservice.mapper;

import com.orderly.orderservice.dto.ProductRequest;
import com.orderly.orderservice.dto.ProductResponse;
import com.orderly.orderservice.dto.ProductUpdateRequest;
import com.orderly.orderservice.model.Product;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;
import org.mapstruct.NullValuePropertyMappingStrategy;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring",
        unmappedTargetPolicy = ReportingPolicy.IGNORE,
        nullValuePropertyMappingStrategy = NullValuePropertyMappingStrategy.IGNORE)
public interface ProductMapper {

    ProductResponse toProductResponse(Product product);

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    @Mapping(target = "fresh", ignore = true)
    @Mapping(target = "stock", source = "stock", defaultValue = "0")
    @Mapping(target = "status", source = "status", defaultValue = "ACTIVE")
    Product toProduct(ProductRequest request);

    // null fields in the request leave the product untouched
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    @Mapping(target = "fresh", ignore = true)
    void updateProductFromRequest(ProductUpdateRequest request, @MappingTarget Product product);
}
