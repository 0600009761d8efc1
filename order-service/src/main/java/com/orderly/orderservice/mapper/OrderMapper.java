package com.orderly.orderservice.mapper;

import com.orderly.orderservice.dto.CustomerDto;
import com.orderly.orderservice.dto.OrderItemResponse;
import com.orderly.orderservice.dto.OrderResponse;
import com.orderly.orderservice.dto.PricingResponse;
import com.orderly.orderservice.dto.ShipperDto;
import com.orderly.orderservice.dto.ShippingAddressDto;
import com.orderly.orderservice.dto.ShippingResponse;
import com.orderly.orderservice.model.Customer;
import com.orderly.orderservice.model.Order;
import com.orderly.orderservice.model.OrderItem;
import com.orderly.orderservice.model.Pricing;
import com.orderly.orderservice.model.Shipper;
import com.orderly.orderservice.model.ShippingAddress;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface OrderMapper {

    // shipping fields live flat on the entity and are grouped for the API
    @Mapping(target = "shipping", expression = "java(toShippingResponse(order))")
    OrderResponse toOrderResponse(Order order);

    OrderItemResponse toOrderItemResponse(OrderItem item);

    PricingResponse toPricingResponse(Pricing pricing);

    CustomerDto toCustomerDto(Customer customer);

    @Mapping(source = "shippingStatus", target = "status")
    @Mapping(source = "receiver", target = "address")
    ShippingResponse toShippingResponse(Order order);

    ShippingAddressDto toShippingAddressDto(ShippingAddress address);

    ShipperDto toShipperDto(Shipper shipper);

    @Mapping(target = "customerId", source = "customerId", defaultValue = "")
    Customer toCustomer(CustomerDto dto);

    Shipper toShipper(ShipperDto dto);
}
