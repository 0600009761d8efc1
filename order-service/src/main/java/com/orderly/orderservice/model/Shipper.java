package com.orderly.orderservice.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Data;

@Data
@Embeddable
public class Shipper {

    @Column(name = "shipper_id")
    private String shipperId;

    @Column(name = "shipper_name")
    private String name;

    @Column(name = "shipper_phone", length = 30)
    private String phone;

    // motorbike | car | truck
    @Column(name = "shipper_vehicle_type", length = 30)
    private String vehicleType;
}
