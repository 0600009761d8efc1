package com.orderly.orderservice.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Settings for the external shipment provider, bound once at startup from the
 * {@code shipment.*} keys and handed to the components that need them.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "shipment")
public class ShipmentProperties {

    @NotBlank
    private String baseUrl;

    // Upper bound for one provider call, the request fails with a timeout after it
    @NotNull
    private Duration timeout = Duration.ofSeconds(30);

    // Nominal weight of one unit of any product
    private BigDecimal itemWeightKg = new BigDecimal("0.5");

    // Parcels lighter than this are declared at this weight
    private BigDecimal minimumWeightKg = new BigDecimal("1.0");

    private BigDecimal packageDimensionCm = new BigDecimal("10.0");

    // The provider rejects blank addresses
    @NotBlank
    private String defaultReceiverAddress = "Ho Chi Minh City, Vietnam";

    private String serviceType = "STANDARD";
}
