package com.orderly.orderservice.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "orders")
public class OrderProperties {

    // Fresh order codes tried before giving up with OrderCodeGenerationException
    @Min(1)
    private int codeMaxAttempts = 5;

    @Min(1)
    private int productIdMaxAttempts = 5;

    @NotBlank
    private String defaultCurrency = "VND";

    @Min(1)
    private int defaultPageSize = 50;

    @Min(1)
    private int maxPageSize = 100;
}
