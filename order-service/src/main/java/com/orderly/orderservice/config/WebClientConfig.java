// order-service/src/main/java/com/orderly/orderservice/config/WebClientConfig.java
package com.orderly.orderservice.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({ShipmentProperties.class, OrderProperties.class})
public class WebClientConfig {

    @Bean
    public WebClient shipmentWebClient(WebClient.Builder builder, ShipmentProperties properties) {
        return builder
                .baseUrl(properties.getBaseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    // Order codes carry the UTC date and time
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
