package com.orderly.orderservice.shipment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orderly.orderservice.config.ShipmentProperties;
import com.orderly.orderservice.model.Order;
import com.orderly.orderservice.model.ShippingStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;

import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * {@link ShipmentGatewayClient} over WebClient. The call is blocking and bounded
 * by {@code shipment.timeout}; the calling thread holds no database resources
 * while it waits.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ShipmentGatewayClientImpl implements ShipmentGatewayClient {

    static final String SHIPMENTS_PATH = "/api/shipments";
    static final String SHIPMENT_STATUS_PATH = "/api/shipments/{orderCode}/status";

    private static final int LOGGED_BODY_LIMIT = 500;

    private final WebClient shipmentWebClient;
    private final ShipmentPayloadFactory payloadFactory;
    private final ShipmentProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public ShipmentResult createShipment(Order order) {
        String orderCode = order.getOrderCode();
        ShipmentRequest payload;
        try {
            payload = payloadFactory.build(order);
        } catch (RuntimeException e) {
            log.error("[SHIPMENT API] Could not build shipment payload: orderCode={}", orderCode, e);
            return ShipmentResult.failure(0, "Could not build shipment payload: " + e.getMessage());
        }
        log.info("[SHIPMENT API] Creating shipment: orderCode={}, items={}", orderCode, payload.getItems().size());
        log.debug("[SHIPMENT API] Shipment payload: {}", payload);

        return exchange("create", orderCode,
                () -> shipmentWebClient.post().uri(SHIPMENTS_PATH).bodyValue(payload),
                true);
    }

    @Override
    public ShipmentResult cancelShipment(String orderCode) {
        log.info("[SHIPMENT API] Cancelling shipment: orderCode={}", orderCode);
        ShipmentStatusRequest body = new ShipmentStatusRequest(ShippingStatus.CANCELLED.name());

        return exchange("cancel", orderCode,
                () -> shipmentWebClient.put().uri(SHIPMENT_STATUS_PATH, orderCode).bodyValue(body),
                false);
    }

    private ShipmentResult exchange(String action, String orderCode,
                                    Supplier<WebClient.RequestHeadersSpec<?>> request,
                                    boolean parseBody) {
        try {
            ProviderReply reply = request.get()
                    .exchangeToMono(response -> response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> new ProviderReply(response.statusCode(), body)))
                    .timeout(properties.getTimeout())
                    .block();
            if (reply == null) {
                log.error("[SHIPMENT API] No reply to {}: orderCode={}", action, orderCode);
                return ShipmentResult.failure(0, "No reply from shipment provider");
            }

            log.info("[SHIPMENT API] Provider answered {}: orderCode={}, status={}",
                    action, orderCode, reply.status.value());
            log.debug("[SHIPMENT API] Response body: {}", abbreviate(reply.body));

            if (!reply.status.is2xxSuccessful()) {
                log.error("[SHIPMENT API] Provider rejected {}: orderCode={}, status={}, body={}",
                        action, orderCode, reply.status.value(), abbreviate(reply.body));
                return ShipmentResult.failure(reply.status.value(), abbreviate(reply.body));
            }
            return parseBody
                    ? toCreateResult(orderCode, reply)
                    : ShipmentResult.success(reply.status.value(), new ShipmentResponse());
        } catch (RuntimeException e) {
            return classify(action, orderCode, e);
        }
    }

    private ShipmentResult toCreateResult(String orderCode, ProviderReply reply) {
        if (reply.body.isBlank()) {
            return ShipmentResult.success(reply.status.value(), new ShipmentResponse());
        }
        try {
            ShipmentResponse response = objectMapper.readValue(reply.body, ShipmentResponse.class);
            return ShipmentResult.success(reply.status.value(), response == null ? new ShipmentResponse() : response);
        } catch (JsonProcessingException e) {
            log.error("[SHIPMENT API] Malformed response body: orderCode={}, status={}, error={}",
                    orderCode, reply.status.value(), e.getOriginalMessage());
            return ShipmentResult.failure(reply.status.value(), "Malformed shipment provider response");
        }
    }

    private ShipmentResult classify(String action, String orderCode, RuntimeException e) {
        Throwable cause = Exceptions.unwrap(e);
        if (cause instanceof TimeoutException) {
            log.error("[SHIPMENT API] Timeout after {} during {}: orderCode={}",
                    properties.getTimeout(), action, orderCode);
            return ShipmentResult.timeout("No answer within " + properties.getTimeout());
        }
        if (cause instanceof WebClientRequestException) {
            log.error("[SHIPMENT API] Request error during {}: orderCode={}, error={}",
                    action, orderCode, cause.getMessage());
            return ShipmentResult.transportError(cause.getMessage());
        }
        log.error("[SHIPMENT API] Unexpected error during {}: orderCode={}", action, orderCode, cause);
        return ShipmentResult.transportError(cause.getMessage());
    }

    private static String abbreviate(String body) {
        if (body == null || body.length() <= LOGGED_BODY_LIMIT) {
            return body;
        }
        return body.substring(0, LOGGED_BODY_LIMIT) + "...";
    }

    private static final class ProviderReply {
        private final HttpStatusCode status;
        private final String body;

        private ProviderReply(HttpStatusCode status, String body) {
            this.status = status;
            this.body = body;
        }
    }
}
