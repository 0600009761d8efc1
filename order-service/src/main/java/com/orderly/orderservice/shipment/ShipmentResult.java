package com.orderly.orderservice.shipment;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Outcome of one call to the shipment provider. Every call, whatever happens
 * on the wire, ends in exactly one {@link Outcome}.
 */
@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class ShipmentResult {

    public enum Outcome {
        SUCCESS,
        FAILURE,         // provider answered, but not with a usable 2xx
        TIMEOUT,
        TRANSPORT_ERROR  // connection refused, DNS, reset ...
    }

    private final Outcome outcome;

    // Only for SUCCESS; empty response when the provider sent no body
    private final ShipmentResponse response;

    // HTTP status of the provider answer, 0 when there was none
    private final int httpStatus;

    private final String detail;

    public static ShipmentResult success(int httpStatus, ShipmentResponse response) {
        return new ShipmentResult(Outcome.SUCCESS, response, httpStatus, null);
    }

    public static ShipmentResult failure(int httpStatus, String detail) {
        return new ShipmentResult(Outcome.FAILURE, null, httpStatus, detail);
    }

    public static ShipmentResult timeout(String detail) {
        return new ShipmentResult(Outcome.TIMEOUT, null, 0, detail);
    }

    public static ShipmentResult transportError(String detail) {
        return new ShipmentResult(Outcome.TRANSPORT_ERROR, null, 0, detail);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }
}
