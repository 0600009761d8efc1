package com.orderly.orderservice.model;

import java.util.Locale;

public enum ShippingStatus {
    NOT_CREATED,
    CREATED,
    PICKED,
    DELIVERING,
    DELIVERED,
    FAILED,
    CANCELLED;

    /**
     * Maps a status string reported by the shipment provider onto our vocabulary.
     * The provider speaks its own dialect (PENDING, IN_TRANSIT, RETURNED ...);
     * anything we cannot place is treated as a freshly created shipment.
     *
     * @return the mapped status, or null when the provider reported none
     */
    public static ShippingStatus fromProvider(String providerStatus) {
        if (providerStatus == null || providerStatus.isBlank()) {
            return null;
        }
        ShippingStatus known = lookup(providerStatus);
        return known != null ? known : CREATED;
    }

    /**
     * @return false for a status {@link #fromProvider} only maps to CREATED as a fallback
     */
    public static boolean isKnownProviderStatus(String providerStatus) {
        return providerStatus != null && !providerStatus.isBlank() && lookup(providerStatus) != null;
    }

    private static ShippingStatus lookup(String providerStatus) {
        String normalized = providerStatus.trim().toUpperCase(Locale.ROOT);
        switch (normalized) {
            case "PENDING":
                return CREATED;
            case "IN_TRANSIT":
            case "OUT_FOR_DELIVERY":
                return DELIVERING;
            case "RETURNED":
                return FAILED;
            default:
                for (ShippingStatus status : values()) {
                    if (status.name().equals(normalized)) {
                        return status;
                    }
                }
                return null;
        }
    }
}
