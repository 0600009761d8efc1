package com.orderly.orderservice.shipment;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Coarse city/district classification of a free-text address, used only to
 * shape the shipment provider payload. Not a geocoder: a case-insensitive
 * substring match against a handful of known cities.
 * <p>
 * Never fails. Null, blank or unrecognised input yields {@link #DEFAULT_CITY}
 * with no district.
 */
public final class AddressParser {

    public static final String DEFAULT_CITY = "Ho Chi Minh City";

    // Checked in insertion order, first city with a matching alias wins
    private static final Map<String, List<String>> CITY_ALIASES = new LinkedHashMap<>();

    static {
        CITY_ALIASES.put("Ho Chi Minh City", List.of("ho chi minh", "hồ chí minh", "hcm"));
        CITY_ALIASES.put("Hanoi", List.of("hanoi", "hà nội"));
        CITY_ALIASES.put("Da Nang", List.of("da nang", "đà nẵng"));
        CITY_ALIASES.put("Can Tho", List.of("can tho", "cần thơ"));
        CITY_ALIASES.put("Hai Phong", List.of("hai phong", "hải phòng"));
    }

    private static final Pattern DISTRICT_NUMBER = Pattern.compile("(?:district|quận)\\s*(\\d+)");

    private AddressParser() {
    }

    public static ParsedAddress parse(String address) {
        if (address == null || address.isBlank()) {
            return new ParsedAddress(DEFAULT_CITY, "", "");
        }
        String lower = address.toLowerCase(Locale.ROOT);
        return new ParsedAddress(findCity(lower), findDistrict(lower), "");
    }

    private static String findCity(String lower) {
        for (Map.Entry<String, List<String>> entry : CITY_ALIASES.entrySet()) {
            for (String alias : entry.getValue()) {
                if (lower.contains(alias)) {
                    return entry.getKey();
                }
            }
        }
        return DEFAULT_CITY;
    }

    private static String findDistrict(String lower) {
        Matcher matcher = DISTRICT_NUMBER.matcher(lower);
        return matcher.find() ? "District " + matcher.group(1) : "";
    }
}
