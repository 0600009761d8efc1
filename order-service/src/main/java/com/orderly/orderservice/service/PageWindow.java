package com.orderly.orderservice.service;

import com.orderly.orderservice.config.OrderProperties;
import com.orderly.orderservice.exception.OrderValidationException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Offset window for list endpoints: skip &gt;= 0 and 1 &lt;= limit &lt;= max page size.
 */
@Getter
@RequiredArgsConstructor
public class PageWindow {

    private final int skip;
    private final int limit;

    public static PageWindow of(Integer skip, Integer limit, OrderProperties properties) {
        int effectiveSkip = skip == null ? 0 : skip;
        int effectiveLimit = limit == null ? properties.getDefaultPageSize() : limit;

        Map<String, String> errors = new LinkedHashMap<>();
        if (effectiveSkip < 0) {
            errors.put("skip", "skip must be greater than or equal to 0");
        }
        if (effectiveLimit < 1 || effectiveLimit > properties.getMaxPageSize()) {
            errors.put("limit", "limit must be between 1 and " + properties.getMaxPageSize());
        }
        if (!errors.isEmpty()) {
            throw new OrderValidationException("Invalid paging parameters", errors);
        }
        return new PageWindow(effectiveSkip, effectiveLimit);
    }
}
