package com.orderly.orderservice.service;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Random;
import java.util.UUID;

/**
 * Produces the business identifiers handed out by this service.
 * Uniqueness is not guaranteed here; callers rely on the database unique
 * constraint and ask for a new value when it is violated.
 */
@Component
public class BusinessKeyGenerator {

    static final String ORDER_CODE_PREFIX = "ORD";

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final Clock clock;
    private final Random random;

    @Autowired
    public BusinessKeyGenerator(Clock clock) {
        this(clock, new Random());
    }

    BusinessKeyGenerator(Clock clock, Random random) {
        this.clock = clock;
        this.random = random;
    }

    /**
     * ORD-yyyyMMdd-HHmmss-NNNN, UTC, with a random 4-digit suffix.
     */
    public String nextOrderCode() {
        return String.format(Locale.ROOT, "%s-%s-%04d", ORDER_CODE_PREFIX, TIMESTAMP.format(clock.instant()), random.nextInt(10_000));
    }

    public String nextProductId() {
        return UUID.randomUUID().toString();
    }
}
