/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.core;

import java.time.Duration;
import java.util.Objects;

/**
 * What a {@link Subscriber} does when its handler fails with a recoverable error.
 *
 * <p>The redelivery delay grows exponentially from {@code initialBackoff} and is capped at
 * {@code maxBackoff}. With {@code maxDeliveries > 0} a message that still fails on its
 * {@code maxDeliveries}-th delivery is terminated instead of nak'd.</p>
 *
 * @param maxDeliveries  deliveries before a failing message is given up, 0 for no limit
 * @param initialBackoff delay before the first redelivery, zero to leave it to the backend
 * @param maxBackoff     upper bound for the delay
 */
public record RetryPolicy(int maxDeliveries, Duration initialBackoff, Duration maxBackoff) {

    private static final RetryPolicy UNBOUNDED = new RetryPolicy(0, Duration.ZERO, Duration.ZERO);

    public RetryPolicy {
        if (maxDeliveries < 0) throw new IllegalArgumentException("maxDeliveries must be >= 0");
        initialBackoff = Objects.requireNonNullElse(initialBackoff, Duration.ZERO);
        maxBackoff = Objects.requireNonNullElse(maxBackoff, initialBackoff);
        if (initialBackoff.isNegative() || maxBackoff.isNegative()) {
            throw new IllegalArgumentException("backoff must not be negative");
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) maxBackoff = initialBackoff;
    }

    /** Retry forever, redelivery timing decided by the backend. */
    public static RetryPolicy unbounded() {
        return UNBOUNDED;
    }

    public static RetryPolicy exponential(int maxDeliveries, Duration initialBackoff, Duration maxBackoff) {
        return new RetryPolicy(maxDeliveries, initialBackoff, maxBackoff);
    }

    public boolean isExhausted(long deliveryCount) {
        return maxDeliveries > 0 && deliveryCount >= maxDeliveries;
    }

    /** Delay before redelivering a message that failed on delivery number {@code deliveryCount}. */
    public Duration backoff(long deliveryCount) {
        if (initialBackoff.isZero()) return Duration.ZERO;
        int exponent = (int) Math.min(Math.max(0, deliveryCount - 1), 62);
        long millis;
        try {
            millis = Math.multiplyExact(initialBackoff.toMillis(), 1L << exponent);
        } catch (ArithmeticException overflow) {
            return maxBackoff;
        }
        return millis > maxBackoff.toMillis() ? maxBackoff : Duration.ofMillis(millis);
    }
}
