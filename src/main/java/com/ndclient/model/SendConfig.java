package com.ndclient.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Timeout and retry settings of a request sender. Fixed for the lifetime of the sender.
 *
 * @param timeout      Maximum duration of a single attempt.
 * @param sendInterval Wait between two attempts of the same request.
 * @param maxAttempts  Total number of attempts, the first one included.
 */
public record SendConfig(Duration timeout, Duration sendInterval, int maxAttempts) {

    public static final SendConfig DEFAULT = new SendConfig(Duration.ofSeconds(30), Duration.ofSeconds(5), 3);

    public SendConfig {
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(sendInterval, "sendInterval");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        if (sendInterval.isNegative()) {
            throw new IllegalArgumentException("sendInterval must not be negative: " + sendInterval);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
    }
}
