package com.poc.svc.ingestion.service.policy;

import com.poc.svc.ingestion.config.RetryPolicyProperties;

import java.time.Duration;
import java.util.Objects;

/**
 * delay(n) = min(initial * multiplier^n, max)，n 從 0 起算。
 */
public record BackoffSchedule(Duration initial, double multiplier, Duration max) {

    public BackoffSchedule {
        Objects.requireNonNull(initial, "initial must not be null");
        Objects.requireNonNull(max, "max must not be null");
        if (initial.isNegative() || max.isNegative()) {
            throw new IllegalArgumentException("backoff durations must not be negative");
        }
        if (multiplier < 1.0d) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
    }

    public static BackoffSchedule from(RetryPolicyProperties properties) {
        return new BackoffSchedule(properties.getInitialBackoff(), properties.getMultiplier(), properties.getMaxBackoff());
    }

    public Duration delayFor(int retryIndex) {
        if (retryIndex < 0) {
            throw new IllegalArgumentException("retryIndex must be >= 0");
        }
        double millis = initial.toMillis() * Math.pow(multiplier, retryIndex);
        if (Double.isInfinite(millis) || millis >= max.toMillis()) {
            return max;
        }
        return Duration.ofMillis(Math.round(millis));
    }
}
