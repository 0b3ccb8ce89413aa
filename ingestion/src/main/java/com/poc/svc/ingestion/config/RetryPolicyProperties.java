package com.poc.svc.ingestion.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

@Validated
@ConfigurationProperties(prefix = "ingestion.retry")
public class RetryPolicyProperties {

    private static final int DEFAULT_MAX_RETRIES = 3;
    private static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofSeconds(1);
    private static final double DEFAULT_MULTIPLIER = 2.0d;
    private static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(30);

    @Min(0)
    private int maxRetries = DEFAULT_MAX_RETRIES;

    @NotNull
    @DurationUnit(ChronoUnit.MILLIS)
    private Duration initialBackoff = DEFAULT_INITIAL_BACKOFF;

    @DecimalMin("1.0")
    private double multiplier = DEFAULT_MULTIPLIER;

    @NotNull
    @DurationUnit(ChronoUnit.MILLIS)
    private Duration maxBackoff = DEFAULT_MAX_BACKOFF;

    public static RetryPolicyProperties defaults() {
        return new RetryPolicyProperties();
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.maxRetries = maxRetries;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public void setInitialBackoff(Duration initialBackoff) {
        this.initialBackoff = requireNonNegative(initialBackoff, "initialBackoff");
    }

    public double getMultiplier() {
        return multiplier;
    }

    public void setMultiplier(double multiplier) {
        if (multiplier < 1.0d) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        this.multiplier = multiplier;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
        this.maxBackoff = requireNonNegative(maxBackoff, "maxBackoff");
    }

    private static Duration requireNonNegative(Duration value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
        return value;
    }
}
