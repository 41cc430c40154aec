package com.chatbridge.shared.config;

import java.time.Duration;

public record RateLimitConfig(
    OperationLimit text,
    OperationLimit media,
    OperationLimit status,
    Duration retryCeiling,
    Duration admissionTimeout
) {
    /** One token every {@code refill}, at most {@code burst} banked; then {@code attempts} tries with doubling delay. */
    public record OperationLimit(Duration refill, int burst, int attempts, Duration baseDelay) {}

    public static RateLimitConfig defaults() {
        return new RateLimitConfig(
            new OperationLimit(Duration.ofMillis(50), 5, 3, Duration.ofMillis(250)),
            new OperationLimit(Duration.ofMillis(150), 2, 3, Duration.ofMillis(400)),
            new OperationLimit(Duration.ofMillis(500), 1, 2, Duration.ofMillis(600)),
            Duration.ofSeconds(5),
            Duration.ofSeconds(30)
        );
    }
}
