package com.chatbridge.shared.config;

import java.time.Duration;

public record EngineConfig(
    int maxConnectAttempts,
    Duration reconnectBaseDelay,
    boolean statusEnabled,
    Duration shutdownGrace
) {
    public static EngineConfig defaults() {
        return new EngineConfig(5, Duration.ofSeconds(2), false, Duration.ofSeconds(5));
    }
}
