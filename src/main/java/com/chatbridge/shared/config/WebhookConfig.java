package com.chatbridge.shared.config;

import java.time.Duration;
import java.util.Map;

public record WebhookConfig(
    boolean enabled,
    String url,
    String secret,
    Map<String, String> headers,
    int maxAttempts,
    Duration baseDelay,
    Duration timeout
) {
    public static WebhookConfig defaults() {
        return new WebhookConfig(false, "", "", Map.of(), 3, Duration.ofMillis(250), Duration.ofSeconds(7));
    }

    public boolean active() {
        return enabled && url != null && !url.isBlank();
    }
}
