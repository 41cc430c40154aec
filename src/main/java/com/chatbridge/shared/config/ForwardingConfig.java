package com.chatbridge.shared.config;

import java.util.Map;

public record ForwardingConfig(
    ForwardMode mode,
    String outFolder,
    long maxFileBytes,
    Map<String, Object> extraParams,
    WebhookConfig webhook
) {
    public static ForwardingConfig defaults() {
        return new ForwardingConfig(ForwardMode.FOLDER, "outbox", 0, Map.of(), WebhookConfig.defaults());
    }
}
