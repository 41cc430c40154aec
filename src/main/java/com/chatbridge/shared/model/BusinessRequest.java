package com.chatbridge.shared.model;

public record BusinessRequest(
    String sessionId,
    String message,
    String channel
) {}
