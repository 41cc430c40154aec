package com.chatbridge.shared.config;

public record BridgeConfig(
    EngineConfig engine,
    ForwardingConfig forward,
    RateLimitConfig limits,
    IngestConfig ingest,
    ProfileConfig profiles
) {
    public static BridgeConfig defaults() {
        return new BridgeConfig(
            EngineConfig.defaults(),
            ForwardingConfig.defaults(),
            RateLimitConfig.defaults(),
            IngestConfig.defaults(),
            ProfileConfig.defaults()
        );
    }
}
