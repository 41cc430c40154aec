package com.chatbridge.gateway;

import com.chatbridge.forward.EnvelopeCodec;
import com.chatbridge.observability.BridgeMetrics;
import com.chatbridge.shared.config.BridgeConfig;
import com.chatbridge.shared.config.ConfigLoader;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Beans shared by both roles. */
@Configuration
public class BridgeConfiguration {

    @Bean
    public BridgeConfig bridgeConfig() {
        return ConfigLoader.load();
    }

    @Bean
    public BridgeMetrics bridgeMetrics() {
        return new BridgeMetrics();
    }

    @Bean
    public EnvelopeCodec envelopeCodec(BridgeConfig config) {
        return new EnvelopeCodec(config.forward().extraParams());
    }
}
