package com.chatbridge.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class BridgeMetrics {

    private final MeterRegistry registry;

    public BridgeMetrics() {
        this(new SimpleMeterRegistry());
    }

    public BridgeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Counter envelopesForwarded() {
        return Counter.builder("chatbridge.envelopes.forwarded").register(registry);
    }

    public Counter webhookFailures() {
        return Counter.builder("chatbridge.webhook.failures").register(registry);
    }

    public Timer webhookLatency() {
        return Timer.builder("chatbridge.webhook.latency").register(registry);
    }

    public Counter dedupeDuplicates() {
        return Counter.builder("chatbridge.dedupe.duplicates").register(registry);
    }

    public Counter aggregationFlushes() {
        return Counter.builder("chatbridge.aggregation.flushes").register(registry);
    }

    public Counter outboundSends() {
        return Counter.builder("chatbridge.outbound.sends").register(registry);
    }
}
