package com.chatbridge.observability;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BridgeMetricsTest {

    @Test
    void registersAllMeters() {
        var metrics = new BridgeMetrics();
        assertNotNull(metrics.registry());
        assertNotNull(metrics.envelopesForwarded());
        assertNotNull(metrics.webhookFailures());
        assertNotNull(metrics.webhookLatency());
        assertNotNull(metrics.dedupeDuplicates());
        assertNotNull(metrics.aggregationFlushes());
        assertNotNull(metrics.outboundSends());
    }

    @Test
    void countersIncrementCorrectly() {
        var metrics = new BridgeMetrics();
        metrics.outboundSends().increment();
        metrics.outboundSends().increment();
        assertEquals(2.0, metrics.outboundSends().count());
        assertEquals(2.0, metrics.registry().get("chatbridge.outbound.sends").counter().count());
    }
}
