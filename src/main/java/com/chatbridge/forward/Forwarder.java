package com.chatbridge.forward;

import com.chatbridge.observability.BridgeMetrics;
import com.chatbridge.shared.model.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Fans one envelope out to the folder sink and the webhook. Either target may be absent. A
 * failure in one never prevents the other.
 */
public class Forwarder {

    private static final Logger log = LoggerFactory.getLogger(Forwarder.class);

    private final EnvelopeCodec codec;
    private final FolderSink sink;
    private final WebhookDelivery webhook;
    private final BridgeMetrics metrics;

    public Forwarder(EnvelopeCodec codec, FolderSink sink, WebhookDelivery webhook, BridgeMetrics metrics) {
        this.codec = codec;
        this.sink = sink;
        this.webhook = webhook;
        this.metrics = metrics;
    }

    public void forward(Envelope env) {
        byte[] payload;
        try {
            payload = codec.encode(env);
        } catch (RuntimeException e) {
            log.warn("marshal envelope failed type={}: {}", env.eventType(), e.getMessage());
            return;
        }
        if (sink != null) {
            try {
                sink.append(env, payload);
            } catch (RuntimeException e) {
                log.warn("sink_write_failed type={} chat={}: {}", env.eventType(), env.chatId(), e.getMessage());
            }
        }
        if (webhook != null) {
            webhook.submit(payload);
        }
        metrics.envelopesForwarded().increment();
    }

    public EnvelopeCodec codec() {
        return codec;
    }

    /** Waits up to {@code grace} for queued webhook deliveries. */
    public void close(Duration grace) {
        if (webhook != null) {
            webhook.close(grace);
        }
    }
}
