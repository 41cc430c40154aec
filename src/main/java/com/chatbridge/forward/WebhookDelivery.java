package com.chatbridge.forward;

import com.chatbridge.auth.WebhookSigner;
import com.chatbridge.observability.BridgeMetrics;
import com.chatbridge.shared.config.WebhookConfig;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fire-and-forget POST of serialized envelopes. Each body is signed, then tried up to
 * {@code maxAttempts} times with doubling delay; transport errors and non-2xx responses both
 * count as failures. The outcome is only logged and counted.
 */
public class WebhookDelivery implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WebhookDelivery.class);

    private final WebhookConfig config;
    private final WebhookSigner signer;
    private final HttpClient httpClient;
    private final ExecutorService executor;
    private final BridgeMetrics metrics;
    private final Clock clock;

    public WebhookDelivery(WebhookConfig config, BridgeMetrics metrics) {
        this(config,
                HttpClient.newBuilder().connectTimeout(config.timeout()).build(),
                Executors.newCachedThreadPool(daemonThreads()),
                metrics,
                Clock.systemUTC());
    }

    public WebhookDelivery(WebhookConfig config, HttpClient httpClient, ExecutorService executor,
                           BridgeMetrics metrics, Clock clock) {
        this.config = config;
        this.signer = new WebhookSigner(config.secret());
        this.httpClient = httpClient;
        this.executor = executor;
        this.metrics = metrics;
        this.clock = clock;
    }

    /** Queues {@code body} for delivery and returns immediately. */
    public Future<Boolean> submit(byte[] body) {
        try {
            return executor.submit(() -> deliver(body));
        } catch (RejectedExecutionException e) {
            log.warn("webhook_rejected reason=shutting_down");
            return CompletableFuture.completedFuture(false);
        }
    }

    /** Delivers synchronously; false once every attempt failed or the thread was interrupted. */
    public boolean deliver(byte[] body) {
        var sample = Timer.start(metrics.registry());
        long delay = config.baseDelay().toMillis();
        String lastError = "";
        int attempts = Math.max(1, config.maxAttempts());
        try {
            for (int attempt = 1; attempt <= attempts; attempt++) {
                try {
                    var resp = httpClient.send(request(body), HttpResponse.BodyHandlers.discarding());
                    if (resp.statusCode() >= 200 && resp.statusCode() < 300) {
                        log.debug("webhook_ok status={} attempt={}", resp.statusCode(), attempt);
                        return true;
                    }
                    lastError = "webhook non-2xx: " + resp.statusCode();
                } catch (IOException e) {
                    lastError = e.getClass().getSimpleName() + ": " + e.getMessage();
                }
                if (attempt < attempts) {
                    Thread.sleep(delay);
                    delay *= 2;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            lastError = "cancelled";
        } finally {
            sample.stop(metrics.webhookLatency());
        }
        metrics.webhookFailures().increment();
        log.warn("webhook post failed url={} error={}", config.url(), lastError);
        return false;
    }

    HttpRequest request(byte[] body) {
        var builder = HttpRequest.newBuilder()
                .uri(URI.create(config.url()))
                .timeout(config.timeout())
                .header("Content-Type", "application/json")
                .header(WebhookSigner.TIMESTAMP_HEADER, DateTimeFormatter.ISO_INSTANT.format(
                        Instant.now(clock).truncatedTo(ChronoUnit.SECONDS)));
        config.headers().forEach(builder::setHeader);
        if (signer.hasSecret()) {
            builder.setHeader(WebhookSigner.SIGNATURE_HEADER, signer.sign(body));
        }
        return builder.POST(HttpRequest.BodyPublishers.ofByteArray(body)).build();
    }

    /** Stops accepting bodies, waits up to {@code grace}, then interrupts pending retries. */
    public void close(Duration grace) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                var dropped = executor.shutdownNow();
                log.warn("webhook_shutdown forced pending={}", dropped.size());
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        close(Duration.ofSeconds(5));
    }

    private static ThreadFactory daemonThreads() {
        var seq = new AtomicInteger();
        return r -> {
            var t = new Thread(r, "webhook-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
