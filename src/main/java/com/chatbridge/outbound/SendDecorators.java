package com.chatbridge.outbound;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Wrappers around a send primitive. Compose as
 * {@code withRateLimit(bucket, wait, withRetry(attempts, base, ceiling, send))}
 * so admission happens once, before the retry loop.
 */
public final class SendDecorators {

    private SendDecorators() {}

    public static <T> Callable<T> withRateLimit(TokenBucket bucket, Duration maxWait, Callable<T> send) {
        return () -> {
            boolean admitted;
            try {
                admitted = bucket.acquire(maxWait);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AdmissionTimeoutException("Interrupted while waiting for rate limiter");
            }
            if (!admitted) {
                throw new AdmissionTimeoutException("Rate limiter wait exceeded " + maxWait.toMillis() + "ms");
            }
            return send.call();
        };
    }

    public static <T> Callable<T> withRetry(int attempts, Duration baseDelay, Duration ceiling, Callable<T> send) {
        return () -> ResilientCall.execute(send, attempts, baseDelay, ceiling);
    }
}
