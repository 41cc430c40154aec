package com.chatbridge.outbound;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Bounded retry with doubling delay. Every failure is retried; there is no sleep after the
 * last attempt.
 */
public class ResilientCall {

    private static final int MAX_ATTEMPTS = 3;
    private static final Duration BASE_DELAY = Duration.ofMillis(250);
    private static final Duration MAX_BACKOFF = Duration.ofSeconds(5);

    public static <T> T execute(Callable<T> action) {
        return execute(action, MAX_ATTEMPTS, BASE_DELAY, MAX_BACKOFF);
    }

    public static <T> T execute(Callable<T> action, int maxAttempts, Duration baseDelay, Duration ceiling) {
        Exception last = null;
        long delay = Math.max(0, baseDelay.toMillis());
        long cap = Math.max(delay, ceiling.toMillis());
        int attempts = Math.max(1, maxAttempts);

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return action.call();
            } catch (Exception e) {
                last = e;
                if (Thread.currentThread().isInterrupted()) break;
                if (attempt < attempts) {
                    sleep(delay);
                    delay = Math.min(delay * 2, cap);
                }
            }
        }
        throw new RuntimeException("All retries exhausted", last);
    }

    private static void sleep(long ms) {
        if (ms <= 0) return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted during retry", ie);
        }
    }
}
