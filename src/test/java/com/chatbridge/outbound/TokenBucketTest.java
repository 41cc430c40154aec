package com.chatbridge.outbound;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class TokenBucketTest {

    private final AtomicLong nanos = new AtomicLong(1_000_000_000L);

    @Test
    void burstThenRefill() {
        var bucket = new TokenBucket(Duration.ofMillis(100), 2, nanos::get);
        assertTrue(bucket.tryAcquire());
        assertTrue(bucket.tryAcquire());
        assertFalse(bucket.tryAcquire());

        nanos.addAndGet(Duration.ofMillis(100).toNanos());
        assertTrue(bucket.tryAcquire());
        assertFalse(bucket.tryAcquire());
    }

    @Test
    void refillNeverExceedsBurst() {
        var bucket = new TokenBucket(Duration.ofMillis(10), 3, nanos::get);
        nanos.addAndGet(Duration.ofSeconds(10).toNanos());
        assertEquals(3.0, bucket.available(), 1e-9);
    }

    @Test
    void acquireGivesUpWhenWaitExceedsDeadline() throws InterruptedException {
        var bucket = new TokenBucket(Duration.ofSeconds(1), 1, nanos::get);
        assertTrue(bucket.acquire(Duration.ZERO));
        assertFalse(bucket.acquire(Duration.ofMillis(10)));
        // the refused reservation was returned
        nanos.addAndGet(Duration.ofSeconds(1).toNanos());
        assertTrue(bucket.tryAcquire());
    }

    @Test
    void acquireWaitsForNextToken() throws InterruptedException {
        var bucket = new TokenBucket(Duration.ofMillis(50), 1);
        assertTrue(bucket.acquire(Duration.ZERO));
        long start = System.nanoTime();
        assertTrue(bucket.acquire(Duration.ofSeconds(1)));
        long waitedMs = (System.nanoTime() - start) / 1_000_000;
        assertTrue(waitedMs >= 30, "Expected to wait for refill, waited " + waitedMs + "ms");
    }

    @Test
    void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> new TokenBucket(Duration.ZERO, 1));
        assertThrows(IllegalArgumentException.class, () -> new TokenBucket(Duration.ofMillis(1), 0));
    }
}
