package com.chatbridge.outbound;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Admits one operation per token. Tokens refill one every {@code refill} interval, up to
 * {@code burst}. A caller that cannot be admitted right away reserves the next token and
 * sleeps until it is due; if the wait would exceed its deadline the reservation is returned.
 */
public class TokenBucket {

    private final long refillNanos;
    private final int burst;
    private final LongSupplier nanoTime;
    private final ReentrantLock lock = new ReentrantLock();

    private double tokens;
    private long lastRefill;

    public TokenBucket(Duration refill, int burst) {
        this(refill, burst, System::nanoTime);
    }

    TokenBucket(Duration refill, int burst, LongSupplier nanoTime) {
        if (refill.isNegative() || refill.isZero()) {
            throw new IllegalArgumentException("refill interval must be positive");
        }
        if (burst < 1) {
            throw new IllegalArgumentException("burst must be at least 1");
        }
        this.refillNanos = refill.toNanos();
        this.burst = burst;
        this.nanoTime = nanoTime;
        this.tokens = burst;
        this.lastRefill = nanoTime.getAsLong();
    }

    /** Takes a token if one is available now. */
    public boolean tryAcquire() {
        lock.lock();
        try {
            refill();
            if (tokens >= 1) {
                tokens -= 1;
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until a token is available.
     *
     * @return false if no token can be granted within {@code maxWait}
     * @throws InterruptedException if interrupted while waiting; the reserved token is given back
     */
    public boolean acquire(Duration maxWait) throws InterruptedException {
        long waitNanos;
        lock.lock();
        try {
            refill();
            tokens -= 1;
            waitNanos = tokens >= 0 ? 0 : (long) Math.ceil(-tokens * refillNanos);
            if (waitNanos > maxWait.toNanos()) {
                tokens += 1;
                return false;
            }
        } finally {
            lock.unlock();
        }
        if (waitNanos > 0) {
            try {
                TimeUnit.NANOSECONDS.sleep(waitNanos);
            } catch (InterruptedException e) {
                giveBack();
                throw e;
            }
        }
        return true;
    }

    public double available() {
        lock.lock();
        try {
            refill();
            return Math.max(0, tokens);
        } finally {
            lock.unlock();
        }
    }

    private void giveBack() {
        lock.lock();
        try {
            tokens = Math.min(burst, tokens + 1);
        } finally {
            lock.unlock();
        }
    }

    // caller holds lock
    private void refill() {
        long now = nanoTime.getAsLong();
        long elapsed = now - lastRefill;
        if (elapsed <= 0) return;
        tokens = Math.min(burst, tokens + (double) elapsed / refillNanos);
        lastRefill = now;
    }
}
