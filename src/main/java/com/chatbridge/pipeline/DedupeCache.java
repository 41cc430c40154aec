package com.chatbridge.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Remembers keys for a trailing window. A key seen again inside the window is a duplicate and
 * keeps its original timestamp; outside the window it is recorded afresh.
 */
public class DedupeCache implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DedupeCache.class);

    private final Duration window;
    private final Clock clock;
    private final Map<String, Instant> seen = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private ScheduledExecutorService sweeper;

    public DedupeCache(Duration window) {
        this(window, Clock.systemUTC());
    }

    public DedupeCache(Duration window, Clock clock) {
        this.window = window;
        this.clock = clock;
    }

    /** Starts evicting expired keys every {@code interval}. */
    public DedupeCache withSweeper(Duration interval, String name) {
        var exec = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
        exec.scheduleWithFixedDelay(this::sweepQuietly, interval.toMillis(), interval.toMillis(),
                TimeUnit.MILLISECONDS);
        this.sweeper = exec;
        return this;
    }

    /** @return true if {@code key} was already seen within the window; blank keys never are */
    public boolean seen(String key) {
        if (key == null || key.isBlank()) return false;
        var now = Instant.now(clock);
        lock.lock();
        try {
            var when = seen.get(key);
            if (when != null && !now.isAfter(when.plus(window))) {
                return true;
            }
            seen.put(key, now);
            return false;
        } finally {
            lock.unlock();
        }
    }

    /** Drops keys older than the window; returns how many were removed. */
    public int sweep() {
        var cutoff = Instant.now(clock).minus(window);
        lock.lock();
        try {
            int before = seen.size();
            seen.values().removeIf(t -> t.isBefore(cutoff));
            return before - seen.size();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return seen.size();
        } finally {
            lock.unlock();
        }
    }

    private void sweepQuietly() {
        try {
            int evicted = sweep();
            if (evicted > 0) log.debug("dedupe_sweep evicted={} remaining={}", evicted, size());
        } catch (RuntimeException e) {
            log.warn("dedupe_sweep_failed: {}", e.getMessage());
        }
    }

    @Override
    public void close() {
        if (sweeper != null) sweeper.shutdownNow();
    }
}
