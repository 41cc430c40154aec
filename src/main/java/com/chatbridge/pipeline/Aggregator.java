package com.chatbridge.pipeline;

import com.chatbridge.observability.BridgeMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-chat debounce window. The first {@link #add} starts a window; later adds and
 * {@link #touch}es push the deadline out. When a deadline passes untouched the window fires
 * once with the number of buffered messages and starts over empty.
 *
 * <p>State changes for one chat are serialized by that chat's lock. Flushes run on a separate
 * executor, one at a time per chat.
 */
public class Aggregator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Aggregator.class);

    public static final String START = "start";
    public static final String MESSAGE = "message";
    public static final String TYPING = "typing";
    public static final String FIRE = "fire";

    @FunctionalInterface
    public interface FlushHandler {
        void onFlush(String chatId, int count);
    }

    @FunctionalInterface
    public interface ResetListener {
        void onReset(String chatId, String reason, int count, Duration window);
    }

    private static final class Window {
        final ReentrantLock lock = new ReentrantLock();
        final ReentrantLock flushLock = new ReentrantLock();
        int count;
        long generation;
        ScheduledFuture<?> timer;
    }

    private final Duration window;
    private final FlushHandler onFlush;
    private final ResetListener onReset;
    private final BridgeMetrics metrics;
    private final ScheduledExecutorService timers;
    private final ExecutorService flushes;
    private final ConcurrentHashMap<String, Window> windows = new ConcurrentHashMap<>();

    public Aggregator(Duration window, FlushHandler onFlush, ResetListener onReset, BridgeMetrics metrics) {
        this.window = window;
        this.onFlush = onFlush;
        this.onReset = onReset != null ? onReset : (c, r, n, w) -> {};
        this.metrics = metrics;
        this.timers = Executors.newSingleThreadScheduledExecutor(named("agg-timer"));
        this.flushes = Executors.newCachedThreadPool(named("agg-flush"));
    }

    /** Buffers one message for {@code chatId}, starting or extending its window. */
    public void add(String chatId) {
        if (chatId == null || chatId.isBlank()) return;
        var w = windows.computeIfAbsent(chatId, k -> new Window());
        int count;
        w.lock.lock();
        try {
            w.count++;
            count = w.count;
            reschedule(chatId, w);
        } finally {
            w.lock.unlock();
        }
        onReset.onReset(chatId, count == 1 ? START : MESSAGE, count, window);
    }

    /**
     * Extends the window of a chat that already has buffered messages; ignored otherwise.
     *
     * @return true if a window was extended
     */
    public boolean touch(String chatId) {
        if (chatId == null) return false;
        var w = windows.get(chatId);
        if (w == null) return false;
        int count;
        w.lock.lock();
        try {
            if (w.count == 0) return false;
            count = w.count;
            reschedule(chatId, w);
        } finally {
            w.lock.unlock();
        }
        onReset.onReset(chatId, TYPING, count, window);
        return true;
    }

    public int pending(String chatId) {
        var w = windows.get(chatId);
        if (w == null) return 0;
        w.lock.lock();
        try {
            return w.count;
        } finally {
            w.lock.unlock();
        }
    }

    public Duration window() {
        return window;
    }

    // caller holds w.lock
    private void reschedule(String chatId, Window w) {
        if (w.timer != null) w.timer.cancel(false);
        long gen = ++w.generation;
        try {
            w.timer = timers.schedule(() -> fire(chatId, w, gen), window.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("agg_schedule_rejected chat={} reason=shutting_down", chatId);
        }
    }

    private void fire(String chatId, Window w, long gen) {
        int count;
        w.lock.lock();
        try {
            if (w.generation != gen || w.count == 0) return;
            count = w.count;
            w.count = 0;
            w.timer = null;
        } finally {
            w.lock.unlock();
        }
        onReset.onReset(chatId, FIRE, count, window);
        try {
            flushes.execute(() -> runFlush(chatId, w, count));
        } catch (RejectedExecutionException e) {
            log.warn("agg_flush_dropped chat={} count={} reason=shutting_down", chatId, count);
        }
    }

    private void runFlush(String chatId, Window w, int count) {
        w.flushLock.lock();
        try {
            metrics.aggregationFlushes().increment();
            onFlush.onFlush(chatId, count);
        } catch (RuntimeException e) {
            log.warn("agg_flush_failed chat={} count={}: {}", chatId, count, e.getMessage());
        } finally {
            w.flushLock.unlock();
        }
    }

    /** Cancels pending windows and waits up to {@code grace} for running flushes. */
    public void close(Duration grace) {
        timers.shutdownNow();
        flushes.shutdown();
        try {
            if (!flushes.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                flushes.shutdownNow();
            }
        } catch (InterruptedException e) {
            flushes.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        close(Duration.ofSeconds(5));
    }

    private static ThreadFactory named(String prefix) {
        var seq = new AtomicInteger();
        return r -> {
            var t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
