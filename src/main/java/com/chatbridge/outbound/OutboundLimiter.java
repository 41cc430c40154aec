package com.chatbridge.outbound;

import com.chatbridge.shared.config.RateLimitConfig;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Callable;

/** One token bucket and retry policy per operation class. */
public class OutboundLimiter {

    private final RateLimitConfig config;
    private final Map<OperationClass, TokenBucket> buckets = new EnumMap<>(OperationClass.class);

    public OutboundLimiter(RateLimitConfig config) {
        this.config = config;
        for (var op : OperationClass.values()) {
            var limit = limitFor(op);
            buckets.put(op, new TokenBucket(limit.refill(), limit.burst()));
        }
    }

    public <T> T execute(OperationClass op, Callable<T> send) {
        var limit = limitFor(op);
        var decorated = SendDecorators.withRateLimit(buckets.get(op), config.admissionTimeout(),
                SendDecorators.withRetry(limit.attempts(), limit.baseDelay(), config.retryCeiling(), send));
        try {
            return decorated.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }

    public RateLimitConfig.OperationLimit limitFor(OperationClass op) {
        switch (op) {
            case MEDIA:
                return config.media();
            case STATUS:
                return config.status();
            default:
                return config.text();
        }
    }
}
