package com.chatbridge.ingest;

import com.chatbridge.shared.model.Envelope;

import java.util.List;
import java.util.Optional;

/** Decides whether an envelope is routed further. Returns the rejection reason, if any. */
@FunctionalInterface
public interface EnvelopeFilter {

    Optional<String> reject(Envelope env);

    static EnvelopeFilter notOutbound() {
        return env -> env.isOutbound() ? Optional.of("direction_out") : Optional.empty();
    }

    static EnvelopeFilter requireSender() {
        return env -> env.senderId() == null || env.senderId().isBlank()
                ? Optional.of("missing_sender") : Optional.empty();
    }

    /** First rejection wins. */
    static EnvelopeFilter chain(List<EnvelopeFilter> filters) {
        var copy = List.copyOf(filters);
        return env -> {
            for (var f : copy) {
                var reason = f.reject(env);
                if (reason.isPresent()) return reason;
            }
            return Optional.empty();
        };
    }

    static EnvelopeFilter standard() {
        return chain(List.of(notOutbound(), requireSender()));
    }
}
