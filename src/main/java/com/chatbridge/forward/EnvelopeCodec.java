package com.chatbridge.forward;

import com.chatbridge.shared.Json;
import com.chatbridge.shared.model.Envelope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Map;

/**
 * Serializes envelopes for the sink and the webhook. Stamps {@code at} with the current UTC time
 * (RFC 3339, second precision) and fills {@code extra} with the configured defaults when the
 * envelope carries none.
 */
public class EnvelopeCodec {

    private final ObjectMapper mapper;
    private final Map<String, Object> defaultExtra;
    private final Clock clock;

    public EnvelopeCodec(Map<String, Object> defaultExtra) {
        this(Json.newMapper(), defaultExtra, Clock.systemUTC());
    }

    public EnvelopeCodec(ObjectMapper mapper, Map<String, Object> defaultExtra, Clock clock) {
        this.mapper = mapper;
        this.defaultExtra = defaultExtra == null ? Map.of() : Map.copyOf(defaultExtra);
        this.clock = clock;
    }

    public Envelope stamp(Envelope env) {
        var stamped = env.withAt(now());
        if (stamped.extra().isEmpty() && !defaultExtra.isEmpty()) {
            stamped = stamped.withExtra(defaultExtra);
        }
        return stamped;
    }

    public byte[] encode(Envelope env) {
        try {
            return mapper.writeValueAsBytes(stamp(env));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize envelope " + env.eventType(), e);
        }
    }

    public Envelope decode(byte[] body) {
        try {
            return mapper.readValue(body, Envelope.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed envelope: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed envelope", e);
        }
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    private String now() {
        return DateTimeFormatter.ISO_INSTANT.format(Instant.now(clock).truncatedTo(ChronoUnit.SECONDS));
    }
}
