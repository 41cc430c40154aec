package com.chatbridge.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Direction {
    IN("in"),
    OUT("out");

    private final String wire;

    Direction(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    /** Lenient parse: unknown or blank values map to {@code null} so partially filled events still decode. */
    @JsonCreator
    public static Direction fromWire(String value) {
        if (value == null) return null;
        var v = value.trim().toLowerCase(Locale.ROOT);
        if ("in".equals(v)) return IN;
        if ("out".equals(v)) return OUT;
        return null;
    }
}
