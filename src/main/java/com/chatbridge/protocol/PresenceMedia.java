package com.chatbridge.protocol;

public enum PresenceMedia {
    TEXT,
    AUDIO;

    public static PresenceMedia parse(String value) {
        return "audio".equalsIgnoreCase(value == null ? "" : value.trim()) ? AUDIO : TEXT;
    }
}
