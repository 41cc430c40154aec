package com.chatbridge.protocol;

import java.util.Locale;
import java.util.Set;

public enum MediaKind {
    IMAGE("image"),
    AUDIO("audio"),
    VIDEO("video"),
    DOCUMENT("document");

    private static final Set<String> IMAGE_EXT = Set.of(".jpg", ".jpeg", ".png", ".webp", ".gif");
    private static final Set<String> VIDEO_EXT = Set.of(".mp4", ".mov", ".m4v", ".webm");
    private static final Set<String> AUDIO_EXT = Set.of(".ogg", ".opus", ".mp3", ".m4a", ".wav");

    private final String wire;

    MediaKind(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }

    public static MediaKind fromFileName(String fileName) {
        if (fileName == null) return DOCUMENT;
        var name = fileName.toLowerCase(Locale.ROOT);
        var dot = name.lastIndexOf('.');
        if (dot < 0) return DOCUMENT;
        var ext = name.substring(dot);
        if (IMAGE_EXT.contains(ext)) return IMAGE;
        if (VIDEO_EXT.contains(ext)) return VIDEO;
        if (AUDIO_EXT.contains(ext)) return AUDIO;
        return DOCUMENT;
    }
}
