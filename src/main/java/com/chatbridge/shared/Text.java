package com.chatbridge.shared;

public final class Text {

    private Text() {}

    /** Trims, flattens newlines and cuts to {@code max} code points with a trailing ellipsis. */
    public static String preview(String s, int max) {
        if (s == null) return "";
        var flat = s.trim().replace("\r\n", " ").replace('\n', ' ').replace('\r', ' ');
        if (max <= 0 || flat.codePointCount(0, flat.length()) <= max) return flat;
        return flat.substring(0, flat.offsetByCodePoints(0, max)) + "…";
    }

    public static int length(String s) {
        return s == null ? 0 : s.trim().codePointCount(0, s.trim().length());
    }

    public static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
