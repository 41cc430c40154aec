package com.chatbridge.engine;

import com.chatbridge.protocol.MediaKind;

import java.io.IOException;
import java.net.URLConnection;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Bytes plus metadata of one outgoing attachment. {@code seconds} and {@code waveform} only
 * matter for audio and are derived when absent.
 */
public record MediaInput(
    byte[] data,
    String mimetype,
    String fileName,
    String caption,
    MediaKind kind,
    Integer seconds,
    byte[] waveform
) {

    public static final String FALLBACK_MIME = "application/octet-stream";

    private static final Map<String, String> MIME_BY_EXT = Map.ofEntries(
            Map.entry(".jpg", "image/jpeg"),
            Map.entry(".jpeg", "image/jpeg"),
            Map.entry(".png", "image/png"),
            Map.entry(".webp", "image/webp"),
            Map.entry(".gif", "image/gif"),
            Map.entry(".mp4", "video/mp4"),
            Map.entry(".mov", "video/quicktime"),
            Map.entry(".m4v", "video/x-m4v"),
            Map.entry(".webm", "video/webm"),
            Map.entry(".ogg", "audio/ogg"),
            Map.entry(".opus", "audio/ogg; codecs=opus"),
            Map.entry(".mp3", "audio/mpeg"),
            Map.entry(".m4a", "audio/mp4"),
            Map.entry(".wav", "audio/wav"),
            Map.entry(".pdf", "application/pdf"),
            Map.entry(".txt", "text/plain; charset=utf-8")
    );

    public static MediaInput fromFile(Path path, String caption) throws IOException {
        var name = path.getFileName().toString();
        return of(Files.readAllBytes(path), name, caption, null);
    }

    /** Kind from the file extension; MIME from {@code mimetype}, else the extension. */
    public static MediaInput of(byte[] data, String fileName, String caption, String mimetype) {
        var mime = mimetype != null && !mimetype.isBlank() ? mimetype : mimeFor(fileName);
        return new MediaInput(data, mime, fileName, caption, MediaKind.fromFileName(fileName), null, null);
    }

    public static String mimeFor(String fileName) {
        if (fileName == null) return FALLBACK_MIME;
        var lower = fileName.toLowerCase(Locale.ROOT);
        var dot = lower.lastIndexOf('.');
        if (dot >= 0) {
            var known = MIME_BY_EXT.get(lower.substring(dot));
            if (known != null) return known;
        }
        var guessed = URLConnection.guessContentTypeFromName(fileName);
        return guessed != null ? guessed : FALLBACK_MIME;
    }

    public boolean isOggOpus() {
        var m = mimetype == null ? "" : mimetype.toLowerCase(Locale.ROOT);
        return m.contains("ogg") || m.contains("opus");
    }
}
