package com.chatbridge.protocol;

import com.chatbridge.shared.model.MediaTicket;

import java.util.Base64;

/** One media attachment as decoded by the protocol client. */
public record MediaPart(
    MediaKind kind,
    String mimetype,
    String caption,
    String title,
    String url,
    String directPath,
    byte[] mediaKey,
    byte[] fileSha256,
    byte[] fileEncSha256,
    long fileLength,
    Integer seconds
) {

    public MediaTicket toTicket() {
        return MediaTicket.of(
                kind.wire(),
                mimetype,
                title,
                url,
                directPath,
                base64(mediaKey),
                base64(fileSha256),
                base64(fileEncSha256),
                fileLength > 0 ? fileLength : null,
                seconds != null && seconds > 0 ? seconds : null);
    }

    private static String base64(byte[] bytes) {
        return bytes == null || bytes.length == 0 ? null : Base64.getEncoder().encodeToString(bytes);
    }
}
