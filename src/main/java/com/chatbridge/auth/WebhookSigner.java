package com.chatbridge.auth;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.HexFormat;

/**
 * HMAC-SHA256 over the raw request body, sent as {@code sha256=<hex>}.
 */
public class WebhookSigner {

    public static final String SIGNATURE_HEADER = "X-Bridge-Signature";
    public static final String TIMESTAMP_HEADER = "X-Bridge-Timestamp";
    public static final String PREFIX = "sha256=";

    private static final String ALGORITHM = "HmacSHA256";

    private final byte[] key;

    public WebhookSigner(String secret) {
        this.key = (secret == null ? "" : secret).getBytes(StandardCharsets.UTF_8);
    }

    public boolean hasSecret() {
        return key.length > 0;
    }

    public String sign(byte[] body) {
        return PREFIX + HexFormat.of().formatHex(mac(body));
    }

    /**
     * Constant-time comparison of {@code header} against the signature of {@code body}. Always
     * false without a secret.
     */
    public boolean verify(byte[] body, String header) {
        if (!hasSecret() || header == null) return false;
        header = header.trim();
        if (!header.startsWith(PREFIX)) return false;
        byte[] given;
        try {
            given = HexFormat.of().parseHex(header.substring(PREFIX.length()).trim());
        } catch (IllegalArgumentException e) {
            return false;
        }
        return MessageDigest.isEqual(mac(body), given);
    }

    /**
     * Accepts Unix seconds or RFC 3339; true if within {@code skew} of {@code now} either way.
     */
    public static boolean timestampWithin(String header, Duration skew, Instant now) {
        if (header == null || header.isBlank()) return false;
        var ts = parseTimestamp(header.trim());
        if (ts == null) return false;
        var delta = Duration.between(ts, now).abs();
        return delta.compareTo(skew) <= 0;
    }

    static Instant parseTimestamp(String value) {
        try {
            return Instant.ofEpochSecond(Long.parseLong(value));
        } catch (NumberFormatException ignored) {
            // not unix seconds, try RFC 3339
        } catch (DateTimeException e) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private byte[] mac(byte[] body) {
        try {
            var mac = Mac.getInstance(ALGORITHM);
            // SecretKeySpec rejects empty keys; a single zero byte pads to the same HMAC key
            mac.init(new SecretKeySpec(key.length == 0 ? new byte[1] : key, ALGORITHM));
            return mac.doFinal(body == null ? new byte[0] : body);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}
