package com.chatbridge.shared.config;

import java.time.Duration;

public record IngestConfig(
    String secret,
    boolean requireSignature,
    boolean allowNoSecretDev,
    long bodyLimitBytes,
    boolean useTimestamp,
    Duration timestampSkew,
    Duration dedupeWindow,
    Duration aggregationWindow,
    Duration preReplyDelay,
    Duration typingPause,
    Duration typingDebounce,
    ReplyPacing pacing,
    String engineUrl,
    String businessUrl,
    String channel
) {
    /** Simulated typing time before a reply: {@code base + chars * perChar + jitter}, capped at {@code max}. */
    public record ReplyPacing(Duration base, Duration perChar, Duration jitter, Duration max) {
        public static ReplyPacing defaults() {
            return new ReplyPacing(Duration.ofMillis(800), Duration.ofMillis(25),
                    Duration.ofMillis(300), Duration.ofSeconds(4));
        }
    }

    /** Refuses to run with signatures required but no secret, unless the dev override is set. */
    public void validate() {
        if (requireSignature && (secret == null || secret.isBlank()) && !allowNoSecretDev) {
            throw new IllegalStateException(
                    "ingest.require-signature is on but no secret is configured (set CHATBRIDGE_WEBHOOK_SECRET)");
        }
    }

    public static IngestConfig defaults() {
        return new IngestConfig(
            "",
            true,
            false,
            1_048_576,
            false,
            Duration.ofMinutes(5),
            Duration.ofMinutes(10),
            Duration.ofSeconds(3),
            Duration.ofMillis(500),
            Duration.ofMillis(400),
            Duration.ofMillis(700),
            ReplyPacing.defaults(),
            "http://127.0.0.1:8080",
            "http://localhost:3000/api/chat/message",
            "whatsapp"
        );
    }
}
