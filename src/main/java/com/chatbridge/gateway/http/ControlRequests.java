package com.chatbridge.gateway.http;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Request bodies of the engine's control surface. */
public final class ControlRequests {

    private ControlRequests() {}

    /** Media comes from {@code media_path} or, base64 in JSON, from {@code media_data} named by {@code file_name}. */
    public record SendMessage(
        @JsonProperty("recipient") String recipient,
        @JsonProperty("message") String message,
        @JsonProperty("media_path") String mediaPath,
        @JsonProperty("media_data") byte[] mediaData,
        @JsonProperty("file_name") String fileName,
        @JsonProperty("mimetype") String mimetype
    ) {
        public boolean hasMedia() {
            return (mediaPath != null && !mediaPath.isBlank()) || (mediaData != null && mediaData.length > 0);
        }
    }

    public record Typing(
        @JsonProperty("recipient") String recipient,
        @JsonProperty("typing") boolean typing,
        @JsonProperty("media") String media
    ) {}

    public record MarkRead(
        @JsonProperty("recipient") String recipient,
        @JsonProperty("message_ids") List<String> messageIds,
        @JsonProperty("receipt_type") String receiptType,
        @JsonProperty("sender") String sender
    ) {}

    public record Status(
        @JsonProperty("message") String message
    ) {}
}
