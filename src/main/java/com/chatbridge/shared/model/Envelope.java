package com.chatbridge.shared.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical representation of one protocol event, shared by the engine, the sinks and the
 * ingestion endpoint. Receipts carry {@code message_ids}; every other event carries at most a
 * single {@code message_id}. {@code at} is stamped when the envelope is serialized, not when the
 * event is captured.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Envelope(
    @JsonProperty("event_type") String eventType,
    @JsonProperty("direction") Direction direction,
    @JsonProperty("chat_id") @JsonAlias("chat_jid") String chatId,
    @JsonProperty("sender_id") @JsonAlias("sender_jid") String senderId,
    @JsonProperty("chat_name") String chatName,
    @JsonProperty("message_id") String messageId,
    @JsonProperty("message_ids") List<String> messageIds,
    @JsonProperty("receipt_type") String receiptType,
    @JsonProperty("text") String text,
    @JsonProperty("media") MediaTicket media,
    @JsonProperty("extra") Map<String, Object> extra,
    @JsonProperty("at") String at
) {

    public Envelope {
        messageIds = messageIds == null ? List.of() : List.copyOf(messageIds);
        extra = extra == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
        if (messageId != null && !messageId.isBlank() && !messageIds.isEmpty()) {
            throw new IllegalArgumentException(
                    "Envelope carries both message_id and message_ids for event " + eventType);
        }
    }

    public static Builder builder(String eventType) {
        return new Builder(eventType);
    }

    public Envelope withAt(String at) {
        return new Envelope(eventType, direction, chatId, senderId, chatName, messageId,
                messageIds, receiptType, text, media, extra, at);
    }

    public Envelope withExtra(Map<String, Object> extra) {
        return new Envelope(eventType, direction, chatId, senderId, chatName, messageId,
                messageIds, receiptType, text, media, extra, at);
    }

    @JsonIgnore
    public boolean isMessage() {
        return EventTypes.MESSAGE.equals(eventType);
    }

    @JsonIgnore
    public boolean isOutbound() {
        return direction == Direction.OUT;
    }

    public static final class Builder {
        private final String eventType;
        private Direction direction;
        private String chatId;
        private String senderId;
        private String chatName;
        private String messageId;
        private List<String> messageIds;
        private String receiptType;
        private String text;
        private MediaTicket media;
        private Map<String, Object> extra;

        private Builder(String eventType) {
            this.eventType = eventType;
        }

        public Builder direction(Direction direction) { this.direction = direction; return this; }
        public Builder chatId(String chatId) { this.chatId = chatId; return this; }
        public Builder senderId(String senderId) { this.senderId = senderId; return this; }
        public Builder chatName(String chatName) { this.chatName = chatName; return this; }
        public Builder messageId(String messageId) { this.messageId = messageId; return this; }
        public Builder messageIds(List<String> messageIds) { this.messageIds = messageIds; return this; }
        public Builder receiptType(String receiptType) { this.receiptType = receiptType; return this; }
        public Builder text(String text) { this.text = text; return this; }
        public Builder media(MediaTicket media) { this.media = media; return this; }
        public Builder extra(Map<String, Object> extra) { this.extra = extra; return this; }

        public Envelope build() {
            return new Envelope(eventType, direction, chatId, senderId, chatName, messageId,
                    messageIds, receiptType, text, media, extra, null);
        }
    }
}
