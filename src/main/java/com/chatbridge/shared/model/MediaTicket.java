package com.chatbridge.shared.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Metadata plus re-download credentials for one media asset. The credential fields
 * ({@code direct_path}, {@code media_key}, the two hashes and the length) are enough to fetch
 * the asset again without the live protocol event. Binary values travel base64 encoded.
 *
 * <p>Inside an {@link Envelope} only the media fields are set; the profile history fills in
 * direction, chat, sender, message id, caption and time via {@link #forHistory}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record MediaTicket(
    @JsonProperty("direction") Direction direction,
    @JsonProperty("chat_id") @JsonAlias("chat_jid") String chatId,
    @JsonProperty("sender_id") @JsonAlias("sender_jid") String senderId,
    @JsonProperty("message_id") String messageId,
    @JsonProperty("type") @JsonAlias("media_type") String type,
    @JsonProperty("mimetype") String mimetype,
    @JsonProperty("title") String title,
    @JsonProperty("url") String url,
    @JsonProperty("caption") String caption,
    @JsonProperty("at") String at,
    @JsonProperty("direct_path") String directPath,
    @JsonProperty("media_key") @JsonAlias("media_key_b64") String mediaKey,
    @JsonProperty("file_hash") @JsonAlias("file_sha256_b64") String fileHash,
    @JsonProperty("encrypted_file_hash") @JsonAlias("file_enc_sha256_b64") String encryptedFileHash,
    @JsonProperty("file_length") Long fileLength,
    @JsonProperty("seconds") Integer seconds
) {

    public static MediaTicket of(String type, String mimetype, String title, String url,
                                 String directPath, String mediaKey, String fileHash,
                                 String encryptedFileHash, Long fileLength, Integer seconds) {
        return new MediaTicket(null, null, null, null, type, mimetype, title, url, null, null,
                directPath, mediaKey, fileHash, encryptedFileHash, fileLength, seconds);
    }

    public MediaTicket forHistory(Direction direction, String chatId, String senderId,
                                  String messageId, String caption, String at) {
        return new MediaTicket(direction, chatId, senderId, messageId, type, mimetype, title, url,
                caption, at, directPath, mediaKey, fileHash, encryptedFileHash, fileLength, seconds);
    }

    @JsonIgnore
    public boolean hasType() {
        return type != null && !type.isBlank();
    }
}
