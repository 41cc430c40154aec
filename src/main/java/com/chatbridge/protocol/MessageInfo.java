package com.chatbridge.protocol;

import java.time.Instant;

/**
 * Envelope metadata of a protocol message. {@code chatDisplayName} is the group name when the
 * protocol ships it with the message, {@code pushName} the sender's self-chosen name.
 */
public record MessageInfo(
    String id,
    ChatAddress chat,
    ChatAddress sender,
    boolean fromMe,
    String pushName,
    String chatDisplayName,
    Instant timestamp
) {

    public boolean isGroup() {
        return chat != null && chat.isGroup();
    }
}
