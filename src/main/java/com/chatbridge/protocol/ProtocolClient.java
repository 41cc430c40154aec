package com.chatbridge.protocol;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Seam to the chat-protocol client. Session storage, pairing and transport encryption live
 * behind this interface; the bridge only sees decoded events and send primitives.
 * All methods may throw {@link ProtocolException}.
 */
public interface ProtocolClient {

    String id();

    /** Registers the single event listener; events may arrive on any thread. */
    void subscribe(Consumer<ProtocolEvent> listener);

    void connect();

    void disconnect();

    boolean isConnected();

    /** Address of the logged-in account. */
    ChatAddress self();

    /** @return the server-assigned message id */
    String sendText(ChatAddress to, String text);

    UploadedMedia upload(byte[] data, MediaKind kind);

    /** @return the server-assigned message id */
    String sendMedia(ChatAddress to, OutgoingMedia media);

    /** @return the server-assigned message id */
    String postStatus(String text);

    void sendChatPresence(ChatAddress chat, boolean composing, PresenceMedia media);

    void announceAvailable();

    void markRead(List<String> messageIds, Instant at, ChatAddress chat, ChatAddress sender, String receiptType);

    Optional<String> groupName(ChatAddress group);

    Optional<String> contactName(ChatAddress contact);
}
