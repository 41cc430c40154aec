package com.chatbridge.protocol;

import com.chatbridge.shared.model.EventTypes;

import java.time.Instant;
import java.util.List;

/**
 * Raw events emitted by a {@link ProtocolClient}. Each kind is its own record with typed
 * accessors; {@link #subject()} names the address the event is about, if any.
 */
public interface ProtocolEvent {

    String type();

    default ChatAddress subject() {
        return ChatAddress.EMPTY;
    }

    record Message(MessageInfo info, MessageContent content) implements ProtocolEvent {
        public String type() { return EventTypes.MESSAGE; }
        public ChatAddress subject() { return info.chat(); }
    }

    record Receipt(ChatAddress chat, ChatAddress sender, List<String> messageIds,
                   String receiptType, Instant timestamp) implements ProtocolEvent {
        public Receipt {
            messageIds = messageIds == null ? List.of() : List.copyOf(messageIds);
        }
        public String type() { return EventTypes.RECEIPT; }
        public ChatAddress subject() { return chat; }
    }

    /** Composing/paused signal inside one chat. */
    record ChatPresence(ChatAddress chat, ChatAddress sender, String state, String media) implements ProtocolEvent {
        public String type() { return EventTypes.CHAT_PRESENCE; }
        public ChatAddress subject() { return chat; }
    }

    /** Online/offline status of a contact. */
    record Presence(ChatAddress from, boolean unavailable, Instant lastSeen) implements ProtocolEvent {
        public String type() { return EventTypes.PRESENCE; }
        public ChatAddress subject() { return from; }
    }

    record GroupUpdate(ChatAddress group, ChatAddress actor, String newName, String newTopic,
                       List<ChatAddress> joined, List<ChatAddress> left) implements ProtocolEvent {
        public GroupUpdate {
            joined = joined == null ? List.of() : List.copyOf(joined);
            left = left == null ? List.of() : List.copyOf(left);
        }
        public String type() { return EventTypes.GROUP_UPDATE; }
        public ChatAddress subject() { return group; }
    }

    record JoinedGroup(ChatAddress group, String name) implements ProtocolEvent {
        public String type() { return EventTypes.JOINED_GROUP; }
        public ChatAddress subject() { return group; }
    }

    record HistorySync(String syncType, int conversations) implements ProtocolEvent {
        public String type() { return EventTypes.HISTORY_SYNC; }
    }

    record Connected() implements ProtocolEvent {
        public String type() { return EventTypes.CONNECTED; }
    }

    record LoggedOut(boolean onConnect, String reason) implements ProtocolEvent {
        public String type() { return EventTypes.LOGGED_OUT; }
    }

    record OfflineSyncCompleted(int count) implements ProtocolEvent {
        public String type() { return EventTypes.OFFLINE_SYNC_COMPLETED; }
    }

    record IdentityChange(ChatAddress address, boolean implicit, Instant timestamp) implements ProtocolEvent {
        public String type() { return EventTypes.IDENTITY_CHANGE; }
        public ChatAddress subject() { return address; }
    }

    /** Anything the client emits that has no dedicated record. */
    record Unknown(String name) implements ProtocolEvent {
        public String type() { return name == null || name.isBlank() ? "unknown" : name; }
    }
}
