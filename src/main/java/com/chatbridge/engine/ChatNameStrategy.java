package com.chatbridge.engine;

import com.chatbridge.protocol.ChatAddress;
import com.chatbridge.protocol.ChatIds;
import com.chatbridge.protocol.ProtocolClient;

import java.util.Optional;

/** One way of naming a chat. Returns empty when it has nothing to offer. */
@FunctionalInterface
public interface ChatNameStrategy {

    /**
     * @param groupDisplayName group name carried by the event itself, may be null
     * @param senderName       the sender's self-chosen name, may be null
     */
    record Context(ChatAddress chat, String groupDisplayName, String senderName) {}

    Optional<String> resolve(Context ctx);

    static ChatNameStrategy eventGroupName() {
        return ctx -> ctx.chat().isGroup() ? nonBlank(ctx.groupDisplayName()) : Optional.empty();
    }

    static ChatNameStrategy clientGroupName(ProtocolClient client) {
        return ctx -> ctx.chat().isGroup() ? client.groupName(ctx.chat()).flatMap(ChatNameStrategy::nonBlank) : Optional.empty();
    }

    static ChatNameStrategy clientContactName(ProtocolClient client) {
        return ctx -> ctx.chat().isGroup() ? Optional.empty() : client.contactName(ctx.chat()).flatMap(ChatNameStrategy::nonBlank);
    }

    static ChatNameStrategy senderName() {
        return ctx -> ctx.chat().isGroup() ? Optional.empty() : nonBlank(ctx.senderName());
    }

    static ChatNameStrategy addressUser() {
        return ctx -> {
            var user = ChatIds.userOf(ChatIds.canonical(ctx.chat()));
            if (user.isEmpty()) user = ctx.chat().user();
            return Optional.of(ctx.chat().isGroup() ? "Group " + user : user);
        };
    }

    private static Optional<String> nonBlank(String s) {
        return s == null || s.isBlank() ? Optional.empty() : Optional.of(s.trim());
    }
}
