package com.chatbridge.engine;

import com.chatbridge.protocol.ChatAddress;
import com.chatbridge.protocol.ProtocolClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/** Tries each {@link ChatNameStrategy} in order and takes the first answer. */
public class ChatNameResolver {

    private static final Logger log = LoggerFactory.getLogger(ChatNameResolver.class);

    private final List<ChatNameStrategy> strategies;

    public ChatNameResolver(List<ChatNameStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    /** Event group name, client group name, client contact name, sender name, address user. */
    public static ChatNameResolver standard(ProtocolClient client) {
        return new ChatNameResolver(List.of(
                ChatNameStrategy.eventGroupName(),
                ChatNameStrategy.clientGroupName(client),
                ChatNameStrategy.clientContactName(client),
                ChatNameStrategy.senderName(),
                ChatNameStrategy.addressUser()));
    }

    public String resolve(ChatAddress chat, String groupDisplayName, String senderName) {
        if (chat == null || chat.isEmpty()) return "";
        var ctx = new ChatNameStrategy.Context(chat, groupDisplayName, senderName);
        for (var strategy : strategies) {
            try {
                var name = strategy.resolve(ctx);
                if (name.isPresent()) return name.get();
            } catch (RuntimeException e) {
                log.debug("chat name lookup failed chat={}: {}", chat, e.getMessage());
            }
        }
        return chat.user();
    }
}
