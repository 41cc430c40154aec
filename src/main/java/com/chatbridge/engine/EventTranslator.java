package com.chatbridge.engine;

import com.chatbridge.protocol.ChatAddress;
import com.chatbridge.protocol.ChatIds;
import com.chatbridge.protocol.MediaKind;
import com.chatbridge.protocol.ProtocolEvent;
import com.chatbridge.shared.model.Direction;
import com.chatbridge.shared.model.Envelope;
import com.chatbridge.shared.model.EventTypes;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the {@link Envelope} for one protocol event. {@code chat_id} is always the canonical
 * id; {@code sender_id} keeps the raw address so alias senders stay recognizable downstream.
 */
public class EventTranslator {

    private final ChatNameResolver names;

    public EventTranslator(ChatNameResolver names) {
        this.names = names;
    }

    public Envelope translate(ProtocolEvent event) {
        if (event instanceof ProtocolEvent.Message m) {
            return m.info().fromMe() ? outboundEcho(m) : inbound(m);
        }
        if (event instanceof ProtocolEvent.Receipt r) {
            return receipt(r);
        }
        if (event instanceof ProtocolEvent.ChatPresence p) {
            var extra = new LinkedHashMap<String, Object>();
            putIfPresent(extra, "state", p.state());
            putIfPresent(extra, "media", p.media());
            return Envelope.builder(EventTypes.CHAT_PRESENCE)
                    .chatId(ChatIds.canonical(p.chat()))
                    .senderId(raw(p.sender()))
                    .extra(extra)
                    .build();
        }
        if (event instanceof ProtocolEvent.Presence p) {
            var extra = new LinkedHashMap<String, Object>();
            extra.put("unavailable", p.unavailable());
            if (p.lastSeen() != null) {
                extra.put("last_seen", DateTimeFormatter.ISO_INSTANT.format(p.lastSeen().truncatedTo(ChronoUnit.SECONDS)));
            }
            return Envelope.builder(EventTypes.PRESENCE)
                    .senderId(raw(p.from()))
                    .extra(extra)
                    .build();
        }
        if (event instanceof ProtocolEvent.GroupUpdate g) {
            var extra = new LinkedHashMap<String, Object>();
            putIfPresent(extra, "name", g.newName());
            putIfPresent(extra, "topic", g.newTopic());
            if (!g.joined().isEmpty()) extra.put("joined", addresses(g.joined()));
            if (!g.left().isEmpty()) extra.put("left", addresses(g.left()));
            return Envelope.builder(EventTypes.GROUP_UPDATE)
                    .chatId(ChatIds.canonical(g.group()))
                    .senderId(raw(g.actor()))
                    .chatName(g.newName())
                    .extra(extra)
                    .build();
        }
        if (event instanceof ProtocolEvent.JoinedGroup j) {
            return Envelope.builder(EventTypes.JOINED_GROUP)
                    .chatId(ChatIds.canonical(j.group()))
                    .chatName(j.name())
                    .build();
        }
        if (event instanceof ProtocolEvent.HistorySync h) {
            var extra = new LinkedHashMap<String, Object>();
            putIfPresent(extra, "sync_type", h.syncType());
            extra.put("conversations", h.conversations());
            return Envelope.builder(EventTypes.HISTORY_SYNC).extra(extra).build();
        }
        if (event instanceof ProtocolEvent.LoggedOut l) {
            var extra = new LinkedHashMap<String, Object>();
            extra.put("on_connect", l.onConnect());
            putIfPresent(extra, "reason", l.reason());
            return Envelope.builder(EventTypes.LOGGED_OUT).extra(extra).build();
        }
        if (event instanceof ProtocolEvent.OfflineSyncCompleted o) {
            return Envelope.builder(EventTypes.OFFLINE_SYNC_COMPLETED)
                    .extra(Map.of("count", o.count()))
                    .build();
        }
        if (event instanceof ProtocolEvent.IdentityChange i) {
            return Envelope.builder(EventTypes.IDENTITY_CHANGE)
                    .chatId(ChatIds.canonical(i.address()))
                    .extra(Map.of("implicit", i.implicit()))
                    .build();
        }
        return Envelope.builder(event.type()).build();
    }

    /** {@code delivered} for an untyped receipt, {@code sent} for the sender's own echo. */
    public static String receiptTag(String receiptType) {
        if (receiptType == null || receiptType.isBlank()) return "delivered";
        if ("sender".equals(receiptType)) return "sent";
        return receiptType;
    }

    public static String chatKind(ChatAddress chat) {
        if (chat == null || chat.isEmpty()) return "UNKNOWN";
        if (chat.isGroup()) return "GROUP";
        if (chat.isBroadcast()) return "STATUS";
        return "PRIVATE";
    }

    private Envelope inbound(ProtocolEvent.Message m) {
        var info = m.info();
        var part = m.content().mediaPart();
        return Envelope.builder(EventTypes.MESSAGE)
                .direction(Direction.IN)
                .chatId(ChatIds.canonical(info.chat()))
                .senderId(raw(info.sender()))
                .chatName(names.resolve(info.chat(), info.chatDisplayName(), info.pushName()))
                .messageId(info.id())
                .text(m.content().text())
                .media(part == null ? null : part.toTicket())
                .build();
    }

    private Envelope outboundEcho(ProtocolEvent.Message m) {
        var info = m.info();
        var part = m.content().mediaPart();
        return Envelope.builder(EventTypes.MESSAGE)
                .direction(Direction.OUT)
                .chatId(ChatIds.canonical(info.chat()))
                .chatName(names.resolve(info.chat(), info.chatDisplayName(), null))
                .messageId(info.id())
                .text(m.content().text())
                .media(part == null ? null : part.toTicket())
                .build();
    }

    private Envelope receipt(ProtocolEvent.Receipt r) {
        return Envelope.builder(EventTypes.RECEIPT)
                .chatId(ChatIds.canonical(r.chat()))
                .senderId(raw(r.sender()))
                .messageIds(r.messageIds())
                .receiptType(receiptTag(r.receiptType()))
                .build();
    }

    static String documentTitle(ProtocolEvent.Message m) {
        var part = m.content().mediaPart();
        return part != null && part.kind() == MediaKind.DOCUMENT ? part.title() : null;
    }

    static Instant timestampOr(Instant ts, Instant now) {
        return ts != null ? ts : now;
    }

    private static String raw(ChatAddress address) {
        return address == null ? null : address.toString();
    }

    private static List<String> addresses(List<ChatAddress> list) {
        return list.stream().map(ChatAddress::toString).collect(Collectors.toList());
    }

    private static void putIfPresent(Map<String, Object> map, String key, String value) {
        if (value != null && !value.isBlank()) map.put(key, value);
    }
}
