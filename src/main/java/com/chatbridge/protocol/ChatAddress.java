package com.chatbridge.protocol;

import java.util.Locale;

/**
 * Raw protocol address, {@code user@server}. The same contact may appear under its primary
 * server or under the alias server; {@link ChatIds} folds those into one storage key.
 */
public record ChatAddress(String user, String server) {

    public static final String USER_SERVER = "s.whatsapp.net";
    public static final String LEGACY_USER_SERVER = "c.us";
    public static final String ALIAS_SERVER = "lid";
    public static final String GROUP_SERVER = "g.us";
    public static final String BROADCAST_SERVER = "broadcast";

    public static final ChatAddress STATUS_BROADCAST = new ChatAddress("status", BROADCAST_SERVER);
    public static final ChatAddress EMPTY = new ChatAddress("", "");

    public ChatAddress {
        user = user == null ? "" : user.trim();
        server = server == null ? "" : server.trim().toLowerCase(Locale.ROOT);
    }

    /** Parses {@code user@server}; a bare value is taken as a primary contact id. */
    public static ChatAddress parse(String raw) {
        if (raw == null || raw.isBlank()) return EMPTY;
        var s = raw.trim();
        var at = s.lastIndexOf('@');
        if (at < 0) return new ChatAddress(s, USER_SERVER);
        return new ChatAddress(s.substring(0, at), s.substring(at + 1));
    }

    public boolean isEmpty() {
        return user.isEmpty() && server.isEmpty();
    }

    public boolean isGroup() {
        return GROUP_SERVER.equals(server);
    }

    public boolean isAlias() {
        return ALIAS_SERVER.equals(server);
    }

    public boolean isStatusBroadcast() {
        return equals(STATUS_BROADCAST);
    }

    public boolean isBroadcast() {
        return BROADCAST_SERVER.equals(server);
    }

    @Override
    public String toString() {
        if (isEmpty()) return "";
        return server.isEmpty() ? user : user + "@" + server;
    }
}
