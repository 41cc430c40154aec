package com.chatbridge.protocol;

import java.util.regex.Pattern;

/**
 * Maps any address form (primary contact id, alias id, device-qualified id, bare phone number,
 * group id, broadcast id) to the single key used for history rows, profiles, sink files and the
 * {@code chat_id} of every envelope. Pure and idempotent.
 */
public final class ChatIds {

    private static final Pattern PHONE_LIKE = Pattern.compile("\\+?[0-9][0-9 ()\\-]*");

    private ChatIds() {}

    public static String canonical(String raw) {
        if (raw == null || raw.isBlank()) return "";
        return canonical(ChatAddress.parse(raw));
    }

    public static String canonical(ChatAddress address) {
        if (address == null || address.isEmpty()) return "";
        var server = address.server();
        var user = address.user();

        if (server.isEmpty()
                || ChatAddress.ALIAS_SERVER.equals(server)
                || ChatAddress.LEGACY_USER_SERVER.equals(server)) {
            server = ChatAddress.USER_SERVER;
        }
        if (ChatAddress.USER_SERVER.equals(server)) {
            user = contactUser(user);
        }
        if (user.isEmpty()) return "";
        return user + "@" + server;
    }

    public static boolean isGroup(String canonicalId) {
        return canonicalId != null && canonicalId.endsWith("@" + ChatAddress.GROUP_SERVER);
    }

    public static boolean isStatusBroadcast(String canonicalId) {
        return ChatAddress.STATUS_BROADCAST.toString().equals(canonicalId);
    }

    /** User part of a canonical id, e.g. the phone number of a contact. */
    public static String userOf(String canonicalId) {
        if (canonicalId == null) return "";
        var at = canonicalId.indexOf('@');
        return at < 0 ? canonicalId : canonicalId.substring(0, at);
    }

    // "5511999:12" (device) and "5511999.0:3" (agent + device) both name contact 5511999
    private static String contactUser(String user) {
        var colon = user.indexOf(':');
        if (colon >= 0) user = user.substring(0, colon);
        var dot = user.indexOf('.');
        if (dot >= 0) user = user.substring(0, dot);
        if (PHONE_LIKE.matcher(user).matches()) {
            user = user.replaceAll("[^0-9]", "");
        }
        return user;
    }
}
