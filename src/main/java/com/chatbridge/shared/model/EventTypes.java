package com.chatbridge.shared.model;

import java.util.Set;

public final class EventTypes {

    public static final String MESSAGE = "message";
    public static final String RECEIPT = "receipt";
    public static final String CHAT_PRESENCE = "chat_presence";
    public static final String PRESENCE = "presence";
    public static final String GROUP_UPDATE = "group_update";
    public static final String JOINED_GROUP = "joined_group";
    public static final String HISTORY_SYNC = "history_sync";
    public static final String CONNECTED = "connected";
    public static final String LOGGED_OUT = "logged_out";
    public static final String OFFLINE_SYNC_COMPLETED = "offline_sync_completed";
    public static final String IDENTITY_CHANGE = "identity_change";

    /** Connection-lifecycle events, filed per host rather than per conversation. */
    public static final Set<String> DEVICE_EVENTS = Set.of(
            CONNECTED, LOGGED_OUT, HISTORY_SYNC, OFFLINE_SYNC_COMPLETED, IDENTITY_CHANGE);

    private EventTypes() {}
}
