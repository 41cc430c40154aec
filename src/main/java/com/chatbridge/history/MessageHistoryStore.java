package com.chatbridge.history;

import java.util.List;

public interface MessageHistoryStore {
    /** Inserts or replaces the row keyed by {@code (id, chatId)} and touches the chat. */
    void append(HistoryRecord record);

    /** Newest {@code limit} messages of a chat, returned oldest first. */
    List<HistoryRecord> recent(String chatId, int limit);
}
