package com.chatbridge.history;

import java.time.Instant;

public record HistoryRecord(
    String id,
    String chatId,
    String sender,
    String content,
    Instant timestamp,
    boolean fromMe,
    String mediaType,
    String filename,
    String url
) {}
