package com.chatbridge.shared.config;

import java.time.ZoneId;

public record ProfileConfig(
    String baseDir,
    int mediaCap,
    ZoneId zone
) {
    public static ProfileConfig defaults() {
        return new ProfileConfig("outbox/profiles", 200, ZoneId.systemDefault());
    }
}
