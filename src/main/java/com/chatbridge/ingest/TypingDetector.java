package com.chatbridge.ingest;

import com.chatbridge.shared.model.Envelope;
import com.chatbridge.shared.model.EventTypes;

import java.util.Locale;
import java.util.Set;

/** Recognizes "user is composing" signals across the event kinds that can carry one. */
public final class TypingDetector {

    private static final Set<String> TYPING_STATES = Set.of("composing", "typing", "recording");
    private static final Set<String> TYPING_RECEIPTS = Set.of("composing", "typing");

    private TypingDetector() {}

    public static boolean isTyping(Envelope env) {
        if (env == null) return false;
        var type = lower(env.eventType());
        var extra = env.extra();
        if (EventTypes.CHAT_PRESENCE.equals(type)) {
            return TYPING_STATES.contains(lower(stringOf(extra.get("state"))));
        }
        if ("typing".equals(type) || EventTypes.PRESENCE.equals(type)) {
            if (TYPING_STATES.contains(lower(stringOf(extra.get("state"))))) return true;
            var flag = extra.get("typing");
            if (flag instanceof Boolean b) return b;
            var s = lower(stringOf(flag));
            if ("true".equals(s) || "1".equals(s)) return true;
        }
        return TYPING_RECEIPTS.contains(lower(env.receiptType()));
    }

    private static String stringOf(Object o) {
        return o == null ? "" : String.valueOf(o);
    }

    private static String lower(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }
}
