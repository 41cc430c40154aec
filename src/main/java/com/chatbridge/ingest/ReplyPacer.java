package com.chatbridge.ingest;

import com.chatbridge.shared.Text;
import com.chatbridge.shared.config.IngestConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Random;

/**
 * Sends a reply the way a person would: typing indicator on, a wait proportional to the reply
 * length, the message, a short pause, typing off.
 */
public class ReplyPacer {

    private static final Logger log = LoggerFactory.getLogger(ReplyPacer.class);

    private final EngineClient engine;
    private final IngestConfig.ReplyPacing pacing;
    private final Duration typingPause;
    private final Random random;

    public ReplyPacer(EngineClient engine, IngestConfig.ReplyPacing pacing, Duration typingPause) {
        this(engine, pacing, typingPause, new Random());
    }

    public ReplyPacer(EngineClient engine, IngestConfig.ReplyPacing pacing, Duration typingPause, Random random) {
        this.engine = engine;
        this.pacing = pacing;
        this.typingPause = typingPause;
        this.random = random;
    }

    public Duration typingTime(String text) {
        long ms = pacing.base().toMillis() + Text.length(text) * pacing.perChar().toMillis();
        long jitter = pacing.jitter().toMillis();
        if (jitter > 0) ms += random.nextInt((int) Math.min(jitter, Integer.MAX_VALUE));
        return Duration.ofMillis(Math.min(ms, pacing.max().toMillis()));
    }

    /** @return false if the message itself could not be sent */
    public boolean reply(String chatId, String text) throws InterruptedException {
        typing(chatId, true);
        Thread.sleep(typingTime(text).toMillis());
        boolean sent;
        try {
            engine.sendText(chatId, text);
            sent = true;
        } catch (RuntimeException e) {
            log.warn("reply_send_failed chat={}: {}", chatId, e.getMessage());
            sent = false;
        }
        Thread.sleep(typingPause.toMillis());
        typing(chatId, false);
        return sent;
    }

    private void typing(String chatId, boolean on) {
        try {
            engine.setTyping(chatId, on, "text");
        } catch (RuntimeException e) {
            log.debug("typing {} failed chat={}: {}", on ? "on" : "off", chatId, e.getMessage());
        }
    }
}
