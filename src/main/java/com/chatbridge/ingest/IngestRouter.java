package com.chatbridge.ingest;

import com.chatbridge.observability.BridgeMetrics;
import com.chatbridge.pipeline.Aggregator;
import com.chatbridge.profiles.ProfileStore;
import com.chatbridge.protocol.ChatAddress;
import com.chatbridge.protocol.ChatIds;
import com.chatbridge.shared.Text;
import com.chatbridge.shared.config.IngestConfig;
import com.chatbridge.shared.model.BusinessRequest;
import com.chatbridge.shared.model.Envelope;
import com.chatbridge.shared.model.EventTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Routes accepted envelopes: profile bookkeeping, aggregation of inbound bursts per chat and,
 * once a window fires, one business call whose answer is sent back with typing pacing.
 */
public class IngestRouter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(IngestRouter.class);

    static final String ERROR_REPLY = "Lo siento, hubo un error procesando tu mensaje.";
    static final String DECODE_ERROR_REPLY = "Error procesando la respuesta.";
    static final String NO_REPLY = "No se pudo obtener respuesta del sistema.";

    private final IngestConfig config;
    private final ProfileStore profiles;
    private final EngineClient engine;
    private final BusinessClient business;
    private final ReplyPacer pacer;
    private final EnvelopeFilter filter;
    private final Aggregator aggregator;
    private final Clock clock;
    private final ExecutorService workers;

    private final ReentrantLock stateLock = new ReentrantLock();
    private final Map<String, Envelope> lastByChat = new HashMap<>();
    private final Map<String, String> lastChatBySender = new HashMap<>();
    private final Map<String, Instant> lastTypingTouch = new HashMap<>();
    private String lastActiveChat = "";

    public IngestRouter(IngestConfig config, ProfileStore profiles, EngineClient engine,
                        BusinessClient business, BridgeMetrics metrics) {
        this(config, profiles, engine, business,
                new ReplyPacer(engine, config.pacing(), config.typingPause()), metrics, Clock.systemUTC());
    }

    public IngestRouter(IngestConfig config, ProfileStore profiles, EngineClient engine,
                        BusinessClient business, ReplyPacer pacer, BridgeMetrics metrics, Clock clock) {
        this.config = config;
        this.profiles = profiles;
        this.engine = engine;
        this.business = business;
        this.pacer = pacer;
        this.filter = EnvelopeFilter.standard();
        this.clock = clock;
        this.aggregator = new Aggregator(config.aggregationWindow(), this::flush, this::onWindowReset, metrics);
        var seq = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            var t = new Thread(r, "ingest-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /** Marks the message read and routes it on a worker thread; returns immediately. */
    public void submit(Envelope env) {
        try {
            workers.execute(() -> process(env));
        } catch (RejectedExecutionException e) {
            log.warn("ingest_rejected type={} reason=shutting_down", env.eventType());
        }
    }

    void process(Envelope env) {
        try {
            if (env.isMessage() && !env.isOutbound() && !Text.isBlank(env.messageId())) {
                markRead(env);
            }
            route(env);
        } catch (RuntimeException e) {
            log.warn("ingest_route_failed type={} chat={}: {}", env.eventType(), env.chatId(), e.getMessage());
        }
    }

    public void route(Envelope env) {
        if (env.isMessage()) {
            onMessage(env);
        } else if (TypingDetector.isTyping(env)) {
            onTyping(env);
        } else if (EventTypes.RECEIPT.equals(env.eventType())) {
            onReceipt(env);
        } else {
            onAny(env);
        }
    }

    private void markRead(Envelope env) {
        var sender = ChatIds.isGroup(env.chatId()) ? env.senderId() : null;
        try {
            engine.markRead(env.chatId(), List.of(env.messageId()), sender);
            log.debug("markread_ok chat={} id={}", env.chatId(), env.messageId());
        } catch (RuntimeException e) {
            log.warn("markread_fail chat={} id={}: {}", env.chatId(), env.messageId(), e.getMessage());
        }
    }

    void onMessage(Envelope env) {
        var chat = env.chatId() == null ? "" : env.chatId();
        if (env.isOutbound()) {
            profiles.appendMedia(chat, env);
            profiles.recordOutbound(chat);
            log.debug("filtered reason=direction_out chat={}", chat);
            return;
        }
        profiles.touchInbound(env);
        profiles.appendMedia(chat, env);

        var rejected = filter.reject(env);
        if (rejected.isPresent()) {
            log.debug("filtered reason={} chat={}", rejected.get(), chat);
            return;
        }

        aggregator.add(chat);
        stateLock.lock();
        try {
            lastChatBySender.put(env.senderId(), chat);
            lastActiveChat = chat;
        } finally {
            stateLock.unlock();
        }

        // alias senders in one-to-one chats are recorded but never answered
        if (ChatAddress.parse(env.senderId()).isAlias() && !ChatIds.isGroup(chat)) {
            log.info("skip_reply reason=alias_sender chat={} from={}", chat, env.senderId());
            return;
        }

        stateLock.lock();
        try {
            lastByChat.put(chat, env);
        } finally {
            stateLock.unlock();
        }
        log.info("message chat={} from={} name=\"{}\" text=\"{}\"",
                chat, env.senderId(), env.chatName(), Text.preview(env.text(), 120));
    }

    void onReceipt(Envelope env) {
        var rejected = filter.reject(env);
        if (rejected.isPresent()) {
            log.debug("filtered reason={} type=receipt", rejected.get());
            return;
        }
        log.info("receipt chat={} type={} count={} first={}", env.chatId(), env.receiptType(),
                env.messageIds().size(), env.messageIds().isEmpty() ? "" : env.messageIds().get(0));
    }

    void onTyping(Envelope env) {
        var now = Instant.now(clock);
        String target;
        stateLock.lock();
        try {
            target = typingTarget(env);
            if (target.isEmpty() || !lastByChat.containsKey(target)) {
                log.debug("typing_ignored chat={} from={}", env.chatId(), env.senderId());
                return;
            }
            var last = lastTypingTouch.get(target);
            if (last != null && Duration.between(last, now).compareTo(config.typingDebounce()) < 0) {
                return;
            }
            lastTypingTouch.put(target, now);
        } finally {
            stateLock.unlock();
        }
        aggregator.touch(target);
    }

    void onAny(Envelope env) {
        var rejected = filter.reject(env);
        if (rejected.isPresent()) {
            log.debug("filtered reason={} type={}", rejected.get(), env.eventType());
            return;
        }
        log.info("event_any type={} chat={} from={}", env.eventType(), env.chatId(), env.senderId());
    }

    // caller holds stateLock
    private String typingTarget(Envelope env) {
        var raw = env.chatId() == null ? "" : env.chatId();
        var mapped = env.senderId() == null ? null : lastChatBySender.get(env.senderId());
        if (mapped != null && !mapped.isEmpty() && !mapped.equals(raw)) return mapped;
        if (!raw.isEmpty()) return raw;
        return lastActiveChat;
    }

    private void onWindowReset(String chatId, String reason, int count, Duration window) {
        var seconds = window.toMillis() / 1000.0;
        if (Aggregator.START.equals(reason)) {
            log.info("agg_window_start chat={} window_s={} count={}", chatId, seconds, count);
        } else if (Aggregator.MESSAGE.equals(reason)) {
            log.info("agg_window_reset_message chat={} window_s={} count={}", chatId, seconds, count);
        } else if (Aggregator.TYPING.equals(reason)) {
            log.info("agg_window_reset_typing chat={} window_s={} count={}", chatId, seconds, count);
        } else {
            log.info("agg_window_fire chat={} count={}", chatId, count);
        }
    }

    void flush(String chatId, int count) {
        try {
            Thread.sleep(config.preReplyDelay().toMillis());
            Envelope last;
            stateLock.lock();
            try {
                last = lastByChat.get(chatId);
            } finally {
                stateLock.unlock();
            }
            if (last != null && !Text.isBlank(last.text())) {
                var reply = askBusiness(last);
                if (!Text.isBlank(reply)) {
                    pacer.reply(chatId, reply);
                    return;
                }
            }
            pacer.reply(chatId, "Llegaron " + count + " mensaje(s) en la ventana.");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("flush interrupted chat={}", chatId);
        }
    }

    String askBusiness(Envelope env) {
        var sessionId = "wa-" + ChatIds.userOf(ChatIds.canonical(env.senderId()));
        try {
            var reply = business.ask(new BusinessRequest(sessionId, env.text().trim(), config.channel()));
            if (reply == null || Text.isBlank(reply.reply())) {
                return NO_REPLY;
            }
            log.info("reply_business chat={} score={} category={} text=\"{}\"", env.chatId(),
                    reply.leadScore(), reply.category(), Text.preview(reply.reply(), 120));
            return reply.reply();
        } catch (BusinessClient.UndecodableReplyException e) {
            log.warn("business_decode_failed chat={}: {}", env.chatId(), e.getMessage());
            return DECODE_ERROR_REPLY;
        } catch (RuntimeException e) {
            log.warn("business_call_failed chat={}: {}", env.chatId(), e.getMessage());
            return ERROR_REPLY;
        }
    }

    public Aggregator aggregator() {
        return aggregator;
    }

    public void close(Duration grace) {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        aggregator.close(grace);
    }

    @Override
    public void close() {
        close(Duration.ofSeconds(5));
    }
}
