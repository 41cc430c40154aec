package com.chatbridge.engine;

import com.chatbridge.forward.Forwarder;
import com.chatbridge.history.HistoryRecord;
import com.chatbridge.history.MessageHistoryStore;
import com.chatbridge.observability.BridgeMetrics;
import com.chatbridge.outbound.OperationClass;
import com.chatbridge.outbound.OutboundLimiter;
import com.chatbridge.pipeline.DedupeCache;
import com.chatbridge.protocol.ChatAddress;
import com.chatbridge.protocol.ChatIds;
import com.chatbridge.protocol.MediaKind;
import com.chatbridge.protocol.OutgoingMedia;
import com.chatbridge.protocol.PresenceMedia;
import com.chatbridge.protocol.ProtocolClient;
import com.chatbridge.protocol.ProtocolEvent;
import com.chatbridge.protocol.ProtocolException;
import com.chatbridge.protocol.UploadedMedia;
import com.chatbridge.shared.Text;
import com.chatbridge.shared.config.EngineConfig;
import com.chatbridge.shared.model.Direction;
import com.chatbridge.shared.model.Envelope;
import com.chatbridge.shared.model.EventTypes;
import com.chatbridge.shared.model.MediaTicket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Owns the protocol connection. Every received event is translated into an {@link Envelope},
 * written to history when it is an inbound message, forwarded and handed to the
 * {@link EngineHandlers}; each of those steps fails independently. Outbound operations run
 * through the {@link OutboundLimiter} and are recorded the same way.
 */
public class BridgeEngine {

    private static final Logger log = LoggerFactory.getLogger(BridgeEngine.class);

    public static final String SELF_SENDER = "me";
    static final Duration RECEIPT_WINDOW = Duration.ofSeconds(5);
    private static final Duration CONNECT_STEP = Duration.ofMillis(250);

    private final ProtocolClient client;
    private final EngineConfig config;
    private final Forwarder forwarder;
    private final MessageHistoryStore history;
    private final OutboundLimiter limiter;
    private final BridgeMetrics metrics;
    private final EngineHandlers handlers;
    private final ChatNameResolver names;
    private final EventTranslator translator;
    private final DedupeCache receipts;
    private final Clock clock;

    public BridgeEngine(ProtocolClient client, EngineConfig config, Forwarder forwarder,
                        MessageHistoryStore history, OutboundLimiter limiter, BridgeMetrics metrics,
                        EngineHandlers handlers) {
        this(client, config, forwarder, history, limiter, metrics, handlers, Clock.systemUTC());
    }

    public BridgeEngine(ProtocolClient client, EngineConfig config, Forwarder forwarder,
                        MessageHistoryStore history, OutboundLimiter limiter, BridgeMetrics metrics,
                        EngineHandlers handlers, Clock clock) {
        this.client = client;
        this.config = config;
        this.forwarder = forwarder;
        this.history = history;
        this.limiter = limiter;
        this.metrics = metrics;
        this.handlers = handlers != null ? handlers : EngineHandlers.NONE;
        this.names = ChatNameResolver.standard(client);
        this.translator = new EventTranslator(names);
        this.receipts = new DedupeCache(RECEIPT_WINDOW, clock);
        this.clock = clock;
    }

    /** Subscribes to the client, connects with retry and announces presence. */
    public void start() throws InterruptedException {
        receipts.withSweeper(Duration.ofSeconds(30), "receipt-dedupe-sweeper");
        client.subscribe(this::handle);
        connect();
        announce();
        log.info("Engine connected as {}", client.self());
    }

    void connect() throws InterruptedException {
        int attempts = Math.max(1, config.maxConnectAttempts());
        RuntimeException last = null;
        for (int i = 0; i < attempts; i++) {
            if (client.isConnected()) return;
            try {
                client.connect();
                if (client.isConnected()) return;
            } catch (RuntimeException e) {
                last = e;
                log.warn("connect attempt {}/{} failed: {}", i + 1, attempts, e.getMessage());
            }
            if (i < attempts - 1) {
                Thread.sleep(config.reconnectBaseDelay().plus(CONNECT_STEP.multipliedBy(i)).toMillis());
            }
        }
        throw new ProtocolException("Failed to connect after " + attempts + " attempts", last);
    }

    /** Entry point for every protocol event. Never throws. */
    public void handle(ProtocolEvent event) {
        try {
            dispatch(event);
        } catch (RuntimeException e) {
            log.error("event handling failed type={}: {}", event.type(), e.getMessage(), e);
            safely("onError", () -> handlers.onError(e));
        }
    }

    private void dispatch(ProtocolEvent event) {
        if (event instanceof ProtocolEvent.Receipt r) {
            var key = ChatIds.canonical(r.chat()) + "|" + r.receiptType() + "|" + String.join(",", r.messageIds());
            if (receipts.seen(key)) {
                log.debug("receipt duplicate dropped key={}", key);
                return;
            }
        }
        if (event instanceof ProtocolEvent.Connected) {
            announce();
        }

        var env = translator.translate(event);
        logSummary(event, env);

        if (event instanceof ProtocolEvent.Message m && !m.info().fromMe()) {
            safely("history", () -> saveInbound(m, env));
        }
        safely("forward", () -> forwarder.forward(env));

        if (event instanceof ProtocolEvent.Message) {
            safely("onMessage", () -> handlers.onMessage(env));
        } else if (event instanceof ProtocolEvent.Receipt) {
            safely("onReceipt", () -> handlers.onReceipt(env));
        } else if (event instanceof ProtocolEvent.Presence || event instanceof ProtocolEvent.ChatPresence) {
            safely("onPresence", () -> handlers.onPresence(env));
        } else if (event instanceof ProtocolEvent.GroupUpdate || event instanceof ProtocolEvent.JoinedGroup) {
            safely("onGroupUpdate", () -> handlers.onGroupUpdate(env));
        }
    }

    private void saveInbound(ProtocolEvent.Message m, Envelope env) {
        if (history == null) return;
        var info = m.info();
        var part = m.content().mediaPart();
        history.append(new HistoryRecord(
                info.id(),
                env.chatId(),
                ChatIds.userOf(ChatIds.canonical(info.sender())),
                env.text(),
                EventTranslator.timestampOr(info.timestamp(), Instant.now(clock)),
                false,
                part == null ? null : part.kind().wire(),
                EventTranslator.documentTitle(m),
                part == null ? null : part.url()));
    }

    private void logSummary(ProtocolEvent event, Envelope env) {
        if (event instanceof ProtocolEvent.Message m) {
            var info = m.info();
            var media = env.media() == null ? "" : " media=" + env.media().type();
            log.info("[{}] {} {} from={} name=\"{}\" id={}{} text=\"{}\"",
                    info.fromMe() ? "OUT" : "IN",
                    EventTranslator.chatKind(info.chat()),
                    env.chatId(), env.senderId(), env.chatName(), info.id(), media,
                    Text.preview(env.text(), 80));
        } else if (event instanceof ProtocolEvent.Receipt r) {
            log.info("[STATUS] {} chat={} ids={}", env.receiptType(), env.chatId(),
                    Text.preview(String.join(",", r.messageIds()), 60));
        } else if (event instanceof ProtocolEvent.LoggedOut l) {
            log.warn("Logged out onConnect={} reason={}", l.onConnect(), l.reason());
        } else {
            log.debug("event {} chat={}", env.eventType(), env.chatId());
        }
    }

    public String sendText(ChatAddress to, String text) {
        var id = limiter.execute(OperationClass.TEXT, () -> client.sendText(to, text));
        var chatId = ChatIds.canonical(to);
        log.info("[OUT] {} {} id={} text=\"{}\"", EventTranslator.chatKind(to), chatId, id, Text.preview(text, 80));
        saveOutbound(new HistoryRecord(id, chatId, SELF_SENDER, text, Instant.now(clock), true, null, null, null));
        forwardOutbound(Envelope.builder(EventTypes.MESSAGE)
                .direction(Direction.OUT)
                .chatId(chatId)
                .chatName(names.resolve(to, null, null))
                .messageId(id)
                .text(text)
                .build());
        return id;
    }

    private record MediaSent(String id, UploadedMedia uploaded) {}

    public String sendMedia(ChatAddress to, MediaInput in) {
        var kind = in.kind() != null ? in.kind() : MediaKind.fromFileName(in.fileName());
        Integer seconds = in.seconds();
        byte[] waveform = in.waveform();
        if (kind == MediaKind.AUDIO) {
            if (seconds == null || seconds <= 0) seconds = audioSeconds(in);
            if (waveform == null || waveform.length == 0) waveform = OggOpusInspector.placeholderWaveform(seconds);
        }
        final Integer secs = seconds;
        final byte[] wave = waveform;

        var sent = limiter.execute(OperationClass.MEDIA, () -> {
            var uploaded = client.upload(in.data(), kind);
            var outgoing = new OutgoingMedia(kind, in.mimetype(), in.fileName(), in.caption(), uploaded,
                    secs, wave, kind == MediaKind.AUDIO);
            return new MediaSent(client.sendMedia(to, outgoing), uploaded);
        });

        var chatId = ChatIds.canonical(to);
        var up = sent.uploaded();
        var ticket = MediaTicket.of(kind.wire(), in.mimetype(), in.fileName(), up.url(), up.directPath(),
                base64(up.mediaKey()), base64(up.fileSha256()), base64(up.fileEncSha256()),
                up.fileLength() > 0 ? up.fileLength() : null,
                kind == MediaKind.AUDIO ? secs : null);
        log.info("[OUT] {} {} id={} media={} file={}", EventTranslator.chatKind(to), chatId, sent.id(),
                kind.wire(), in.fileName());
        saveOutbound(new HistoryRecord(sent.id(), chatId, SELF_SENDER, in.caption(), Instant.now(clock), true,
                kind.wire().toLowerCase(Locale.ROOT), in.fileName(), up.url()));
        forwardOutbound(Envelope.builder(EventTypes.MESSAGE)
                .direction(Direction.OUT)
                .chatId(chatId)
                .chatName(names.resolve(to, null, null))
                .messageId(sent.id())
                .text(in.caption())
                .media(ticket)
                .build());
        return sent.id();
    }

    /** Posts to the status feed; unsupported unless {@code status-enabled} is set. */
    public String postStatus(String text) {
        if (!config.statusEnabled()) {
            throw new UnsupportedOperationException("status posting is not enabled");
        }
        var id = limiter.execute(OperationClass.STATUS, () -> client.postStatus(text));
        log.info("[OUT] STATUS id={} text=\"{}\"", id, Text.preview(text, 80));
        forwardOutbound(Envelope.builder(EventTypes.MESSAGE)
                .direction(Direction.OUT)
                .chatId(ChatAddress.STATUS_BROADCAST.toString())
                .messageId(id)
                .text(text)
                .build());
        return id;
    }

    public void setTyping(ChatAddress chat, boolean typing, PresenceMedia media) {
        client.sendChatPresence(chat, typing, media != null ? media : PresenceMedia.TEXT);
    }

    /**
     * Marks messages as read ({@code read}) or played ({@code played}). Groups need the original
     * sender; in one-to-one chats it is ignored. No ids means nothing to do.
     */
    public void markRead(ChatAddress chat, List<String> messageIds, ChatAddress sender, String receiptType) {
        var ids = messageIds == null ? List.<String>of() : messageIds.stream()
                .filter(id -> id != null && !id.isBlank())
                .map(String::trim)
                .collect(Collectors.toList());
        if (ids.isEmpty()) return;
        var who = ChatAddress.EMPTY;
        if (chat.isGroup()) {
            if (sender == null || sender.isEmpty()) {
                throw new IllegalArgumentException("sender is required to mark group messages read");
            }
            who = sender;
        }
        var type = "played".equalsIgnoreCase(receiptType) ? "played" : "read";
        client.markRead(ids, Instant.now(clock), chat, who, type);
        log.debug("markread chat={} ids={} type={}", chat, ids.size(), type);
    }

    public boolean isConnected() {
        return client.isConnected();
    }

    public void shutdown() {
        shutdown(config.shutdownGrace());
    }

    public void shutdown(Duration grace) {
        log.info("Engine shutting down");
        try {
            client.disconnect();
        } catch (RuntimeException e) {
            log.warn("disconnect failed: {}", e.getMessage());
        }
        forwarder.close(grace);
        receipts.close();
    }

    private void announce() {
        safely("announceAvailable", client::announceAvailable);
    }

    private void saveOutbound(HistoryRecord record) {
        metrics.outboundSends().increment();
        if (history != null) {
            safely("history", () -> history.append(record));
        }
    }

    private void forwardOutbound(Envelope env) {
        safely("forward", () -> forwarder.forward(env));
    }

    private int audioSeconds(MediaInput in) {
        if (in.isOggOpus() && OggOpusInspector.isOgg(in.data())) {
            try {
                return OggOpusInspector.durationSeconds(in.data());
            } catch (RuntimeException e) {
                log.debug("ogg duration unavailable: {}", e.getMessage());
            }
        }
        return OggOpusInspector.DEFAULT_SECONDS;
    }

    private static String base64(byte[] bytes) {
        return bytes == null || bytes.length == 0 ? null : Base64.getEncoder().encodeToString(bytes);
    }

    private static void safely(String step, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.warn("{} failed: {}", step, e.getMessage());
        }
    }
}
