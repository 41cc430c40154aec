package com.chatbridge.gateway.http;

import com.chatbridge.auth.WebhookSigner;
import com.chatbridge.forward.EnvelopeCodec;
import com.chatbridge.ingest.IngestRouter;
import com.chatbridge.observability.BridgeMetrics;
import com.chatbridge.pipeline.DedupeCache;
import com.chatbridge.shared.Text;
import com.chatbridge.shared.config.BridgeConfig;
import com.chatbridge.shared.config.IngestConfig;
import com.chatbridge.shared.model.Envelope;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Receives envelopes pushed by the engine. Validation happens before anything is acknowledged;
 * once accepted the envelope is acknowledged at once and handed to the {@link IngestRouter}.
 */
@RestController
@ConditionalOnProperty(name = "chatbridge.role", havingValue = "ingest")
public class WebhookController {

    private static final Logger log = LoggerFactory.getLogger(WebhookController.class);

    private final IngestConfig config;
    private final WebhookSigner signer;
    private final EnvelopeCodec codec;
    private final DedupeCache dedupe;
    private final IngestRouter router;
    private final BridgeMetrics metrics;
    private final Clock clock;

    public WebhookController(BridgeConfig config, WebhookSigner signer, EnvelopeCodec codec,
                             DedupeCache dedupe, IngestRouter router, BridgeMetrics metrics) {
        this(config.ingest(), signer, codec, dedupe, router, metrics, Clock.systemUTC());
    }

    WebhookController(IngestConfig config, WebhookSigner signer, EnvelopeCodec codec, DedupeCache dedupe,
                      IngestRouter router, BridgeMetrics metrics, Clock clock) {
        this.config = config;
        this.signer = signer;
        this.codec = codec;
        this.dedupe = dedupe;
        this.router = router;
        this.metrics = metrics;
        this.clock = clock;
    }

    @RequestMapping("/wh")
    public ResponseEntity<Map<String, Object>> receive(HttpServletRequest request) throws IOException {
        if (!"POST".equalsIgnoreCase(request.getMethod())) {
            return error(HttpStatus.METHOD_NOT_ALLOWED, "method not allowed");
        }
        long limit = config.bodyLimitBytes();
        if (limit > 0 && request.getContentLengthLong() > limit) {
            return error(HttpStatus.PAYLOAD_TOO_LARGE, "body too large");
        }
        var body = readLimited(request.getInputStream(), limit);
        if (body == null) {
            return error(HttpStatus.PAYLOAD_TOO_LARGE, "body too large");
        }

        if (config.useTimestamp()) {
            var ts = request.getHeader(WebhookSigner.TIMESTAMP_HEADER);
            if (!WebhookSigner.timestampWithin(ts, config.timestampSkew(), Instant.now(clock))) {
                log.warn("wh_rejected reason=stale_timestamp ts={}", ts);
                return error(HttpStatus.UNAUTHORIZED, "bad timestamp");
            }
        }
        if (config.requireSignature()) {
            if (!signer.verify(body, request.getHeader(WebhookSigner.SIGNATURE_HEADER))) {
                log.warn("wh_rejected reason=bad_signature");
                return error(HttpStatus.UNAUTHORIZED, "bad signature");
            }
        } else if (!signer.hasSecret()) {
            log.warn("signature_not_required_dev_mode");
        }

        Envelope env;
        try {
            env = codec.decode(body);
        } catch (IllegalArgumentException e) {
            log.warn("wh_rejected reason=bad_json: {}", e.getMessage());
            return error(HttpStatus.BAD_REQUEST, "bad json");
        }
        log.info("wh_event type={} dir={} chat={} from={} id={} text=\"{}\"", env.eventType(),
                env.direction() == null ? "" : env.direction().wire(), env.chatId(), env.senderId(),
                env.messageId(), Text.preview(env.text(), 120));

        if (env.isMessage() && !Text.isBlank(env.messageId()) && dedupe.seen(env.messageId())) {
            metrics.dedupeDuplicates().increment();
            log.info("wh_duplicate id={}", env.messageId());
            return ResponseEntity.ok(Map.of("ok", true, "dup", true));
        }
        router.submit(env);
        return ResponseEntity.ok(Map.of("ok", true));
    }

    /** @return the body, or null when it is longer than {@code limit} */
    static byte[] readLimited(InputStream in, long limit) throws IOException {
        var out = new ByteArrayOutputStream();
        var buf = new byte[8192];
        long total = 0;
        int n;
        while ((n = in.read(buf)) != -1) {
            total += n;
            if (limit > 0 && total > limit) return null;
            out.write(buf, 0, n);
        }
        return out.toByteArray();
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("ok", false, "error", message));
    }
}
