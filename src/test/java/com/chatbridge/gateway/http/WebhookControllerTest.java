package com.chatbridge.gateway.http;

import com.chatbridge.auth.WebhookSigner;
import com.chatbridge.forward.EnvelopeCodec;
import com.chatbridge.ingest.IngestRouter;
import com.chatbridge.observability.BridgeMetrics;
import com.chatbridge.pipeline.DedupeCache;
import com.chatbridge.shared.config.IngestConfig;
import com.chatbridge.shared.model.Envelope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.mock.web.MockHttpServletRequest;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class WebhookControllerTest {

    private static final String SECRET = "s3cret";
    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
    private static final String MESSAGE = "{\"event_type\":\"message\",\"direction\":\"in\","
            + "\"chat_id\":\"5511@s.whatsapp.net\",\"sender_id\":\"5511@s.whatsapp.net\","
            + "\"message_id\":\"M1\",\"text\":\"hola\"}";

    private final WebhookSigner signer = new WebhookSigner(SECRET);
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private IngestRouter router;
    private BridgeMetrics metrics;

    @BeforeEach
    void setUp() {
        router = mock(IngestRouter.class);
        metrics = new BridgeMetrics();
    }

    private static IngestConfig config(boolean requireSignature, boolean useTimestamp, long limit) {
        return new IngestConfig(SECRET, requireSignature, false, limit, useTimestamp, Duration.ofMinutes(5),
                Duration.ofMinutes(10), Duration.ofSeconds(3), Duration.ZERO, Duration.ZERO, Duration.ZERO,
                IngestConfig.ReplyPacing.defaults(), "http://engine", "http://biz", "whatsapp");
    }

    private WebhookController controller(IngestConfig config) {
        return new WebhookController(config, signer, new EnvelopeCodec(Map.of()),
                new DedupeCache(Duration.ofMinutes(10), clock), router, metrics, clock);
    }

    private MockHttpServletRequest post(String body, boolean sign) {
        var req = new MockHttpServletRequest("POST", "/wh");
        var bytes = body.getBytes(StandardCharsets.UTF_8);
        req.setContent(bytes);
        if (sign) req.addHeader(WebhookSigner.SIGNATURE_HEADER, signer.sign(bytes));
        return req;
    }

    @Test
    void acceptsSignedMessage() throws Exception {
        var resp = controller(config(true, false, 1024)).receive(post(MESSAGE, true));

        assertEquals(200, resp.getStatusCode().value());
        assertEquals(Map.of("ok", true), resp.getBody());
        var captor = ArgumentCaptor.forClass(Envelope.class);
        verify(router).submit(captor.capture());
        assertEquals("M1", captor.getValue().messageId());
        assertEquals("hola", captor.getValue().text());
    }

    @Test
    void rejectsOtherMethods() throws Exception {
        var resp = controller(config(true, false, 1024)).receive(new MockHttpServletRequest("GET", "/wh"));
        assertEquals(405, resp.getStatusCode().value());
        assertEquals(false, resp.getBody().get("ok"));
    }

    @Test
    void rejectsOversizedBody() throws Exception {
        var resp = controller(config(true, false, 16)).receive(post(MESSAGE, true));
        assertEquals(413, resp.getStatusCode().value());
        verifyNoInteractions(router);
    }

    @Test
    void streamedBodyOverLimitIsCutOff() throws Exception {
        var big = new byte[100];
        assertNull(WebhookController.readLimited(new ByteArrayInputStream(big), 99));
        assertEquals(100, WebhookController.readLimited(new ByteArrayInputStream(big), 100).length);
        assertEquals(100, WebhookController.readLimited(new ByteArrayInputStream(big), 0).length);
    }

    @Test
    void rejectsBadSignature() throws Exception {
        var req = post(MESSAGE, false);
        req.addHeader(WebhookSigner.SIGNATURE_HEADER, "sha256=00");
        var resp = controller(config(true, false, 1024)).receive(req);
        assertEquals(401, resp.getStatusCode().value());
        assertEquals("bad signature", resp.getBody().get("error"));
    }

    @Test
    void unsignedAcceptedWhenSignatureNotRequired() throws Exception {
        var resp = controller(config(false, false, 1024)).receive(post(MESSAGE, false));
        assertEquals(200, resp.getStatusCode().value());
    }

    @Test
    void staleTimestampIsRejected() throws Exception {
        var req = post(MESSAGE, true);
        req.addHeader(WebhookSigner.TIMESTAMP_HEADER, String.valueOf(NOW.minusSeconds(600).getEpochSecond()));
        var resp = controller(config(true, true, 1024)).receive(req);
        assertEquals(401, resp.getStatusCode().value());
        assertEquals("bad timestamp", resp.getBody().get("error"));
    }

    @Test
    void timestampBeyondInstantRangeIsUnauthorized() throws Exception {
        var req = post(MESSAGE, true);
        req.addHeader(WebhookSigner.TIMESTAMP_HEADER, "99999999999999999");
        var resp = controller(config(true, true, 1024)).receive(req);
        assertEquals(401, resp.getStatusCode().value());
        assertEquals("bad timestamp", resp.getBody().get("error"));
        verifyNoInteractions(router);
    }

    @Test
    void freshTimestampPasses() throws Exception {
        var req = post(MESSAGE, true);
        req.addHeader(WebhookSigner.TIMESTAMP_HEADER, "2024-06-01T11:58:00Z");
        var resp = controller(config(true, true, 1024)).receive(req);
        assertEquals(200, resp.getStatusCode().value());
    }

    @Test
    void malformedJsonIsBadRequest() throws Exception {
        var resp = controller(config(true, false, 1024)).receive(post("{not json", true));
        assertEquals(400, resp.getStatusCode().value());
        verifyNoInteractions(router);
    }

    @Test
    void replayedMessageIsAcknowledgedOnce() throws Exception {
        var controller = controller(config(true, false, 1024));
        controller.receive(post(MESSAGE, true));
        var resp = controller.receive(post(MESSAGE, true));

        assertEquals(200, resp.getStatusCode().value());
        assertEquals(true, resp.getBody().get("dup"));
        verify(router, times(1)).submit(any());
        assertEquals(1.0, metrics.dedupeDuplicates().count());
    }

    @Test
    void receiptsAreNotDeduplicated() throws Exception {
        var receipt = "{\"event_type\":\"receipt\",\"chat_id\":\"5511@s.whatsapp.net\",\"message_ids\":[\"M1\"],\"receipt_type\":\"read\"}";
        var controller = controller(config(true, false, 1024));
        controller.receive(post(receipt, true));
        controller.receive(post(receipt, true));
        verify(router, times(2)).submit(any());
    }
}
