package com.chatbridge.ingest;

import com.chatbridge.observability.BridgeMetrics;
import com.chatbridge.profiles.ProfileStore;
import com.chatbridge.shared.config.IngestConfig;
import com.chatbridge.shared.model.BusinessReply;
import com.chatbridge.shared.model.BusinessRequest;
import com.chatbridge.shared.model.Direction;
import com.chatbridge.shared.model.Envelope;
import com.chatbridge.shared.model.EventTypes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class IngestRouterTest {

    private static final String CHAT = "5511999@s.whatsapp.net";
    private static final String GROUP = "1203-4@g.us";

    @TempDir
    Path tempDir;

    private EngineClient engine;
    private BusinessClient business;
    private ReplyPacer pacer;
    private ProfileStore profiles;
    private BridgeMetrics metrics;
    private IngestRouter router;

    private static IngestConfig config(Duration window) {
        return new IngestConfig("secret", true, false, 1024, false, Duration.ofMinutes(5),
                Duration.ofMinutes(10), window, Duration.ZERO, Duration.ZERO, Duration.ofMillis(50),
                IngestConfig.ReplyPacing.defaults(), "http://engine", "http://biz", "whatsapp");
    }

    @BeforeEach
    void setUp() {
        engine = mock(EngineClient.class);
        business = mock(BusinessClient.class);
        pacer = mock(ReplyPacer.class);
        metrics = new BridgeMetrics();
        profiles = new ProfileStore(tempDir.resolve("profiles"), tempDir.resolve("out"), 10, ZoneOffset.UTC);
        router = router(Duration.ofMillis(200));
    }

    private IngestRouter router(Duration window) {
        return new IngestRouter(config(window), profiles, engine, business, pacer, metrics, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        router.close(Duration.ofMillis(200));
    }

    private static Envelope message(String chat, String sender, String id, String text) {
        return Envelope.builder(EventTypes.MESSAGE)
                .direction(Direction.IN)
                .chatId(chat)
                .senderId(sender)
                .messageId(id)
                .text(text)
                .build();
    }

    @Test
    void burstProducesOneBusinessCallWithLastText() throws Exception {
        when(business.ask(any())).thenReturn(new BusinessReply("Hola, en que te ayudo?", 3, "lead"));

        router.process(message(CHAT, "5511999:4@s.whatsapp.net", "m1", "hola"));
        router.process(message(CHAT, "5511999:4@s.whatsapp.net", "m2", "  quiero info  "));

        verify(pacer, timeout(2000)).reply(CHAT, "Hola, en que te ayudo?");
        var captor = ArgumentCaptor.forClass(BusinessRequest.class);
        verify(business).ask(captor.capture());
        assertEquals("wa-5511999", captor.getValue().sessionId());
        assertEquals("quiero info", captor.getValue().message());
        assertEquals("whatsapp", captor.getValue().channel());
        assertEquals(1.0, metrics.aggregationFlushes().count());
    }

    @Test
    void inboundMessagesAreMarkedRead() {
        router.process(message(CHAT, CHAT, "m1", "hola"));
        router.process(message(GROUP, CHAT, "g1", "hola grupo"));

        verify(engine).markRead(CHAT, List.of("m1"), null);
        verify(engine).markRead(GROUP, List.of("g1"), CHAT);
    }

    @Test
    void markReadFailureDoesNotStopRouting() {
        doThrow(new RuntimeException("engine down")).when(engine).markRead(any(), any(), any());
        router.process(message(CHAT, CHAT, "m1", "hola"));
        assertEquals(1, router.aggregator().pending(CHAT));
    }

    @Test
    void aliasSenderInPrivateChatGetsCountFallback() throws Exception {
        var aliasChat = "4477@s.whatsapp.net";
        router.process(message(aliasChat, "4477@lid", "m1", "hola"));

        verify(pacer, timeout(2000)).reply(aliasChat, "Llegaron 1 mensaje(s) en la ventana.");
        verifyNoInteractions(business);
    }

    @Test
    void aliasSenderInGroupIsAnswered() throws Exception {
        when(business.ask(any())).thenReturn(new BusinessReply("ok", null, null));
        router.process(message(GROUP, "4477@lid", "g1", "hola"));

        verify(pacer, timeout(2000)).reply(GROUP, "ok");
    }

    @Test
    void outboundMessagesOnlyUpdateProfile() {
        var out = Envelope.builder(EventTypes.MESSAGE).direction(Direction.OUT).chatId(CHAT).messageId("o1").text("hi").build();
        router.process(out);

        assertEquals(0, router.aggregator().pending(CHAT));
        assertEquals(1, profiles.get(CHAT).orElseThrow().metrics().msgOut());
        verifyNoInteractions(engine);
    }

    @Test
    void messageWithoutSenderIsFiltered() {
        router.process(message(CHAT, null, "m1", "hola"));
        assertEquals(0, router.aggregator().pending(CHAT));
        assertEquals(1, profiles.get(CHAT).orElseThrow().metrics().msgIn());
    }

    @Test
    void typingExtendsWindowOfKnownChat() throws Exception {
        router.close(Duration.ofMillis(100));
        router = router(Duration.ofMillis(400));
        when(business.ask(any())).thenReturn(new BusinessReply("listo", null, null));

        router.process(message(CHAT, CHAT, "m1", "hola"));
        Thread.sleep(250);
        router.process(Envelope.builder(EventTypes.CHAT_PRESENCE).chatId(CHAT).senderId(CHAT)
                .extra(Map.of("state", "composing")).build());
        Thread.sleep(250);

        assertEquals(1, router.aggregator().pending(CHAT));
        verify(pacer, timeout(2000)).reply(CHAT, "listo");
    }

    @Test
    void typingForUnknownChatIsIgnored() {
        router.process(Envelope.builder(EventTypes.CHAT_PRESENCE).chatId("other@s.whatsapp.net")
                .senderId("other@s.whatsapp.net").extra(Map.of("state", "composing")).build());
        assertEquals(0, router.aggregator().pending("other@s.whatsapp.net"));
    }

    @Test
    void businessFailuresMapToFallbackTexts() {
        var env = message(CHAT, CHAT, "m1", "hola");

        when(business.ask(any())).thenThrow(new RuntimeException("timeout"));
        assertEquals(IngestRouter.ERROR_REPLY, router.askBusiness(env));

        reset(business);
        when(business.ask(any())).thenThrow(new BusinessClient.UndecodableReplyException("bad json", null));
        assertEquals(IngestRouter.DECODE_ERROR_REPLY, router.askBusiness(env));

        reset(business);
        when(business.ask(any())).thenReturn(new BusinessReply(" ", null, null));
        assertEquals(IngestRouter.NO_REPLY, router.askBusiness(env));
    }

    @Test
    void submitRunsAsynchronously() {
        router.submit(message(CHAT, CHAT, "m1", "hola"));
        verify(engine, timeout(2000)).markRead(CHAT, List.of("m1"), null);
    }
}
