package com.chatbridge.engine;

import com.chatbridge.protocol.ChatAddress;
import com.chatbridge.protocol.MediaKind;
import com.chatbridge.protocol.MediaPart;
import com.chatbridge.protocol.MessageContent;
import com.chatbridge.protocol.MessageInfo;
import com.chatbridge.protocol.ProtocolClient;
import com.chatbridge.protocol.ProtocolEvent;
import com.chatbridge.shared.model.Direction;
import com.chatbridge.shared.model.EventTypes;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class EventTranslatorTest {

    private static final ChatAddress ALIAS = ChatAddress.parse("998877@lid");
    private static final ChatAddress CONTACT = ChatAddress.parse("5511999:3@s.whatsapp.net");
    private static final ChatAddress GROUP = ChatAddress.parse("1203-9@g.us");

    private final EventTranslator translator =
            new EventTranslator(ChatNameResolver.standard(mock(ProtocolClient.class)));

    private static ProtocolEvent.Message message(ChatAddress chat, ChatAddress sender, boolean fromMe,
                                                 MessageContent content) {
        var info = new MessageInfo("ABC", chat, sender, fromMe, "Ana", null, Instant.parse("2024-01-01T00:00:00Z"));
        return new ProtocolEvent.Message(info, content);
    }

    @Test
    void inboundMessageUsesCanonicalChatAndRawSender() {
        var env = translator.translate(message(ALIAS, ALIAS, false, MessageContent.text("hola")));

        assertEquals(EventTypes.MESSAGE, env.eventType());
        assertEquals(Direction.IN, env.direction());
        assertEquals("998877@s.whatsapp.net", env.chatId());
        assertEquals("998877@lid", env.senderId());
        assertEquals("Ana", env.chatName());
        assertEquals("ABC", env.messageId());
        assertEquals("hola", env.text());
        assertNull(env.media());
    }

    @Test
    void outboundEchoHasNoSenderButNamesTheChat() {
        var env = translator.translate(message(CONTACT, CONTACT, true, MessageContent.text("sent from phone")));

        assertEquals(Direction.OUT, env.direction());
        assertEquals("5511999@s.whatsapp.net", env.chatId());
        assertNull(env.senderId());
        // own push name never names the other side
        assertEquals("5511999", env.chatName());
    }

    @Test
    void mediaMessageCarriesTicketAndCaption() {
        var part = new MediaPart(MediaKind.IMAGE, "image/jpeg", "look", null, "https://cdn/x",
                "/v/t62/x", new byte[]{1, 2}, null, null, 1234L, null);
        var env = translator.translate(message(GROUP, CONTACT, false, MessageContent.media(part)));

        assertEquals("look", env.text());
        assertEquals("image", env.media().type());
        assertEquals("https://cdn/x", env.media().url());
        assertEquals("AQI=", env.media().mediaKey());
        assertEquals(1234L, env.media().fileLength());
        assertEquals("Group 1203-9", env.chatName());
    }

    @Test
    void documentTitleOnlyForDocuments() {
        var doc = new MediaPart(MediaKind.DOCUMENT, "application/pdf", null, "invoice.pdf", null,
                null, null, null, null, 0, null);
        var img = new MediaPart(MediaKind.IMAGE, "image/png", null, "ignored", null,
                null, null, null, null, 0, null);
        assertEquals("invoice.pdf", EventTranslator.documentTitle(message(CONTACT, CONTACT, false, MessageContent.media(doc))));
        assertNull(EventTranslator.documentTitle(message(CONTACT, CONTACT, false, MessageContent.media(img))));
    }

    @Test
    void receiptTagsDefaultAndSenderEcho() {
        var delivered = translator.translate(new ProtocolEvent.Receipt(CONTACT, CONTACT, List.of("a", "b"), "", null));
        assertEquals("delivered", delivered.receiptType());
        assertEquals(List.of("a", "b"), delivered.messageIds());
        assertNull(delivered.messageId());

        assertEquals("sent", EventTranslator.receiptTag("sender"));
        assertEquals("read", EventTranslator.receiptTag("read"));
        assertEquals("delivered", EventTranslator.receiptTag(null));
    }

    @Test
    void chatPresenceCarriesStateAndMedia() {
        var env = translator.translate(new ProtocolEvent.ChatPresence(CONTACT, CONTACT, "composing", "audio"));

        assertEquals(EventTypes.CHAT_PRESENCE, env.eventType());
        assertEquals("composing", env.extra().get("state"));
        assertEquals("audio", env.extra().get("media"));
    }

    @Test
    void presenceFormatsLastSeen() {
        var env = translator.translate(new ProtocolEvent.Presence(CONTACT, true, Instant.parse("2024-03-01T10:15:30.789Z")));

        assertEquals(true, env.extra().get("unavailable"));
        assertEquals("2024-03-01T10:15:30Z", env.extra().get("last_seen"));
        assertEquals("5511999:3@s.whatsapp.net", env.senderId());
    }

    @Test
    void groupUpdateListsMembers() {
        var env = translator.translate(new ProtocolEvent.GroupUpdate(GROUP, CONTACT, "New name", null,
                List.of(ALIAS), List.of()));

        assertEquals("1203-9@g.us", env.chatId());
        assertEquals("New name", env.chatName());
        assertEquals(List.of("998877@lid"), env.extra().get("joined"));
        assertFalse(env.extra().containsKey("left"));
        assertFalse(env.extra().containsKey("topic"));
    }

    @Test
    void systemEvents() {
        assertEquals(EventTypes.CONNECTED, translator.translate(new ProtocolEvent.Connected()).eventType());
        assertEquals(7, translator.translate(new ProtocolEvent.OfflineSyncCompleted(7)).extra().get("count"));
        var loggedOut = translator.translate(new ProtocolEvent.LoggedOut(true, "401"));
        assertEquals(true, loggedOut.extra().get("on_connect"));
        assertEquals("401", loggedOut.extra().get("reason"));
        assertEquals("unknown", translator.translate(new ProtocolEvent.Unknown(" ")).eventType());
        assertEquals("call_offer", translator.translate(new ProtocolEvent.Unknown("call_offer")).eventType());
    }

    @Test
    void chatKinds() {
        assertEquals("GROUP", EventTranslator.chatKind(GROUP));
        assertEquals("STATUS", EventTranslator.chatKind(ChatAddress.STATUS_BROADCAST));
        assertEquals("PRIVATE", EventTranslator.chatKind(CONTACT));
        assertEquals("UNKNOWN", EventTranslator.chatKind(ChatAddress.EMPTY));
    }
}
