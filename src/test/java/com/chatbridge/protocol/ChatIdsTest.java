package com.chatbridge.protocol;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChatIdsTest {

    @Test
    void deviceAndAgentSuffixesAreStripped() {
        assertEquals("5511999@s.whatsapp.net", ChatIds.canonical("5511999:12@s.whatsapp.net"));
        assertEquals("5511999@s.whatsapp.net", ChatIds.canonical("5511999.0:3@s.whatsapp.net"));
    }

    @Test
    void aliasAndLegacyServersFoldIntoPrimary() {
        var primary = ChatIds.canonical("5511999@s.whatsapp.net");
        assertEquals(primary, ChatIds.canonical("5511999@lid"));
        assertEquals(primary, ChatIds.canonical("5511999@c.us"));
        assertEquals(primary, ChatIds.canonical("5511999"));
    }

    @Test
    void formattedPhoneNumbersReduceToDigits() {
        assertEquals("5511999@s.whatsapp.net", ChatIds.canonical("+55 (11) 999"));
    }

    @Test
    void groupsAndBroadcastsKeepTheirServer() {
        assertEquals("120363-456@g.us", ChatIds.canonical("120363-456@g.us"));
        assertEquals("status@broadcast", ChatIds.canonical("status@broadcast"));
        assertTrue(ChatIds.isGroup("120363-456@g.us"));
        assertTrue(ChatIds.isStatusBroadcast("status@broadcast"));
    }

    @Test
    void canonicalIsIdempotent() {
        for (var raw : new String[]{"5511999:4@s.whatsapp.net", "77@lid", "120363@g.us", "+1 555 0100"}) {
            var once = ChatIds.canonical(raw);
            assertEquals(once, ChatIds.canonical(once), raw);
        }
    }

    @Test
    void blankInputGivesEmptyKey() {
        assertEquals("", ChatIds.canonical((String) null));
        assertEquals("", ChatIds.canonical("  "));
        assertEquals("", ChatIds.canonical(ChatAddress.EMPTY));
    }

    @Test
    void userOfReturnsPartBeforeAt() {
        assertEquals("5511999", ChatIds.userOf("5511999@s.whatsapp.net"));
        assertEquals("plain", ChatIds.userOf("plain"));
    }
}
