package com.chatbridge.protocol;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChatAddressTest {

    @Test
    void bareValueIsPrimaryContact() {
        var a = ChatAddress.parse("5511999");
        assertEquals("5511999", a.user());
        assertEquals(ChatAddress.USER_SERVER, a.server());
    }

    @Test
    void aliasAddressIsKeptForSending() {
        var a = ChatAddress.parse("123456@lid");
        assertTrue(a.isAlias());
        assertEquals("123456@lid", a.toString());
    }

    @Test
    void groupAndStatusDetection() {
        assertTrue(ChatAddress.parse("1203@g.us").isGroup());
        assertTrue(ChatAddress.parse("status@broadcast").isStatusBroadcast());
        assertTrue(ChatAddress.parse("").isEmpty());
    }
}
