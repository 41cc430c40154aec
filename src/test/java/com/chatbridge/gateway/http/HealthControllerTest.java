package com.chatbridge.gateway.http;

import com.chatbridge.profiles.ProfileStore;
import com.chatbridge.shared.model.Direction;
import com.chatbridge.shared.model.Envelope;
import com.chatbridge.shared.model.EventTypes;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.ObjectProvider;

import java.nio.file.Path;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class HealthControllerTest {

    @TempDir
    Path tempDir;

    @SuppressWarnings("unchecked")
    private static ObjectProvider<ProfileStore> provider(ProfileStore store) {
        ObjectProvider<ProfileStore> p = mock(ObjectProvider.class);
        when(p.getIfAvailable()).thenReturn(store);
        return p;
    }

    @Test
    void probesAnswerPlainText() {
        var controller = new HealthController(provider(null));
        assertEquals("ok", controller.healthz());
        assertEquals("ready", controller.readyz());
        assertTrue(controller.banner().contains("/wh"));
    }

    @Test
    void profilesEmptyWithoutStore() {
        assertTrue(new HealthController(provider(null)).profiles().isEmpty());
    }

    @Test
    void profilesSnapshotFromStore() {
        var store = new ProfileStore(tempDir, tempDir.resolve("out"), 5, ZoneOffset.UTC);
        store.touchInbound(Envelope.builder(EventTypes.MESSAGE).direction(Direction.IN)
                .chatId("5511@s.whatsapp.net").senderId("5511@s.whatsapp.net").messageId("m1").text("hola").build());

        var snapshot = new HealthController(provider(store)).profiles();

        assertEquals(1, snapshot.size());
        assertEquals("hola", snapshot.get("5511@s.whatsapp.net").lastText());
    }
}
