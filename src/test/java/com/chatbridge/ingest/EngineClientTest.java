package com.chatbridge.ingest;

import com.chatbridge.support.RequestBodies;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class EngineClientTest {

    private final HttpClient http = mock(HttpClient.class);
    private final EngineClient client = new EngineClient("http://engine:8080/", http);
    private final ObjectMapper mapper = new ObjectMapper();

    @SuppressWarnings("unchecked")
    private void respond(int status) throws Exception {
        HttpResponse<String> resp = mock(HttpResponse.class);
        when(resp.statusCode()).thenReturn(status);
        when(resp.body()).thenReturn(status == 200 ? "{\"success\":true}" : "{\"success\":false}");
        doReturn(resp).when(http).send(any(HttpRequest.class), any());
    }

    private HttpRequest sent() throws Exception {
        var captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(http).send(captor.capture(), any());
        return captor.getValue();
    }

    @Test
    void sendTextPostsRecipientAndMessage() throws Exception {
        respond(200);
        client.sendText("5511@s.whatsapp.net", "hola");

        var req = sent();
        assertEquals("http://engine:8080/api/send", req.uri().toString());
        assertEquals("POST", req.method());
        assertEquals("application/json", req.headers().firstValue("Content-Type").orElse(""));
        var json = mapper.readTree(RequestBodies.asString(req));
        assertEquals("5511@s.whatsapp.net", json.get("recipient").asText());
        assertEquals("hola", json.get("message").asText());
    }

    @Test
    void typingDefaultsMediaToText() throws Exception {
        respond(200);
        client.setTyping("c1", true, null);

        var json = mapper.readTree(RequestBodies.asString(sent()));
        assertTrue(json.get("typing").asBoolean());
        assertEquals("text", json.get("media").asText());
    }

    @Test
    void markReadOmitsBlankSender() throws Exception {
        respond(200);
        client.markRead("c1", List.of("m1"), " ");

        var req = sent();
        assertEquals("/api/markread", req.uri().getPath());
        var json = mapper.readTree(RequestBodies.asString(req));
        assertEquals("read", json.get("receipt_type").asText());
        assertEquals("m1", json.get("message_ids").get(0).asText());
        assertFalse(json.has("sender"));
    }

    @Test
    void markReadIncludesGroupSender() throws Exception {
        respond(200);
        client.markRead("g@g.us", List.of("m1"), "5511@s.whatsapp.net");

        var json = mapper.readTree(RequestBodies.asString(sent()));
        assertEquals("5511@s.whatsapp.net", json.get("sender").asText());
    }

    @Test
    void non2xxIsAnError() throws Exception {
        respond(500);
        var ex = assertThrows(RuntimeException.class, () -> client.sendText("c1", "hola"));
        assertTrue(ex.getMessage().contains("500"));
    }

    @Test
    void transportFailureIsWrapped() throws Exception {
        doThrow(new IOException("connection refused")).when(http).send(any(HttpRequest.class), any());
        var ex = assertThrows(RuntimeException.class, () -> client.sendText("c1", "hola"));
        assertInstanceOf(IOException.class, ex.getCause());
    }
}
