package com.chatbridge.ingest;

import com.chatbridge.shared.Json;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Calls the engine's control surface: {@code /api/send}, {@code /api/typing}, {@code /api/markread}. */
public class EngineClient {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final String baseUrl;
    private final HttpClient httpClient;
    private final ObjectMapper mapper = Json.newMapper();

    public EngineClient(String baseUrl) {
        this(baseUrl, HttpClient.newBuilder().connectTimeout(TIMEOUT).build());
    }

    public EngineClient(String baseUrl, HttpClient httpClient) {
        this.baseUrl = baseUrl.replaceAll("/+$", "");
        this.httpClient = httpClient;
    }

    public void sendText(String recipient, String message) {
        var body = new LinkedHashMap<String, Object>();
        body.put("recipient", recipient);
        body.put("message", message);
        post("/api/send", body);
    }

    public void setTyping(String recipient, boolean typing, String media) {
        var body = new LinkedHashMap<String, Object>();
        body.put("recipient", recipient);
        body.put("typing", typing);
        body.put("media", media == null || media.isBlank() ? "text" : media);
        post("/api/typing", body);
    }

    /** {@code sender} is only sent when non-blank; the engine requires it for groups. */
    public void markRead(String recipient, List<String> messageIds, String sender) {
        var body = new LinkedHashMap<String, Object>();
        body.put("recipient", recipient);
        body.put("message_ids", messageIds);
        body.put("receipt_type", "read");
        if (sender != null && !sender.isBlank()) body.put("sender", sender);
        post("/api/markread", body);
    }

    private void post(String path, Map<String, Object> body) {
        try {
            var request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .header("Content-Type", "application/json")
                    .timeout(TIMEOUT)
                    .POST(HttpRequest.BodyPublishers.ofByteArray(mapper.writeValueAsBytes(body)))
                    .build();
            var resp = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new RuntimeException("engine " + path + " error " + resp.statusCode() + ": " + resp.body());
            }
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted calling engine " + path, e);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }
}
