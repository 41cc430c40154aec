package com.chatbridge.ingest;

import com.chatbridge.shared.Json;
import com.chatbridge.shared.model.BusinessReply;
import com.chatbridge.shared.model.BusinessRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/** Posts the aggregated conversation turn to the downstream business service. */
public class BusinessClient {

    /** The service answered, but not with a decodable reply. */
    public static class UndecodableReplyException extends RuntimeException {
        public UndecodableReplyException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    private final String url;
    private final HttpClient httpClient;
    private final ObjectMapper mapper = Json.newMapper();
    private final Duration timeout;

    public BusinessClient(String url) {
        this(url, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), Duration.ofSeconds(30));
    }

    public BusinessClient(String url, HttpClient httpClient, Duration timeout) {
        this.url = url;
        this.httpClient = httpClient;
        this.timeout = timeout;
    }

    public BusinessReply ask(BusinessRequest request) {
        String body;
        try {
            var httpReq = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .header("Content-Type", "application/json")
                    .timeout(timeout)
                    .POST(HttpRequest.BodyPublishers.ofByteArray(mapper.writeValueAsBytes(request)))
                    .build();
            var resp = httpClient.send(httpReq, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new RuntimeException("business API error " + resp.statusCode() + ": " + resp.body());
            }
            body = resp.body();
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted calling business API", e);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
        try {
            return mapper.readValue(body, BusinessReply.class);
        } catch (JsonProcessingException e) {
            throw new UndecodableReplyException("Undecodable business reply", e);
        }
    }
}
