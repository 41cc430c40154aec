package com.chatbridge.gateway.http;

import com.chatbridge.profiles.Profile;
import com.chatbridge.profiles.ProfileStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HealthController {

    private final ObjectProvider<ProfileStore> profiles;

    public HealthController(ObjectProvider<ProfileStore> profiles) {
        this.profiles = profiles;
    }

    @GetMapping(value = "/healthz", produces = MediaType.TEXT_PLAIN_VALUE)
    public String healthz() {
        return "ok";
    }

    @GetMapping(value = "/readyz", produces = MediaType.TEXT_PLAIN_VALUE)
    public String readyz() {
        return "ready";
    }

    @GetMapping("/debug/profiles")
    public Map<String, Profile> profiles() {
        var store = profiles.getIfAvailable();
        return store == null ? Map.of() : store.snapshot();
    }

    @GetMapping(value = "/", produces = MediaType.TEXT_PLAIN_VALUE)
    public String banner() {
        return "chatbridge: POST /wh (signed envelopes), GET /healthz, GET /readyz, GET /debug/profiles";
    }
}
