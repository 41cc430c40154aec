package com.chatbridge.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".chatbridge", "config.yaml"
    );

    public static BridgeConfig load() {
        var override = System.getenv("CHATBRIDGE_CONFIG");
        return load(override != null && !override.isBlank() ? Path.of(override) : DEFAULT_PATH);
    }

    @SuppressWarnings("unchecked")
    public static BridgeConfig load(Path path) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var engine = (Map<String, Object>) raw.getOrDefault("engine", Map.of());
        var forward = (Map<String, Object>) raw.getOrDefault("forward", Map.of());
        var limits = (Map<String, Object>) raw.getOrDefault("limits", Map.of());
        var ingest = (Map<String, Object>) raw.getOrDefault("ingest", Map.of());
        var profiles = (Map<String, Object>) raw.getOrDefault("profiles", Map.of());

        return new BridgeConfig(
            parseEngine(engine),
            parseForwarding(forward),
            parseLimits(limits),
            parseIngest(ingest),
            parseProfiles(profiles)
        );
    }

    private static EngineConfig parseEngine(Map<String, Object> engine) {
        var defaults = EngineConfig.defaults();
        return new EngineConfig(
            intOf(engine.get("max-connect-attempts"), defaults.maxConnectAttempts()),
            durationOf(engine.get("reconnect-base-delay"), defaults.reconnectBaseDelay()),
            boolOf(engine.get("status-enabled"), defaults.statusEnabled()),
            durationOf(engine.get("shutdown-grace"), defaults.shutdownGrace())
        );
    }

    @SuppressWarnings("unchecked")
    private static ForwardingConfig parseForwarding(Map<String, Object> forward) {
        var defaults = ForwardingConfig.defaults();
        var webhook = (Map<String, Object>) forward.getOrDefault("webhook", Map.of());
        var extra = (Map<String, Object>) forward.getOrDefault("extra", defaults.extraParams());
        var mode = forward.containsKey("mode")
                ? ForwardMode.parse(String.valueOf(forward.get("mode")))
                : defaults.mode();
        return new ForwardingConfig(
            mode,
            envOrDefault("CHATBRIDGE_OUTBOX", stringOf(forward.get("out-folder"), defaults.outFolder())),
            longOf(forward.get("max-file-bytes"), defaults.maxFileBytes()),
            new LinkedHashMap<>(extra),
            parseWebhook(webhook)
        );
    }

    @SuppressWarnings("unchecked")
    private static WebhookConfig parseWebhook(Map<String, Object> webhook) {
        var defaults = WebhookConfig.defaults();
        var headers = new HashMap<String, String>();
        ((Map<String, Object>) webhook.getOrDefault("headers", Map.of()))
                .forEach((k, v) -> headers.put(k, String.valueOf(v)));
        var url = envOrDefault("CHATBRIDGE_WEBHOOK_URL", stringOf(webhook.get("url"), defaults.url()));
        return new WebhookConfig(
            boolOf(webhook.get("enabled"), !url.isBlank()),
            url,
            envOrDefault("CHATBRIDGE_WEBHOOK_SECRET", stringOf(webhook.get("secret"), defaults.secret())),
            headers,
            intOf(webhook.get("max-attempts"), defaults.maxAttempts()),
            durationOf(webhook.get("base-delay"), defaults.baseDelay()),
            durationOf(webhook.get("timeout"), defaults.timeout())
        );
    }

    @SuppressWarnings("unchecked")
    private static RateLimitConfig parseLimits(Map<String, Object> limits) {
        var defaults = RateLimitConfig.defaults();
        return new RateLimitConfig(
            parseOperation((Map<String, Object>) limits.getOrDefault("text", Map.of()), defaults.text()),
            parseOperation((Map<String, Object>) limits.getOrDefault("media", Map.of()), defaults.media()),
            parseOperation((Map<String, Object>) limits.getOrDefault("status", Map.of()), defaults.status()),
            durationOf(limits.get("retry-ceiling"), defaults.retryCeiling()),
            durationOf(limits.get("admission-timeout"), defaults.admissionTimeout())
        );
    }

    private static RateLimitConfig.OperationLimit parseOperation(Map<String, Object> op,
                                                                 RateLimitConfig.OperationLimit def) {
        return new RateLimitConfig.OperationLimit(
            durationOf(op.get("refill"), def.refill()),
            intOf(op.get("burst"), def.burst()),
            intOf(op.get("attempts"), def.attempts()),
            durationOf(op.get("base-delay"), def.baseDelay())
        );
    }

    @SuppressWarnings("unchecked")
    private static IngestConfig parseIngest(Map<String, Object> ingest) {
        var defaults = IngestConfig.defaults();
        var reply = (Map<String, Object>) ingest.getOrDefault("reply", Map.of());
        var pacingDef = defaults.pacing();
        return new IngestConfig(
            envOrDefault("CHATBRIDGE_WEBHOOK_SECRET", stringOf(ingest.get("secret"), defaults.secret())),
            boolOf(ingest.get("require-signature"), defaults.requireSignature()),
            boolOf(ingest.get("allow-no-secret-dev"), defaults.allowNoSecretDev()),
            longOf(ingest.get("body-limit"), defaults.bodyLimitBytes()),
            boolOf(ingest.get("use-timestamp"), defaults.useTimestamp()),
            durationOf(ingest.get("timestamp-skew"), defaults.timestampSkew()),
            durationOf(ingest.get("dedupe-window"), defaults.dedupeWindow()),
            durationOf(ingest.get("aggregation-window"), defaults.aggregationWindow()),
            durationOf(ingest.get("pre-reply-delay"), defaults.preReplyDelay()),
            durationOf(ingest.get("typing-pause"), defaults.typingPause()),
            durationOf(ingest.get("typing-debounce"), defaults.typingDebounce()),
            new IngestConfig.ReplyPacing(
                durationOf(reply.get("base-wait"), pacingDef.base()),
                durationOf(reply.get("per-char"), pacingDef.perChar()),
                durationOf(reply.get("jitter"), pacingDef.jitter()),
                durationOf(reply.get("max-wait"), pacingDef.max())
            ),
            envOrDefault("CHATBRIDGE_ENGINE_URL", stringOf(ingest.get("engine-url"), defaults.engineUrl())),
            envOrDefault("CHATBRIDGE_BUSINESS_URL", stringOf(ingest.get("business-url"), defaults.businessUrl())),
            stringOf(ingest.get("channel"), defaults.channel())
        );
    }

    private static ProfileConfig parseProfiles(Map<String, Object> profiles) {
        var defaults = ProfileConfig.defaults();
        var zone = profiles.containsKey("zone")
                ? ZoneId.of(String.valueOf(profiles.get("zone")))
                : defaults.zone();
        return new ProfileConfig(
            stringOf(profiles.get("base-dir"), defaults.baseDir()),
            intOf(profiles.get("media-cap"), defaults.mediaCap()),
            zone
        );
    }

    /** Accepts bare numbers (milliseconds), {@code 250ms}, {@code 3s}, {@code 5m} or ISO-8601 ({@code PT3S}). */
    static Duration durationOf(Object value, Duration fallback) {
        if (value == null) return fallback;
        if (value instanceof Number n) return Duration.ofMillis(n.longValue());
        var s = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) return fallback;
        if (s.startsWith("pt") || s.startsWith("p")) return Duration.parse(s.toUpperCase(Locale.ROOT));
        if (s.endsWith("ms")) return Duration.ofMillis(Long.parseLong(s.substring(0, s.length() - 2).trim()));
        if (s.endsWith("s")) return Duration.ofMillis(Math.round(Double.parseDouble(s.substring(0, s.length() - 1).trim()) * 1000));
        if (s.endsWith("m")) return Duration.ofMinutes(Long.parseLong(s.substring(0, s.length() - 1).trim()));
        if (s.endsWith("h")) return Duration.ofHours(Long.parseLong(s.substring(0, s.length() - 1).trim()));
        return Duration.ofMillis(Long.parseLong(s));
    }

    private static int intOf(Object value, int fallback) {
        return value == null ? fallback : Integer.parseInt(String.valueOf(value).trim());
    }

    private static long longOf(Object value, long fallback) {
        return value == null ? fallback : Long.parseLong(String.valueOf(value).trim());
    }

    private static boolean boolOf(Object value, boolean fallback) {
        return value == null ? fallback : Boolean.parseBoolean(String.valueOf(value).trim());
    }

    private static String stringOf(Object value, String fallback) {
        return value == null ? fallback : String.valueOf(value);
    }

    private static String envOrDefault(String env, String fallback) {
        var val = System.getenv(env);
        return val != null ? val : fallback;
    }
}
