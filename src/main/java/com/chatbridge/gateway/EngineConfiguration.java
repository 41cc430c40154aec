package com.chatbridge.gateway;

import com.chatbridge.engine.BridgeEngine;
import com.chatbridge.engine.EngineHandlers;
import com.chatbridge.forward.EnvelopeCodec;
import com.chatbridge.forward.FolderSink;
import com.chatbridge.forward.Forwarder;
import com.chatbridge.forward.WebhookDelivery;
import com.chatbridge.history.JdbcMessageHistoryStore;
import com.chatbridge.history.MessageHistoryStore;
import com.chatbridge.observability.BridgeMetrics;
import com.chatbridge.outbound.OutboundLimiter;
import com.chatbridge.protocol.ProtocolClient;
import com.chatbridge.shared.config.BridgeConfig;
import com.chatbridge.shared.config.ForwardMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.nio.file.Path;

/**
 * Engine role: history store, sink and webhook fan-out, rate-limited sends and the connected
 * {@link BridgeEngine}. The protocol client itself is supplied by whichever module provides a
 * {@link ProtocolClient} bean.
 */
@Configuration
@ConditionalOnProperty(name = "chatbridge.role", havingValue = "engine", matchIfMissing = true)
public class EngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EngineConfiguration.class);

    @Bean
    public MessageHistoryStore messageHistoryStore(DataSource dataSource) {
        var store = new JdbcMessageHistoryStore(dataSource);
        store.initSchema();
        return store;
    }

    @Bean
    public Forwarder forwarder(BridgeConfig config, EnvelopeCodec codec, BridgeMetrics metrics) {
        var fwd = config.forward();
        FolderSink sink = null;
        if (fwd.mode() == ForwardMode.FOLDER) {
            sink = new FolderSink(Path.of(fwd.outFolder()), fwd.maxFileBytes());
            log.info("Folder sink enabled at {}", fwd.outFolder());
        }
        WebhookDelivery webhook = null;
        if (fwd.webhook().active()) {
            webhook = new WebhookDelivery(fwd.webhook(), metrics);
            log.info("Webhook forwarding enabled url={}", fwd.webhook().url());
        }
        return new Forwarder(codec, sink, webhook, metrics);
    }

    @Bean
    public OutboundLimiter outboundLimiter(BridgeConfig config) {
        return new OutboundLimiter(config.limits());
    }

    @Bean(destroyMethod = "shutdown")
    public BridgeEngine bridgeEngine(ObjectProvider<ProtocolClient> clients, ObjectProvider<EngineHandlers> handlers,
                                     BridgeConfig config, Forwarder forwarder, MessageHistoryStore history,
                                     OutboundLimiter limiter, BridgeMetrics metrics) {
        var client = clients.getIfAvailable();
        if (client == null) {
            throw new IllegalStateException("engine role needs a ProtocolClient bean; none is registered");
        }
        var engine = new BridgeEngine(client, config.engine(), forwarder, history, limiter, metrics,
                handlers.getIfAvailable(() -> EngineHandlers.NONE));
        try {
            engine.start();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while connecting", e);
        }
        return engine;
    }
}
