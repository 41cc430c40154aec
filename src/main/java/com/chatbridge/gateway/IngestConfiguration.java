package com.chatbridge.gateway;

import com.chatbridge.auth.WebhookSigner;
import com.chatbridge.ingest.BusinessClient;
import com.chatbridge.ingest.EngineClient;
import com.chatbridge.ingest.IngestRouter;
import com.chatbridge.observability.BridgeMetrics;
import com.chatbridge.pipeline.DedupeCache;
import com.chatbridge.profiles.ProfileStore;
import com.chatbridge.shared.config.BridgeConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;

@Configuration
@ConditionalOnProperty(name = "chatbridge.role", havingValue = "ingest")
public class IngestConfiguration {

    @Bean
    public WebhookSigner ingestSigner(BridgeConfig config) {
        config.ingest().validate();
        return new WebhookSigner(config.ingest().secret());
    }

    @Bean(destroyMethod = "close")
    public DedupeCache ingestDedupe(BridgeConfig config) {
        return new DedupeCache(config.ingest().dedupeWindow()).withSweeper(Duration.ofMinutes(1), "ingest-dedupe-sweeper");
    }

    @Bean
    public ProfileStore profileStore(BridgeConfig config) {
        var p = config.profiles();
        return new ProfileStore(Path.of(p.baseDir()), Path.of(config.forward().outFolder()), p.mediaCap(), p.zone());
    }

    @Bean(destroyMethod = "close")
    public IngestRouter ingestRouter(BridgeConfig config, ProfileStore profiles, BridgeMetrics metrics) {
        var ingest = config.ingest();
        return new IngestRouter(ingest, profiles, new EngineClient(ingest.engineUrl()),
                new BusinessClient(ingest.businessUrl()), metrics);
    }
}
