package com.cinelink.federation.config;

import com.cinelink.federation.match.MatchNormalizer;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.springframework.boot.autoconfigure.mongo.MongoClientSettingsBuilderCustomizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(FederationProperties.class)
public class FederationConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService federationExecutor(FederationProperties properties) {
        return Executors.newFixedThreadPool(Math.max(2, properties.getExecution().getPoolSize()));
    }

    /**
     * One thread per store. Health probes never share threads with request work, and a
     * probe that hangs past its timeout only ever occupies its own store's slot.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService healthProbeExecutor() {
        return Executors.newFixedThreadPool(2);
    }

    @Bean
    public MatchNormalizer matchNormalizer(FederationProperties properties) {
        return new MatchNormalizer(properties.getMatch().isQuoteSubstring());
    }

    @Bean
    public MongoClientSettingsBuilderCustomizer mongoTimeoutCustomizer(FederationProperties properties) {
        FederationProperties.Document config = properties.getDocument();
        return builder -> builder
            .applyToSocketSettings(socket -> socket
                .connectTimeout(config.getConnectTimeoutMs(), TimeUnit.MILLISECONDS)
                .readTimeout(config.getReadTimeoutMs(), TimeUnit.MILLISECONDS))
            .applyToClusterSettings(cluster -> cluster
                .serverSelectionTimeout(config.getServerSelectionTimeoutMs(), TimeUnit.MILLISECONDS));
    }
}
