package com.agentbridge.orchestrator.config;

import com.agentbridge.orchestrator.cache.TranslationCache;
import com.agentbridge.orchestrator.diff.SemanticDiff;
import com.agentbridge.orchestrator.harness.RoundTripHarness;
import com.agentbridge.orchestrator.registry.AdapterRegistry;
import com.agentbridge.orchestrator.repository.ActivityRepository;
import com.agentbridge.orchestrator.repository.SnapshotRepository;
import com.agentbridge.orchestrator.service.AgentCatalogService;
import com.agentbridge.orchestrator.service.MigrationJobService;
import com.agentbridge.orchestrator.service.TranslationOrchestrator;
import com.agentbridge.orchestrator.service.TranslationResponse;
import com.agentbridge.orchestrator.store.CanonicalStore;
import com.agentbridge.orchestrator.store.GraphCodec;
import com.agentbridge.orchestrator.store.InMemoryCanonicalStore;
import com.agentbridge.orchestrator.store.JpaCanonicalStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the bridge core. Registry, store and cache are ordinary beans owned
 * by the application context; nothing in the core is a static singleton.
 *
 * <pre>
 *   agentbridge.store.type                memory | jpa (default jpa)
 *   agentbridge.cache.capacity            total entries across shards
 *   agentbridge.cache.shards
 *   agentbridge.cache.ttl                 e.g. 10m
 *   agentbridge.cache.sweep-interval      e.g. 30s
 *   agentbridge.translation.async-workers
 *   agentbridge.migration.workers         default worker count per migration job
 *   agentbridge.harness.regression-tolerance
 * </pre>
 */
@Configuration
public class BridgeConfiguration {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    AdapterRegistry adapterRegistry(MeterRegistry meterRegistry) {
        return new AdapterRegistry(meterRegistry);
    }

    @Bean
    GraphCodec graphCodec(ObjectMapper objectMapper) {
        return new GraphCodec(objectMapper);
    }

    // ------------------------------------------------------------------
    // Store
    // ------------------------------------------------------------------

    @Bean
    @ConditionalOnProperty(name = "agentbridge.store.type", havingValue = "jpa", matchIfMissing = true)
    CanonicalStore jpaCanonicalStore(SnapshotRepository snapshots,
                                     ActivityRepository activities,
                                     PlatformTransactionManager transactionManager,
                                     GraphCodec codec,
                                     Clock clock) {
        return new JpaCanonicalStore(snapshots, activities, new TransactionTemplate(transactionManager), codec, clock);
    }

    @Bean
    @ConditionalOnProperty(name = "agentbridge.store.type", havingValue = "memory")
    CanonicalStore inMemoryCanonicalStore() {
        return new InMemoryCanonicalStore();
    }

    // ------------------------------------------------------------------
    // Cache and translation
    // ------------------------------------------------------------------

    @Bean(initMethod = "start", destroyMethod = "close")
    TranslationCache<TranslationResponse> translationCache(
            @Value("${agentbridge.cache.capacity:1000}") int capacity,
            @Value("${agentbridge.cache.shards:16}") int shards,
            @Value("${agentbridge.cache.ttl:10m}") Duration ttl,
            @Value("${agentbridge.cache.sweep-interval:30s}") Duration sweepInterval,
            Clock clock,
            MeterRegistry meterRegistry) {
        return new TranslationCache<>(capacity, shards, ttl, sweepInterval, clock, meterRegistry);
    }

    @Bean(destroyMethod = "shutdown")
    ExecutorService translationExecutor(@Value("${agentbridge.translation.async-workers:4}") int workers) {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "translation-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    TranslationOrchestrator translationOrchestrator(AdapterRegistry registry,
                                                    CanonicalStore store,
                                                    TranslationCache<TranslationResponse> cache,
                                                    MeterRegistry meterRegistry,
                                                    Clock clock,
                                                    @Qualifier("translationExecutor") ExecutorService executor) {
        return new TranslationOrchestrator(registry, store, cache, meterRegistry, clock, executor);
    }

    @Bean
    AgentCatalogService agentCatalogService(CanonicalStore store,
                                            TranslationOrchestrator orchestrator,
                                            AdapterRegistry registry,
                                            TranslationCache<TranslationResponse> cache,
                                            GraphCodec codec) {
        return new AgentCatalogService(store, orchestrator, registry, cache, codec);
    }

    @Bean
    MigrationJobService migrationJobService(TranslationOrchestrator orchestrator,
                                            CanonicalStore store,
                                            AdapterRegistry registry,
                                            Clock clock,
                                            @Value("${agentbridge.migration.workers:4}") int workers,
                                            @Value("${agentbridge.migration.retention:1h}") Duration retention) {
        return new MigrationJobService(orchestrator, store, registry, clock, workers, retention);
    }

    @Bean
    RoundTripHarness roundTripHarness(SemanticDiff diff,
                                      @Value("${agentbridge.harness.regression-tolerance:0.0}") double tolerance) {
        return new RoundTripHarness(diff, tolerance);
    }
}
