package com.agentbridge.orchestrator.service;

import com.agentbridge.orchestrator.Samples;
import com.agentbridge.orchestrator.adapter.StubAdapter;
import com.agentbridge.orchestrator.adapter.impl.CrewAiAdapter;
import com.agentbridge.orchestrator.adapter.impl.LmosAdapter;
import com.agentbridge.orchestrator.adapter.impl.McpAdapter;
import com.agentbridge.orchestrator.cache.CacheKey;
import com.agentbridge.orchestrator.cache.TranslationCache;
import com.agentbridge.orchestrator.canonical.CanonicalGraph;
import com.agentbridge.orchestrator.canonical.Triple;
import com.agentbridge.orchestrator.canonical.Vocabulary;
import com.agentbridge.orchestrator.error.AdapterNotFoundException;
import com.agentbridge.orchestrator.error.ErrorCategory;
import com.agentbridge.orchestrator.registry.AdapterRegistry;
import com.agentbridge.orchestrator.store.CompactionResult;
import com.agentbridge.orchestrator.store.DiscoveryCriteria;
import com.agentbridge.orchestrator.store.GraphCodec;
import com.agentbridge.orchestrator.store.InMemoryCanonicalStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for AgentCatalogService over the in-memory store. No Spring context.
 */
class AgentCatalogServiceTest {

    AdapterRegistry                       registry;
    InMemoryCanonicalStore                store;
    TranslationCache<TranslationResponse> cache;
    GraphCodec                            codec;
    TranslationOrchestrator               orchestrator;
    AgentCatalogService                   catalog;

    @BeforeEach
    void setUp() {
        SimpleMeterRegistry meters = new SimpleMeterRegistry();
        Clock clock = Clock.fixed(Instant.parse("2026-03-10T12:00:00Z"), ZoneOffset.UTC);
        registry = new AdapterRegistry(meters);
        registry.register(new McpAdapter());
        registry.register(new CrewAiAdapter());
        registry.register(new LmosAdapter());
        store = new InMemoryCanonicalStore();
        cache = new TranslationCache<>(100, 4, Duration.ofMinutes(10), Duration.ofMinutes(1), clock, meters);
        codec = new GraphCodec(new ObjectMapper());
        orchestrator = new TranslationOrchestrator(registry, store, cache, meters, clock, Runnable::run);
        catalog = new AgentCatalogService(store, orchestrator, registry, cache, codec);
    }

    // ------------------------------------------------------------------
    // Import
    // ------------------------------------------------------------------

    @Test
    void importAgent_storesFirstVersion() {
        ImportResult result = catalog.importAgent("crewai", Samples.crewAi().data());

        assertThat(result.success()).isTrue();
        assertThat(result.agentId()).isEqualTo("senior-researcher");
        assertThat(result.version()).isEqualTo(1);
        assertThat(result.fidelity()).isGreaterThan(0.9);
        assertThat(catalog.listAgents()).extracting(s -> s.agentId()).containsExactly("senior-researcher");
    }

    @Test
    void importAgent_minimalMcpAgent_storesSingleAgentNode() {
        ImportResult result = catalog.importAgent("mcp", Map.of("name", "Ada", "tools", List.of("search")));

        assertThat(result.version()).isEqualTo(1);
        assertThat(result.fidelity()).isGreaterThanOrEqualTo(0.9);
        CanonicalGraph graph = store.getAgentSnapshot("ada", 1).orElseThrow().graph();
        assertThat(graph.requireAgentNode()).isEqualTo(Vocabulary.agentIri("ada"));
        assertThat(graph.literal(Vocabulary.agentIri("ada"), Vocabulary.NAME)).contains("Ada");
    }

    @Test
    void importAgent_graphDescribingTwoAgents_isNotStored() {
        StubAdapter alpha = new StubAdapter("alpha");
        alpha.extraAgent = "mallory";
        registry.register(alpha);

        ImportResult result = catalog.importAgent("alpha", Map.of("name", "Ada"));

        assertThat(result.success()).isFalse();
        assertThat(result.version()).isNull();
        assertThat(result.errors()).singleElement()
                .satisfies(e -> assertThat(e.category()).isEqualTo(ErrorCategory.TRANSFORM));
        assertThat(catalog.listAgents()).isEmpty();
    }

    @Test
    void importAgent_explicitId_overridesDerivedId() {
        ImportResult result = catalog.importAgent("mcp", Samples.mcp().data(), "librarian");

        assertThat(result.agentId()).isEqualTo("librarian");
        assertThat(catalog.getAgent("librarian")).isPresent();
        assertThat(catalog.getAgent("research-assistant")).isEmpty();
    }

    @Test
    void importAgent_invalidPayload_reportsWithoutStoring() {
        ImportResult result = catalog.importAgent("crewai", Map.of("goal", "no role here"));

        assertThat(result.success()).isFalse();
        assertThat(result.version()).isNull();
        assertThat(result.errors()).isNotEmpty();
        assertThat(catalog.listAgents()).isEmpty();
    }

    @Test
    void importAgent_unknownFormat_throws() {
        assertThatThrownBy(() -> catalog.importAgent("autogen", Map.of("name", "x")))
                .isInstanceOf(AdapterNotFoundException.class);
    }

    // ------------------------------------------------------------------
    // Read
    // ------------------------------------------------------------------

    @Test
    void getAgent_returnsSortedTriplesAndHistory() {
        catalog.importAgent("mcp", Samples.mcp().data());
        catalog.importAgent("mcp", Samples.mcp().data());

        AgentDetails details = catalog.getAgent("research-assistant").orElseThrow();

        assertThat(details.summary().name()).isEqualTo("Research Assistant");
        assertThat(details.summary().latestVersion()).isEqualTo(2);
        assertThat(details.summary().capabilities()).contains("search", "fetch");
        assertThat(details.triples()).isSortedAccordingTo(Triple.ORDER);
        assertThat(details.history()).extracting(h -> h.version()).containsExactly(1, 2);
    }

    @Test
    void discoverAgents_filtersByCapabilityProtocolAndText() {
        catalog.importAgent("mcp", Samples.mcp().data());
        catalog.importAgent("lmos", Samples.lmos().data());
        catalog.importAgent("crewai", Samples.crewAi().data());

        assertThat(catalog.discoverAgents(new DiscoveryCriteria("forecasting", null, null)))
                .extracting(s -> s.agentId()).containsExactly("weather-agent");
        assertThat(catalog.discoverAgents(new DiscoveryCriteria("search", null, null)))
                .extracting(s -> s.agentId()).containsExactlyInAnyOrder("research-assistant", "senior-researcher");
        assertThat(catalog.discoverAgents(new DiscoveryCriteria(null, "crewai", null)))
                .extracting(s -> s.agentId()).containsExactly("senior-researcher");
        assertThat(catalog.discoverAgents(new DiscoveryCriteria(null, null, "PAPERS")))
                .extracting(s -> s.agentId()).containsExactlyInAnyOrder("research-assistant", "senior-researcher");
        assertThat(catalog.discoverAgents(null)).hasSize(3);
    }

    @Test
    void traceSubject_followsToolsFromTheAgentNode() {
        catalog.importAgent("mcp", Samples.mcp().data());

        List<Triple> trace = catalog.traceSubject("research-assistant", null, 2).orElseThrow();

        assertThat(trace).anySatisfy(t -> {
            assertThat(t.subject()).isEqualTo(Vocabulary.childIri("research-assistant", "tool", "fetch"));
            assertThat(t.predicate()).isEqualTo(Vocabulary.DESCRIPTION);
        });
        assertThat(catalog.traceSubject("ghost", null, 2)).isEmpty();
    }

    @Test
    void getActivities_listsImportsForTheAgent() {
        catalog.importAgent("mcp", Samples.mcp().data());
        catalog.importAgent("lmos", Samples.lmos().data());

        assertThat(catalog.getActivities("research-assistant")).singleElement()
                .satisfies(a -> assertThat(a.targetFormat()).isEqualTo("mcp"));
    }

    // ------------------------------------------------------------------
    // Export
    // ------------------------------------------------------------------

    @Test
    void exportAgent_ntriples_isLossless() {
        catalog.importAgent("mcp", Samples.mcp().data());

        AgentExport export = catalog.exportAgent("research-assistant", "ntriples", null).orElseThrow();

        assertThat(export.fidelity()).isEqualTo(1.0);
        assertThat((String) export.content())
                .contains("<https://agentbridge.dev/agent/research-assistant>")
                .contains("\"Research Assistant\"");
    }

    @Test
    void exportAgent_json_decodesToTheStoredGraph() {
        catalog.importAgent("lmos", Samples.lmos().data());

        AgentExport export = catalog.exportAgent("weather-agent", "json", 1).orElseThrow();

        assertThat(codec.decode((String) export.content()))
                .isEqualTo(store.getAgentSnapshot("weather-agent", 1).orElseThrow().graph());
    }

    @Test
    void exportAgent_protocol_translatesFromStore() {
        catalog.importAgent("crewai", Samples.crewAi().data());

        AgentExport export = catalog.exportAgent("senior-researcher", "lmos", null).orElseThrow();

        assertThat(export.success()).isTrue();
        assertThat(export.fidelity()).isGreaterThan(0.0);
        @SuppressWarnings("unchecked")
        Map<String, Object> content = (Map<String, Object>) export.content();
        assertThat(content).containsEntry("title", "senior-researcher");
        assertThat(export.warnings()).contains("Agent has no name; using its id 'senior-researcher' as title");
    }

    @Test
    void exportAgent_missingAgentOrVersion_isEmpty() {
        catalog.importAgent("mcp", Samples.mcp().data());

        assertThat(catalog.exportAgent("ghost", "mcp", null)).isEmpty();
        assertThat(catalog.exportAgent("research-assistant", "mcp", 7)).isEmpty();
    }

    // ------------------------------------------------------------------
    // Maintenance
    // ------------------------------------------------------------------

    @Test
    void compact_prunesOldBodiesAndInvalidatesCache() {
        catalog.importAgent("mcp", Samples.mcp().data());
        catalog.importAgent("mcp", Samples.mcp().data());
        orchestrator.translate(new TranslationRequest("research-assistant", "mcp", "crewai", Samples.mcp(),
                new TranslationOptions(true, false, null, false)));
        CacheKey key = new CacheKey("research-assistant", "mcp", "crewai");
        assertThat(cache.get(key)).isPresent();

        CompactionResult result = catalog.compact(1);

        assertThat(result.prunedSnapshots()).isEqualTo(1);
        assertThat(result.affectedAgents()).containsExactly("research-assistant");
        assertThat(cache.get(key)).isEmpty();
        assertThat(catalog.getHistory("research-assistant"))
                .extracting(h -> h.compacted()).containsExactly(true, false);
    }

    @Test
    void getStats_aggregatesStoreCacheAndAdapters() {
        catalog.importAgent("mcp", Samples.mcp().data());
        catalog.importAgent("crewai", Samples.crewAi().data());

        CatalogStats stats = catalog.getStats();

        assertThat(stats.store().agents()).isEqualTo(2);
        assertThat(stats.store().snapshots()).isEqualTo(2);
        assertThat(stats.adapters()).containsOnlyKeys("mcp", "crewai", "lmos");
        assertThat(stats.adapters().get("mcp").calls()).isEqualTo(2);
    }
}
