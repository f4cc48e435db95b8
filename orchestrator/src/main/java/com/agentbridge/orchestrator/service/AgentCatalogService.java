package com.agentbridge.orchestrator.service;

import com.agentbridge.orchestrator.adapter.NativePayload;
import com.agentbridge.orchestrator.cache.TranslationCache;
import com.agentbridge.orchestrator.canonical.CanonicalGraph;
import com.agentbridge.orchestrator.canonical.GraphTraversal;
import com.agentbridge.orchestrator.canonical.Iri;
import com.agentbridge.orchestrator.canonical.NTriplesWriter;
import com.agentbridge.orchestrator.canonical.Triple;
import com.agentbridge.orchestrator.canonical.Vocabulary;
import com.agentbridge.orchestrator.error.AdapterNotFoundException;
import com.agentbridge.orchestrator.registry.AdapterRegistry;
import com.agentbridge.orchestrator.registry.AdapterUsage;
import com.agentbridge.orchestrator.store.AgentSnapshot;
import com.agentbridge.orchestrator.store.AgentSummary;
import com.agentbridge.orchestrator.store.CanonicalStore;
import com.agentbridge.orchestrator.store.CompactionResult;
import com.agentbridge.orchestrator.store.Discovery;
import com.agentbridge.orchestrator.store.DiscoveryCriteria;
import com.agentbridge.orchestrator.store.GraphCodec;
import com.agentbridge.orchestrator.store.HistoryEntry;
import com.agentbridge.orchestrator.store.RetentionPolicy;
import com.agentbridge.orchestrator.store.TranslationActivity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Store-facing API consumed by CLI and dashboard tooling (and the REST
 * layer): list, inspect, import, export and discover stored agents.
 */
public class AgentCatalogService {

    private static final Logger log = LoggerFactory.getLogger(AgentCatalogService.class);

    public static final String FORMAT_NTRIPLES = "ntriples";
    public static final String FORMAT_JSON     = "json";

    private final CanonicalStore                        store;
    private final TranslationOrchestrator               orchestrator;
    private final AdapterRegistry                       registry;
    private final TranslationCache<TranslationResponse> cache;
    private final GraphCodec                            codec;

    public AgentCatalogService(CanonicalStore store,
                               TranslationOrchestrator orchestrator,
                               AdapterRegistry registry,
                               TranslationCache<TranslationResponse> cache,
                               GraphCodec codec) {
        this.store        = store;
        this.orchestrator = orchestrator;
        this.registry     = registry;
        this.cache        = cache;
        this.codec        = codec;
    }

    // ------------------------------------------------------------------
    // Read
    // ------------------------------------------------------------------

    public List<AgentSummary> listAgents() {
        return store.listAgents();
    }

    public List<AgentSummary> discoverAgents(DiscoveryCriteria criteria) {
        return store.discoverAgents(criteria == null ? DiscoveryCriteria.any() : criteria);
    }

    public Optional<AgentDetails> getAgent(String agentId) {
        return store.getAgentSnapshot(agentId, null).map(s -> new AgentDetails(
                Discovery.summarize(s),
                s.metadata(),
                sorted(s.graph()),
                store.getAgentHistory(agentId)));
    }

    public List<HistoryEntry> getHistory(String agentId) {
        return store.getAgentHistory(agentId);
    }

    public List<TranslationActivity> getActivities(String agentId) {
        return store.activities(agentId);
    }

    /**
     * Triples describing {@code subject} and everything reachable from it
     * within {@code maxDepth} hops in the agent's latest snapshot.
     *
     * @param subject null for the agent node itself
     */
    public Optional<List<Triple>> traceSubject(String agentId, String subject, int maxDepth) {
        Iri start = subject == null ? Vocabulary.agentIri(agentId) : Iri.of(subject);
        return store.getAgentSnapshot(agentId, null)
                .map(s -> GraphTraversal.describe(s.graph(), start, maxDepth));
    }

    public CatalogStats getStats() {
        Map<String, AdapterUsage> usage = new LinkedHashMap<>();
        registry.protocolIds().forEach(id -> usage.put(id, registry.usage(id)));
        return new CatalogStats(store.getStats(), cache.stats(), usage, registry.compatibility().entries());
    }

    // ------------------------------------------------------------------
    // Import / export
    // ------------------------------------------------------------------

    /**
     * Translate a native payload into a new snapshot.
     *
     * @param agentId optional explicit id; derived from the native identity otherwise
     * @throws AdapterNotFoundException if {@code sourceFormat} has no enabled adapter
     */
    public ImportResult importAgent(String sourceFormat, Map<String, Object> data, String agentId) {
        TranslationResponse response = orchestrator.translate(new TranslationRequest(agentId, sourceFormat,
                sourceFormat, NativePayload.of(sourceFormat, data), new TranslationOptions(false, true, null, false)));
        double forward = response.forwardReport() == null ? 0.0 : response.forwardReport().fidelityScore();
        boolean stored = response.snapshotVersion() != null;
        if (stored) {
            log.info("Imported {} from {} as v{}", response.agentId(), sourceFormat, response.snapshotVersion());
        }
        return new ImportResult(stored, response.agentId(), response.snapshotVersion(), forward,
                response.warnings(), response.errors());
    }

    public ImportResult importAgent(String sourceFormat, Map<String, Object> data) {
        return importAgent(sourceFormat, data, null);
    }

    /**
     * Render a stored snapshot as {@code ntriples}, {@code json} (the store's
     * graph encoding) or any registered protocol.
     *
     * @param version null for the latest
     * @return empty when the agent or version does not exist
     * @throws AdapterNotFoundException for an unknown protocol format
     */
    public Optional<AgentExport> exportAgent(String agentId, String format, Integer version) {
        Optional<AgentSnapshot> snapshot = store.getAgentSnapshot(agentId, version);
        if (snapshot.isEmpty()) return Optional.empty();
        AgentSnapshot s = snapshot.get();

        if (FORMAT_NTRIPLES.equals(format)) {
            return Optional.of(new AgentExport(agentId, s.version(), format,
                    NTriplesWriter.write(s.graph()), 1.0, List.of(), List.of()));
        }
        if (FORMAT_JSON.equals(format)) {
            return Optional.of(new AgentExport(agentId, s.version(), format,
                    codec.encode(s.graph()), 1.0, List.of(), List.of()));
        }

        TranslationResponse response = orchestrator.translateFromStore(agentId, format, s.version());
        Object content = response.targetData() == null ? null : response.targetData().data();
        return Optional.of(new AgentExport(agentId, s.version(), format, content,
                response.totalFidelity(), response.warnings(), response.errors()));
    }

    // ------------------------------------------------------------------
    // Maintenance
    // ------------------------------------------------------------------

    /** Prune superseded snapshot bodies and drop cached translations of the affected agents. */
    public CompactionResult compact(int keepLatest) {
        CompactionResult result = store.compact(new RetentionPolicy(keepLatest));
        result.affectedAgents().forEach(cache::invalidate);
        return result;
    }

    private static List<Triple> sorted(CanonicalGraph graph) {
        return graph.triples().stream().sorted(Triple.ORDER).toList();
    }
}
