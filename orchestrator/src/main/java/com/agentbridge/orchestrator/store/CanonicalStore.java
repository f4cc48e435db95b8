package com.agentbridge.orchestrator.store;

import com.agentbridge.orchestrator.canonical.CanonicalGraph;
import com.agentbridge.orchestrator.error.StoreException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Versioned, append-only storage of canonical graphs plus the translation
 * activity log.
 *
 * <p>Writers for one agent id are serialized so versions are 1, 2, 3 … with
 * no gaps and no duplicates; writers for different agents do not contend.
 * Readers only ever see committed snapshots. Snapshots are never mutated;
 * {@link #compact} prunes superseded bodies and leaves the activity log alone.
 */
public interface CanonicalStore {

    /** @throws StoreException if the snapshot cannot be written */
    SnapshotRef createAgentSnapshot(String agentId, CanonicalGraph graph, SnapshotMetadata metadata);

    /**
     * @param version null for the latest
     * @return empty if the agent or version is unknown, or the body was compacted away
     */
    Optional<AgentSnapshot> getAgentSnapshot(String agentId, Integer version);

    /** Latest snapshot taken at or before {@code instant}. */
    Optional<AgentSnapshot> getAgentSnapshotAsOf(String agentId, Instant instant);

    /** Ascending by version; empty for unknown agents. */
    List<HistoryEntry> getAgentHistory(String agentId);

    List<AgentSummary> discoverAgents(DiscoveryCriteria criteria);

    default List<AgentSummary> listAgents() {
        return discoverAgents(DiscoveryCriteria.any());
    }

    void recordTranslation(TranslationActivity activity);

    /** Activities for one agent in the order they were recorded. */
    List<TranslationActivity> activities(String agentId);

    CompactionResult compact(RetentionPolicy policy);

    StoreStats getStats();
}
