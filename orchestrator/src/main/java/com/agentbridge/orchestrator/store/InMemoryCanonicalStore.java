package com.agentbridge.orchestrator.store;

import com.agentbridge.orchestrator.canonical.CanonicalGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local store. Each agent has its own lock for writers and a
 * copy-on-write snapshot list, so readers never block and never observe a
 * half-written version.
 */
public class InMemoryCanonicalStore implements CanonicalStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCanonicalStore.class);

    // Graph is null once compaction pruned the body.
    private record Stored(int version, CanonicalGraph graph, SnapshotMetadata metadata) {
        Stored pruned() { return new Stored(version, null, metadata); }
    }

    private static final class AgentHistory {
        final ReentrantLock         lock      = new ReentrantLock();
        final CopyOnWriteArrayList<Stored> snapshots = new CopyOnWriteArrayList<>();
    }

    private final Map<String, AgentHistory>                 agents     = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<TranslationActivity> activities = new CopyOnWriteArrayList<>();

    // ------------------------------------------------------------------
    // Snapshots
    // ------------------------------------------------------------------

    @Override
    public SnapshotRef createAgentSnapshot(String agentId, CanonicalGraph graph, SnapshotMetadata metadata) {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(graph, "graph");
        AgentHistory history = agents.computeIfAbsent(agentId, id -> new AgentHistory());

        history.lock.lock();
        try {
            int version = history.snapshots.size() + 1;
            history.snapshots.add(new Stored(version, graph, metadata));
            log.info("Stored snapshot {} v{} ({} triples, from {})",
                    agentId, version, graph.size(), metadata.sourceFormat());
            return new SnapshotRef(agentId, version);
        } finally {
            history.lock.unlock();
        }
    }

    @Override
    public Optional<AgentSnapshot> getAgentSnapshot(String agentId, Integer version) {
        AgentHistory history = agents.get(agentId);
        if (history == null) return Optional.empty();
        List<Stored> snapshots = history.snapshots;
        if (snapshots.isEmpty()) return Optional.empty();

        int wanted = version == null ? snapshots.size() : version;
        if (wanted < 1 || wanted > snapshots.size()) return Optional.empty();
        return toSnapshot(agentId, snapshots.get(wanted - 1));
    }

    @Override
    public Optional<AgentSnapshot> getAgentSnapshotAsOf(String agentId, Instant instant) {
        AgentHistory history = agents.get(agentId);
        if (history == null) return Optional.empty();
        return history.snapshots.stream()
                .filter(s -> !s.metadata().timestamp().isAfter(instant))
                .max(Comparator.comparingInt(Stored::version))
                .flatMap(s -> toSnapshot(agentId, s));
    }

    @Override
    public List<HistoryEntry> getAgentHistory(String agentId) {
        AgentHistory history = agents.get(agentId);
        if (history == null) return List.of();
        return history.snapshots.stream()
                .map(s -> new HistoryEntry(s.version(), s.metadata().timestamp(),
                        s.metadata().sourceFormat(), s.metadata().fidelity(), s.graph() == null))
                .toList();
    }

    @Override
    public List<AgentSummary> discoverAgents(DiscoveryCriteria criteria) {
        return agents.keySet().stream()
                .sorted()
                .map(id -> getAgentSnapshot(id, null))
                .flatMap(Optional::stream)
                .filter(s -> Discovery.matches(s, criteria))
                .map(Discovery::summarize)
                .toList();
    }

    private static Optional<AgentSnapshot> toSnapshot(String agentId, Stored stored) {
        if (stored.graph() == null) return Optional.empty();
        return Optional.of(new AgentSnapshot(agentId, stored.version(), stored.graph(), stored.metadata()));
    }

    // ------------------------------------------------------------------
    // Activity log
    // ------------------------------------------------------------------

    @Override
    public void recordTranslation(TranslationActivity activity) {
        activities.add(Objects.requireNonNull(activity, "activity"));
    }

    @Override
    public List<TranslationActivity> activities(String agentId) {
        return activities.stream().filter(a -> Objects.equals(agentId, a.agentId())).toList();
    }

    // ------------------------------------------------------------------
    // Maintenance
    // ------------------------------------------------------------------

    @Override
    public CompactionResult compact(RetentionPolicy policy) {
        int pruned = 0;
        List<String> affected = new ArrayList<>();
        for (Map.Entry<String, AgentHistory> e : agents.entrySet()) {
            AgentHistory history = e.getValue();
            history.lock.lock();
            try {
                int cutoff = history.snapshots.size() - policy.keepLatest();
                int prunedHere = 0;
                for (int i = 0; i < cutoff; i++) {
                    Stored s = history.snapshots.get(i);
                    if (s.graph() != null) {
                        history.snapshots.set(i, s.pruned());
                        prunedHere++;
                    }
                }
                if (prunedHere > 0) {
                    pruned += prunedHere;
                    affected.add(e.getKey());
                }
            } finally {
                history.lock.unlock();
            }
        }
        affected.sort(Comparator.naturalOrder());
        log.info("Compaction kept latest {} per agent: pruned {} snapshot(s) across {} agent(s)",
                policy.keepLatest(), pruned, affected.size());
        return new CompactionResult(pruned, affected);
    }

    @Override
    public StoreStats getStats() {
        long snapshots = 0, retained = 0, triples = 0;
        Instant oldest = null, newest = null;
        for (AgentHistory history : agents.values()) {
            for (Stored s : history.snapshots) {
                snapshots++;
                if (s.graph() != null) {
                    retained++;
                    triples += s.graph().size();
                }
                Instant t = s.metadata().timestamp();
                if (oldest == null || t.isBefore(oldest)) oldest = t;
                if (newest == null || t.isAfter(newest)) newest = t;
            }
        }
        return new StoreStats(agents.size(), snapshots, retained, triples, activities.size(), oldest, newest);
    }
}
