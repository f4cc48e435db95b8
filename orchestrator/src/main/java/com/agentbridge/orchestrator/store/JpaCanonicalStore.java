package com.agentbridge.orchestrator.store;

import com.agentbridge.orchestrator.canonical.CanonicalGraph;
import com.agentbridge.orchestrator.error.StoreException;
import com.agentbridge.orchestrator.model.Activity;
import com.agentbridge.orchestrator.model.Snapshot;
import com.agentbridge.orchestrator.repository.ActivityRepository;
import com.agentbridge.orchestrator.repository.SnapshotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * PostgreSQL-backed store (tables from Flyway V1).
 *
 * <p>Version assignment: within this process the per-agent lock is held
 * across the whole transaction, commit included, so local writers never
 * race. Writers in other processes are caught by the unique
 * (agent_id, version) constraint; the loser retries once with a fresh
 * MAX(version) lookup and then gives up with a {@link StoreException}.
 */
public class JpaCanonicalStore implements CanonicalStore {

    private static final Logger log = LoggerFactory.getLogger(JpaCanonicalStore.class);

    private static final int MAX_ATTEMPTS = 2;

    private final SnapshotRepository         snapshots;
    private final ActivityRepository         activities;
    private final TransactionTemplate        tx;
    private final GraphCodec                 codec;
    private final Clock                      clock;
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public JpaCanonicalStore(SnapshotRepository snapshots,
                             ActivityRepository activities,
                             TransactionTemplate tx,
                             GraphCodec codec,
                             Clock clock) {
        this.snapshots  = snapshots;
        this.activities = activities;
        this.tx         = tx;
        this.codec      = codec;
        this.clock      = clock;
    }

    // ------------------------------------------------------------------
    // Snapshots
    // ------------------------------------------------------------------

    @Override
    public SnapshotRef createAgentSnapshot(String agentId, CanonicalGraph graph, SnapshotMetadata metadata) {
        Objects.requireNonNull(agentId, "agentId");
        String json = codec.encode(graph);
        ReentrantLock lock = locks.computeIfAbsent(agentId, id -> new ReentrantLock());

        lock.lock();
        try {
            for (int attempt = 1; ; attempt++) {
                try {
                    SnapshotRef ref = tx.execute(status -> {
                        int next = snapshots.findMaxVersion(agentId).orElse(0) + 1;
                        snapshots.saveAndFlush(new Snapshot(agentId, next, metadata.sourceFormat(),
                                metadata.fidelity(), metadata.timestamp(), graph.size(), json));
                        return new SnapshotRef(agentId, next);
                    });
                    log.info("Stored snapshot {} v{} ({} triples, from {})",
                            agentId, ref.version(), graph.size(), metadata.sourceFormat());
                    return ref;
                } catch (DataIntegrityViolationException e) {
                    if (attempt >= MAX_ATTEMPTS) {
                        throw new StoreException("Version conflict for agent '" + agentId
                                + "' persisted after " + attempt + " attempts", e);
                    }
                    log.warn("Version conflict for agent {} (attempt {}); retrying with a fresh version",
                            agentId, attempt);
                } catch (DataAccessException e) {
                    throw new StoreException("Cannot store snapshot for agent '" + agentId + "'", e);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<AgentSnapshot> getAgentSnapshot(String agentId, Integer version) {
        return read(() -> (version == null
                ? snapshots.findTopByAgentIdOrderByVersionDesc(agentId)
                : snapshots.findByAgentIdAndVersion(agentId, version))
                .flatMap(this::toSnapshot));
    }

    @Override
    public Optional<AgentSnapshot> getAgentSnapshotAsOf(String agentId, Instant instant) {
        return read(() -> snapshots.findTopByAgentIdAndTakenAtLessThanEqualOrderByVersionDesc(agentId, instant)
                .flatMap(this::toSnapshot));
    }

    @Override
    public List<HistoryEntry> getAgentHistory(String agentId) {
        return read(() -> snapshots.findByAgentIdOrderByVersionAsc(agentId).stream()
                .map(s -> new HistoryEntry(s.getVersion(), s.getTakenAt(), s.getSourceFormat(),
                        s.getFidelity(), s.isCompacted()))
                .toList());
    }

    @Override
    public List<AgentSummary> discoverAgents(DiscoveryCriteria criteria) {
        return read(() -> snapshots.findLatestPerAgent().stream()
                .map(this::toSnapshot)
                .flatMap(Optional::stream)
                .filter(s -> Discovery.matches(s, criteria))
                .map(Discovery::summarize)
                .toList());
    }

    private Optional<AgentSnapshot> toSnapshot(Snapshot row) {
        if (row.isCompacted()) return Optional.empty();
        return Optional.of(new AgentSnapshot(row.getAgentId(), row.getVersion(), codec.decode(row.getGraphJson()),
                new SnapshotMetadata(row.getTakenAt(), row.getSourceFormat(), row.getFidelity())));
    }

    // ------------------------------------------------------------------
    // Activity log
    // ------------------------------------------------------------------

    @Override
    public void recordTranslation(TranslationActivity a) {
        Activity row = new Activity(a.id(), a.timestamp(), a.agentId(), a.sourceFormat(), a.targetFormat(),
                a.fidelityScore(), codec.encodeList(a.lostFields()), a.durationMs(), a.success());
        try {
            activities.save(row);
        } catch (DataAccessException e) {
            throw new StoreException("Cannot append translation activity " + a.id(), e);
        }
    }

    @Override
    public List<TranslationActivity> activities(String agentId) {
        return read(() -> activities.findByAgentIdOrderByOccurredAtAsc(agentId).stream()
                .map(r -> new TranslationActivity(r.getId(), r.getOccurredAt(), r.getAgentId(),
                        r.getSourceFormat(), r.getTargetFormat(), r.getFidelity(),
                        codec.decodeList(r.getLostFields()), r.getDurationMs(), r.isSuccess()))
                .toList());
    }

    // ------------------------------------------------------------------
    // Maintenance
    // ------------------------------------------------------------------

    @Override
    public CompactionResult compact(RetentionPolicy policy) {
        try {
            CompactionResult result = tx.execute(status -> {
                Instant now = clock.instant();
                List<Snapshot> prunable = snapshots.findPrunable(policy.keepLatest());
                TreeSet<String> affected = new TreeSet<>();
                for (Snapshot s : prunable) {
                    s.prune(now);
                    affected.add(s.getAgentId());
                }
                snapshots.saveAll(prunable);
                return new CompactionResult(prunable.size(), new ArrayList<>(affected));
            });
            log.info("Compaction kept latest {} per agent: pruned {} snapshot(s) across {} agent(s)",
                    policy.keepLatest(), result.prunedSnapshots(), result.affectedAgents().size());
            return result;
        } catch (DataAccessException e) {
            throw new StoreException("Compaction failed", e);
        }
    }

    @Override
    public StoreStats getStats() {
        return read(() -> new StoreStats(
                snapshots.countAgents(),
                snapshots.count(),
                snapshots.countByGraphJsonIsNotNull(),
                snapshots.sumRetainedTriples(),
                activities.count(),
                snapshots.findOldestTakenAt().orElse(null),
                snapshots.findNewestTakenAt().orElse(null)));
    }

    private static <T> T read(Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            throw new StoreException("Store read failed: " + e.getMostSpecificCause().getMessage(), e);
        }
    }
}
