package com.agentbridge.orchestrator.repository;

import com.agentbridge.orchestrator.model.Snapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Queries over the agent_snapshots table.
 */
public interface SnapshotRepository extends JpaRepository<Snapshot, UUID> {

    /** Highest committed version for an agent; the next writer takes this + 1. */
    @Query("SELECT MAX(s.version) FROM Snapshot s WHERE s.agentId = :agentId")
    Optional<Integer> findMaxVersion(@Param("agentId") String agentId);

    Optional<Snapshot> findByAgentIdAndVersion(String agentId, int version);

    Optional<Snapshot> findTopByAgentIdOrderByVersionDesc(String agentId);

    Optional<Snapshot> findTopByAgentIdAndTakenAtLessThanEqualOrderByVersionDesc(String agentId, Instant instant);

    List<Snapshot> findByAgentIdOrderByVersionAsc(String agentId);

    /** Latest version of every agent, ordered by agent id. */
    @Query("""
            SELECT s FROM Snapshot s
            WHERE s.version = (SELECT MAX(s2.version) FROM Snapshot s2 WHERE s2.agentId = s.agentId)
            ORDER BY s.agentId ASC
            """)
    List<Snapshot> findLatestPerAgent();

    /** Snapshots still holding a body that fall outside the newest {@code keepLatest} of their agent. */
    @Query("""
            SELECT s FROM Snapshot s
            WHERE s.graphJson IS NOT NULL
              AND s.version <= (SELECT MAX(s2.version) FROM Snapshot s2 WHERE s2.agentId = s.agentId) - :keepLatest
            ORDER BY s.agentId ASC, s.version ASC
            """)
    List<Snapshot> findPrunable(@Param("keepLatest") int keepLatest);

    @Query("SELECT COUNT(DISTINCT s.agentId) FROM Snapshot s")
    long countAgents();

    long countByGraphJsonIsNotNull();

    @Query("SELECT COALESCE(SUM(s.tripleCount), 0) FROM Snapshot s WHERE s.graphJson IS NOT NULL")
    long sumRetainedTriples();

    @Query("SELECT MIN(s.takenAt) FROM Snapshot s")
    Optional<Instant> findOldestTakenAt();

    @Query("SELECT MAX(s.takenAt) FROM Snapshot s")
    Optional<Instant> findNewestTakenAt();
}
