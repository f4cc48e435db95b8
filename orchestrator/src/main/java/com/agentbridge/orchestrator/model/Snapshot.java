package com.agentbridge.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One stored version of an agent's canonical graph.
 *
 * The (agent_id, version) pair is unique; a concurrent writer that picked the
 * same version fails on the constraint and retries with a fresh lookup.
 * graph_json is null once compaction pruned the body.
 *
 * DB table: agent_snapshots  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "agent_snapshots",
       uniqueConstraints = @UniqueConstraint(name = "uq_agent_version", columnNames = {"agent_id", "version"}))
public class Snapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "agent_id", nullable = false)
    private String agentId;

    @Column(nullable = false)
    private int version;

    @Column(name = "source_format", nullable = false)
    private String sourceFormat;

    @Column(nullable = false)
    private double fidelity;

    @Column(name = "taken_at", nullable = false, updatable = false)
    private Instant takenAt;

    @Column(name = "triple_count", nullable = false)
    private int tripleCount;

    // Triples as a JSON array of {s, p, o, datatype?} objects.
    @Column(name = "graph_json", columnDefinition = "TEXT")
    private String graphJson;

    @Column(name = "compacted_at")
    private Instant compactedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Snapshot() {}   // required by JPA

    public Snapshot(String agentId, int version, String sourceFormat, double fidelity,
                    Instant takenAt, int tripleCount, String graphJson) {
        this.agentId      = agentId;
        this.version      = version;
        this.sourceFormat = sourceFormat;
        this.fidelity     = fidelity;
        this.takenAt      = takenAt;
        this.tripleCount  = tripleCount;
        this.graphJson    = graphJson;
    }

    // ------------------------------------------------------------------
    // Getters / compaction
    // ------------------------------------------------------------------

    public UUID    getId()           { return id; }
    public String  getAgentId()      { return agentId; }
    public int     getVersion()      { return version; }
    public String  getSourceFormat() { return sourceFormat; }
    public double  getFidelity()     { return fidelity; }
    public Instant getTakenAt()      { return takenAt; }
    public int     getTripleCount()  { return tripleCount; }
    public String  getGraphJson()    { return graphJson; }
    public Instant getCompactedAt()  { return compactedAt; }

    public boolean isCompacted() { return graphJson == null; }

    public void prune(Instant at) {
        this.graphJson   = null;
        this.compactedAt = at;
    }
}
