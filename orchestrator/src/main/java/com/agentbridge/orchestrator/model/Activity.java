package com.agentbridge.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Append-only translation audit row. Never updated, never compacted.
 *
 * DB table: translation_activities  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "translation_activities")
public class Activity {

    // Assigned by the orchestrator so the id is known before the row is written.
    @Id
    private UUID id;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    @Column(name = "agent_id")
    private String agentId;

    @Column(name = "source_format", nullable = false)
    private String sourceFormat;

    @Column(name = "target_format", nullable = false)
    private String targetFormat;

    @Column(nullable = false)
    private double fidelity;

    // JSON array of field paths.
    @Column(name = "lost_fields", columnDefinition = "TEXT", nullable = false)
    private String lostFields;

    @Column(name = "duration_ms", nullable = false)
    private long durationMs;

    @Column(nullable = false)
    private boolean success;

    protected Activity() {}   // required by JPA

    public Activity(UUID id, Instant occurredAt, String agentId, String sourceFormat, String targetFormat,
                    double fidelity, String lostFields, long durationMs, boolean success) {
        this.id           = id;
        this.occurredAt   = occurredAt;
        this.agentId      = agentId;
        this.sourceFormat = sourceFormat;
        this.targetFormat = targetFormat;
        this.fidelity     = fidelity;
        this.lostFields   = lostFields;
        this.durationMs   = durationMs;
        this.success      = success;
    }

    public UUID    getId()           { return id; }
    public Instant getOccurredAt()   { return occurredAt; }
    public String  getAgentId()      { return agentId; }
    public String  getSourceFormat() { return sourceFormat; }
    public String  getTargetFormat() { return targetFormat; }
    public double  getFidelity()     { return fidelity; }
    public String  getLostFields()   { return lostFields; }
    public long    getDurationMs()   { return durationMs; }
    public boolean isSuccess()       { return success; }
}
