package com.agentbridge.orchestrator.store;

import java.time.Instant;
import java.util.Objects;

/**
 * @param timestamp    when the snapshot was taken
 * @param sourceFormat protocol id the graph was translated from
 * @param fidelity     forward fidelity of that translation
 */
public record SnapshotMetadata(Instant timestamp, String sourceFormat, double fidelity) {

    public SnapshotMetadata {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(sourceFormat, "sourceFormat");
    }
}
