package com.agentbridge.orchestrator.service;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** Point-in-time view of a migration job. */
public record MigrationStatus(
        UUID                jobId,
        MigrationState      state,
        String              targetFormat,
        int                 total,
        int                 succeeded,
        int                 failed,
        int                 skipped,
        Instant             startedAt,
        Instant             finishedAt,
        List<MigrationItem> items) {

    public MigrationStatus {
        items = List.copyOf(items);
    }

    public boolean finished() {
        return state != MigrationState.RUNNING;
    }
}
