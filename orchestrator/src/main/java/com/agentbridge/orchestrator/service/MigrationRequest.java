package com.agentbridge.orchestrator.service;

import java.util.List;

/**
 * @param agentIds        agents to migrate; empty means every stored agent
 * @param targetFormat    protocol every agent is exported to
 * @param workers         worker threads for this job; null uses the configured default
 * @param continueOnError false cancels the remaining agents after the first failure
 */
public record MigrationRequest(List<String> agentIds, String targetFormat, Integer workers, boolean continueOnError) {

    public MigrationRequest {
        if (targetFormat == null || targetFormat.isBlank()) {
            throw new IllegalArgumentException("targetFormat is required");
        }
        if (workers != null && workers < 1) {
            throw new IllegalArgumentException("workers must be positive");
        }
        agentIds = agentIds == null ? List.of() : List.copyOf(agentIds);
    }
}
