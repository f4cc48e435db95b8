package com.agentbridge.orchestrator.store;

import java.time.Instant;
import java.util.List;

public record AgentSummary(
        String       agentId,
        String       name,
        int          latestVersion,
        String       sourceFormat,
        Instant      updatedAt,
        List<String> capabilities) {

    public AgentSummary {
        capabilities = List.copyOf(capabilities);
    }
}
