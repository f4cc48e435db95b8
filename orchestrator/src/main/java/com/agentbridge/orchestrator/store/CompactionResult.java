package com.agentbridge.orchestrator.store;

import java.util.List;

public record CompactionResult(int prunedSnapshots, List<String> affectedAgents) {

    public CompactionResult {
        affectedAgents = List.copyOf(affectedAgents);
    }
}
