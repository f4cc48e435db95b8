package com.agentbridge.orchestrator.service;

import com.agentbridge.orchestrator.canonical.Triple;
import com.agentbridge.orchestrator.store.AgentSummary;
import com.agentbridge.orchestrator.store.HistoryEntry;
import com.agentbridge.orchestrator.store.SnapshotMetadata;

import java.util.List;

/** Latest snapshot of an agent with its version history. */
public record AgentDetails(
        AgentSummary       summary,
        SnapshotMetadata   metadata,
        List<Triple>       triples,
        List<HistoryEntry> history) {

    public AgentDetails {
        triples = List.copyOf(triples);
        history = List.copyOf(history);
    }
}
