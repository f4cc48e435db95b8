package com.agentbridge.orchestrator.store;

import com.agentbridge.orchestrator.canonical.CanonicalGraph;

/** Immutable, versioned canonical graph of one agent. */
public record AgentSnapshot(String agentId, int version, CanonicalGraph graph, SnapshotMetadata metadata) {}
