package com.agentbridge.orchestrator.store;

public record SnapshotRef(String agentId, int version) {}
