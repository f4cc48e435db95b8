package com.agentbridge.orchestrator.store;

import java.time.Instant;

public record StoreStats(
        long    agents,
        long    snapshots,
        long    retainedSnapshots,
        long    triples,
        long    activities,
        Instant oldestSnapshot,
        Instant newestSnapshot) {}
