package com.agentbridge.orchestrator.store;

/** Keep the bodies of the newest {@code keepLatest} snapshots per agent. */
public record RetentionPolicy(int keepLatest) {

    public RetentionPolicy {
        if (keepLatest < 1) {
            throw new IllegalArgumentException("keepLatest must be >= 1 (the latest snapshot is always kept)");
        }
    }
}
