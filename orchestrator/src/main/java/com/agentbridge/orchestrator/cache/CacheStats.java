package com.agentbridge.orchestrator.cache;

public record CacheStats(int size, int capacity, long hits, long misses, long evictions, long expirations) {

    public double hitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }
}
