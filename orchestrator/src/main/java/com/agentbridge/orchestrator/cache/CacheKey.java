package com.agentbridge.orchestrator.cache;

import java.util.Objects;

public record CacheKey(String agentId, String sourceFormat, String targetFormat) {

    public CacheKey {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(sourceFormat, "sourceFormat");
        Objects.requireNonNull(targetFormat, "targetFormat");
    }
}
