package com.agentbridge.orchestrator.service;

import com.agentbridge.orchestrator.cache.CacheStats;
import com.agentbridge.orchestrator.registry.AdapterUsage;
import com.agentbridge.orchestrator.registry.CompatibilityMatrix;
import com.agentbridge.orchestrator.store.StoreStats;

import java.util.List;
import java.util.Map;

public record CatalogStats(
        StoreStats                      store,
        CacheStats                      cache,
        Map<String, AdapterUsage>       adapters,
        List<CompatibilityMatrix.Entry> compatibility) {}
