package com.agentbridge.orchestrator.adapter;

import com.agentbridge.orchestrator.canonical.CanonicalGraph;

/** Output of {@link ProtocolAdapter#toCanonical}. */
public record CanonicalResult(CanonicalGraph graph, String agentId, TransformReport report) {}
