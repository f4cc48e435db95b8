package com.agentbridge.orchestrator.adapter;

/** Output of {@link ProtocolAdapter#fromCanonical}. */
public record NativeResult(NativePayload payload, TransformReport report) {}
