package com.agentbridge.orchestrator.adapter;

/**
 * Per-call options passed to an adapter.
 *
 * @param agentId explicit agent id; when null the adapter derives one from the native identity
 * @param strict  treat validation warnings as errors
 */
public record TransformOptions(String agentId, boolean strict) {

    private static final TransformOptions DEFAULTS = new TransformOptions(null, false);

    public static TransformOptions defaults() { return DEFAULTS; }

    public static TransformOptions forAgent(String agentId) {
        return new TransformOptions(agentId, false);
    }
}
