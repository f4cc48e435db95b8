package com.agentbridge.orchestrator.error;

/**
 * Failure classes reported by the bridge.
 *
 * ADAPTER_NOT_FOUND  : fatal, never retried.
 * TRANSFORM          : malformed or incomplete native/canonical input.
 * FIDELITY_THRESHOLD : data-quality rejection; nothing is persisted.
 * STORE              : storage failure (e.g. version conflict after the internal retry).
 * TIMEOUT            : an asynchronous adapter stage missed its deadline; retryable.
 * CACHE              : non-fatal; callers degrade to a cache miss.
 */
public enum ErrorCategory {
    ADAPTER_NOT_FOUND,
    TRANSFORM,
    FIDELITY_THRESHOLD,
    STORE,
    TIMEOUT,
    CACHE
}
