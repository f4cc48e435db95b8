package com.agentbridge.orchestrator.error;

/**
 * Base class for every failure raised by the bridge.
 *
 * Unchecked so callers only catch it when they have a specific recovery
 * strategy. The orchestrator converts data-quality failures into response
 * errors; only adapter and store unavailability propagate to the caller.
 */
public class BridgeException extends RuntimeException {

    private final ErrorCategory category;

    public BridgeException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    public BridgeException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() { return category; }
}
