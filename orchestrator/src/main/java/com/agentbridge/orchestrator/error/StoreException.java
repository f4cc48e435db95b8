package com.agentbridge.orchestrator.error;

/**
 * Thrown when the canonical store cannot complete an operation,
 * including a version conflict that survived the internal retry.
 */
public class StoreException extends BridgeException {

    public StoreException(String message) {
        super(ErrorCategory.STORE, message);
    }

    public StoreException(String message, Throwable cause) {
        super(ErrorCategory.STORE, message, cause);
    }
}
