package com.agentbridge.orchestrator.error;

/**
 * Thrown by an adapter when native or canonical input cannot be translated,
 * e.g. the identity field is missing or the graph has no Agent node.
 */
public class TransformException extends BridgeException {

    public TransformException(String message) {
        super(ErrorCategory.TRANSFORM, message);
    }

    public TransformException(String message, Throwable cause) {
        super(ErrorCategory.TRANSFORM, message, cause);
    }
}
