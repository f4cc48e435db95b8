package com.agentbridge.orchestrator.error;

public class CacheException extends BridgeException {
    public CacheException(String message, Throwable cause) {
        super(ErrorCategory.CACHE, message, cause);
    }
}
