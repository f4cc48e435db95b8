package com.agentbridge.orchestrator.error;

import java.time.Duration;

/**
 * The asynchronous source stage of a translation did not finish in time.
 * No store mutation has happened when this is raised, so callers may retry.
 */
public class TranslationTimeoutException extends BridgeException {
    public TranslationTimeoutException(String operation, Duration timeout) {
        super(ErrorCategory.TIMEOUT, operation + " timed out after " + timeout.toMillis() + " ms");
    }
}
