package com.agentbridge.orchestrator.service;

import com.agentbridge.orchestrator.error.BridgeException;
import com.agentbridge.orchestrator.error.ErrorCategory;

public record TranslationError(ErrorCategory category, String message) {

    public static TranslationError of(BridgeException e) {
        return new TranslationError(e.getCategory(), e.getMessage());
    }
}
