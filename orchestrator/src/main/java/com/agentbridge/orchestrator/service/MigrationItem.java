package com.agentbridge.orchestrator.service;

import com.agentbridge.orchestrator.adapter.NativePayload;

import java.util.List;

public record MigrationItem(
        String                 agentId,
        boolean                success,
        double                 fidelity,
        NativePayload          output,
        List<TranslationError> errors) {

    public MigrationItem {
        errors = List.copyOf(errors);
    }
}
