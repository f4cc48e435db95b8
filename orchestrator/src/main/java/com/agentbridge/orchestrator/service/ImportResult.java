package com.agentbridge.orchestrator.service;

import java.util.List;

/**
 * @param version  snapshot version created, null when the import failed
 * @param fidelity forward fidelity of the native → canonical transform
 */
public record ImportResult(
        boolean                success,
        String                 agentId,
        Integer                version,
        double                 fidelity,
        List<String>           warnings,
        List<TranslationError> errors) {

    public ImportResult {
        warnings = List.copyOf(warnings);
        errors   = List.copyOf(errors);
    }
}
