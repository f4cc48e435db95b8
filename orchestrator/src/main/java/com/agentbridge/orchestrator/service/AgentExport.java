package com.agentbridge.orchestrator.service;

import java.util.List;

/**
 * A stored agent rendered in some format.
 *
 * @param content  native map for protocol formats; text for {@code ntriples} and {@code json}
 * @param fidelity reverse fidelity for protocol formats, 1.0 for lossless graph serializations
 */
public record AgentExport(
        String                 agentId,
        int                    version,
        String                 format,
        Object                 content,
        double                 fidelity,
        List<String>           warnings,
        List<TranslationError> errors) {

    public AgentExport {
        warnings = List.copyOf(warnings);
        errors   = List.copyOf(errors);
    }

    public boolean success() {
        return errors.isEmpty();
    }
}
