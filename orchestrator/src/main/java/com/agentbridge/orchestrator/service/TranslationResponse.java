package com.agentbridge.orchestrator.service;

import com.agentbridge.orchestrator.adapter.NativePayload;
import com.agentbridge.orchestrator.adapter.TransformReport;

import java.util.List;

/**
 * Outcome of one translation. Data-quality failures arrive here with
 * {@code success=false} and populated {@code errors}, never as exceptions.
 *
 * @param snapshotVersion version created when the request asked to persist, else null
 * @param fromCache       true when served from the translation cache without adapter calls
 */
public record TranslationResponse(
        boolean                success,
        String                 agentId,
        String                 sourceFormat,
        String                 targetFormat,
        NativePayload          targetData,
        TransformReport        forwardReport,
        TransformReport        reverseReport,
        double                 totalFidelity,
        Integer                snapshotVersion,
        List<String>           warnings,
        List<TranslationError> errors,
        boolean                fromCache,
        long                   durationMs) {

    public TranslationResponse {
        warnings = List.copyOf(warnings);
        errors   = List.copyOf(errors);
    }

    public TranslationResponse asCached() {
        return new TranslationResponse(success, agentId, sourceFormat, targetFormat, targetData,
                forwardReport, reverseReport, totalFidelity, snapshotVersion, warnings, errors, true, durationMs);
    }
}
