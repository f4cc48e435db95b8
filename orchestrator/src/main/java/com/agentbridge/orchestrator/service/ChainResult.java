package com.agentbridge.orchestrator.service;

import com.agentbridge.orchestrator.adapter.NativePayload;

import java.util.List;

/**
 * Result of a multi-hop translation.
 *
 * @param cumulativeFidelity product of every completed hop's total fidelity
 * @param hops               responses of the hops that ran, in order
 */
public record ChainResult(
        boolean                   success,
        String                    agentId,
        List<String>              formats,
        NativePayload             finalData,
        double                    cumulativeFidelity,
        Integer                   snapshotVersion,
        List<TranslationResponse> hops,
        List<String>              warnings,
        List<TranslationError>    errors) {

    public ChainResult {
        formats  = List.copyOf(formats);
        hops     = List.copyOf(hops);
        warnings = List.copyOf(warnings);
        errors   = List.copyOf(errors);
    }
}
