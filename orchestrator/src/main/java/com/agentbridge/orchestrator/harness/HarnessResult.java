package com.agentbridge.orchestrator.harness;

import java.util.List;

/**
 * @param fidelity        round trip: overall fidelity; cross-framework: forward × reverse
 * @param exactMatch      the reconstructed graph equals the original triple for triple
 * @param lostPredicates  predicates present in the original graph and missing afterwards
 * @param failureMessage  null when the case passed
 */
public record HarnessResult(
        String       name,
        String       sourceProtocol,
        String       targetProtocol,
        double       forwardFidelity,
        double       reverseFidelity,
        double       fidelity,
        double       minFidelity,
        boolean      exactMatch,
        boolean      passed,
        List<String> lostPredicates,
        long         durationMs,
        String       failureMessage) {

    public HarnessResult {
        lostPredicates = List.copyOf(lostPredicates);
    }
}
