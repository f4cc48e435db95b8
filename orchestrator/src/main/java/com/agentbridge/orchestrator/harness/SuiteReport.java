package com.agentbridge.orchestrator.harness;

import java.util.List;

/**
 * @param baselineMean             mean fidelity of the stored baseline, null when none was supplied
 * @param regressedAgainstBaseline the suite mean fell below the baseline mean
 */
public record SuiteReport(
        String              name,
        List<HarnessResult> results,
        int                 passed,
        int                 failed,
        double              meanFidelity,
        Double              baselineMean,
        boolean             regressedAgainstBaseline,
        long                durationMs) {

    public SuiteReport {
        results = List.copyOf(results);
    }

    /** CI gate: any failing case or a regression of the mean fails the build. */
    public boolean failsBuild() {
        return failed > 0 || regressedAgainstBaseline;
    }
}
