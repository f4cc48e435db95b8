package com.agentbridge.orchestrator.registry;

/**
 * Running usage figures for one adapter or one adapter pair. Only the count
 * and the mean are kept, never the individual samples.
 */
public record AdapterUsage(long calls, double meanFidelity) {

    public static final AdapterUsage NONE = new AdapterUsage(0, 0.0);

    public AdapterUsage record(double fidelity) {
        long n = calls + 1;
        return new AdapterUsage(n, meanFidelity + (fidelity - meanFidelity) / n);
    }
}
