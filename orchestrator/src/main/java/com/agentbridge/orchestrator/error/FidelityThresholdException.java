package com.agentbridge.orchestrator.error;

import java.util.Locale;

public class FidelityThresholdException extends BridgeException {

    private final double fidelity;
    private final double minimum;

    public FidelityThresholdException(double fidelity, double minimum) {
        super(ErrorCategory.FIDELITY_THRESHOLD, String.format(Locale.ROOT,
                "Forward fidelity %.4f is below the accepted minimum %.4f", fidelity, minimum));
        this.fidelity = fidelity;
        this.minimum  = minimum;
    }

    public double getFidelity() { return fidelity; }
    public double getMinimum()  { return minimum; }
}
