package com.agentbridge.orchestrator.service;

/**
 * @param useCache        serve and store results in the translation cache (needs an agent id)
 * @param persist         store the canonical graph as a new snapshot
 * @param maxFidelityLoss reject the translation when forward fidelity drops below 1 - this; null disables the check
 * @param strict          treat source validation warnings as errors
 */
public record TranslationOptions(boolean useCache, boolean persist, Double maxFidelityLoss, boolean strict) {

    public TranslationOptions {
        if (maxFidelityLoss != null && (maxFidelityLoss < 0.0 || maxFidelityLoss > 1.0)) {
            throw new IllegalArgumentException("maxFidelityLoss must be within [0,1]: " + maxFidelityLoss);
        }
    }

    public static TranslationOptions defaults() {
        return new TranslationOptions(false, false, null, false);
    }

    public TranslationOptions withPersist(boolean value) {
        return new TranslationOptions(useCache, value, maxFidelityLoss, strict);
    }
}
