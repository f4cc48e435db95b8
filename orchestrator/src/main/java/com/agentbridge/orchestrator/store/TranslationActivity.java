package com.agentbridge.orchestrator.store;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Append-only audit record of one translation attempt, successful or not.
 * This is the durable contract read by external observability tooling.
 */
public record TranslationActivity(
        UUID         id,
        Instant      timestamp,
        String       agentId,
        String       sourceFormat,
        String       targetFormat,
        double       fidelityScore,
        List<String> lostFields,
        long         durationMs,
        boolean      success) {

    public TranslationActivity {
        lostFields = List.copyOf(lostFields);
    }
}
