package com.agentbridge.orchestrator.adapter;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Per-direction result of one adapter call.
 *
 * The fidelity score is the adapter's own account of how much survived:
 * <pre>
 *   (mapped + 0.9 * unmapped + 0.5 * lossy) / (mapped + unmapped + lossy)
 * </pre>
 * where "unmapped" fields were preserved in the extension namespace (or the
 * passthrough field) and "lossy" fields lost meaning on the way.
 */
public record TransformReport(
        boolean          success,
        double           fidelityScore,
        List<String>     mappedFields,
        List<FieldIssue> unmappedFields,
        List<FieldIssue> lossyMappings,
        List<String>     warnings,
        List<String>     errors,
        long             durationMs) {

    public static final double EXTENSION_CREDIT = 0.9;
    public static final double LOSSY_CREDIT     = 0.5;

    public TransformReport {
        if (fidelityScore < 0.0 || fidelityScore > 1.0) {
            throw new IllegalArgumentException("fidelityScore out of [0,1]: " + fidelityScore);
        }
        mappedFields   = List.copyOf(mappedFields);
        unmappedFields = List.copyOf(unmappedFields);
        lossyMappings  = List.copyOf(lossyMappings);
        warnings       = List.copyOf(warnings);
        errors         = List.copyOf(errors);
    }

    /** A failed report with zero fidelity. */
    public static TransformReport failed(String error, long durationMs) {
        return new TransformReport(false, 0.0, List.of(), List.of(), List.of(),
                List.of(), List.of(error), durationMs);
    }

    /** Paths of fields whose meaning did not survive. */
    public List<String> lostFields() {
        return lossyMappings.stream().map(FieldIssue::path).distinct().toList();
    }

    public static Builder builder() { return new Builder(); }

    // ------------------------------------------------------------------
    // Builder
    // ------------------------------------------------------------------

    public static final class Builder {

        private final long             startNanos = System.nanoTime();
        private final Set<String>      mapped     = new LinkedHashSet<>();
        private final List<FieldIssue> unmapped   = new ArrayList<>();
        private final List<FieldIssue> lossy      = new ArrayList<>();
        private final List<String>     warnings   = new ArrayList<>();
        private final List<String>     errors     = new ArrayList<>();

        private Builder() {}

        public Builder mapped(String path)                  { mapped.add(path); return this; }
        public Builder unmapped(String path, String reason) { unmapped.add(new FieldIssue(path, reason)); return this; }
        public Builder lossy(String path, String reason)    { lossy.add(new FieldIssue(path, reason)); return this; }
        public Builder warning(String message)              { warnings.add(message); return this; }
        public Builder warnings(List<String> messages)      { warnings.addAll(messages); return this; }
        public Builder error(String message)                { errors.add(message); return this; }

        public double fidelity() {
            int total = mapped.size() + unmapped.size() + lossy.size();
            if (total == 0) return 1.0;
            double kept = mapped.size()
                    + EXTENSION_CREDIT * unmapped.size()
                    + LOSSY_CREDIT * lossy.size();
            return Math.min(1.0, kept / total);
        }

        public TransformReport build() {
            long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
            boolean success = errors.isEmpty();
            return new TransformReport(success, success ? fidelity() : 0.0,
                    new ArrayList<>(mapped), unmapped, lossy, warnings, errors, durationMs);
        }
    }
}
