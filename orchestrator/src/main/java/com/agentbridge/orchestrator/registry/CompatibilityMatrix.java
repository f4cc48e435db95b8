package com.agentbridge.orchestrator.registry;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Observed end-to-end fidelity per (source, target) protocol pair, fed by
 * every completed translation.
 */
public class CompatibilityMatrix {

    public record Pair(String source, String target) {}

    public record Entry(String source, String target, long translations, double meanFidelity) {}

    private final Map<Pair, AdapterUsage> pairs = new ConcurrentHashMap<>();

    public void record(String source, String target, double fidelity) {
        pairs.merge(new Pair(source, target), AdapterUsage.NONE.record(fidelity),
                (old, ignored) -> old.record(fidelity));
    }

    public Optional<Entry> get(String source, String target) {
        return Optional.ofNullable(pairs.get(new Pair(source, target)))
                .map(u -> new Entry(source, target, u.calls(), u.meanFidelity()));
    }

    /** All observed pairs, best mean fidelity first. */
    public List<Entry> entries() {
        return pairs.entrySet().stream()
                .map(e -> new Entry(e.getKey().source(), e.getKey().target(),
                        e.getValue().calls(), e.getValue().meanFidelity()))
                .sorted(Comparator.comparingDouble(Entry::meanFidelity).reversed()
                        .thenComparing(Entry::source)
                        .thenComparing(Entry::target))
                .toList();
    }

    /** Pairs whose mean fidelity has dropped below {@code threshold}. */
    public List<Entry> degradedPairs(double threshold) {
        return entries().stream().filter(e -> e.meanFidelity() < threshold).toList();
    }

    void removeProtocol(String protocolId) {
        pairs.keySet().removeIf(p -> p.source().equals(protocolId) || p.target().equals(protocolId));
    }
}
