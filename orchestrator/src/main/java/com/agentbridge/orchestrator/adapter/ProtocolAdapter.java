package com.agentbridge.orchestrator.adapter;

import com.agentbridge.orchestrator.canonical.CanonicalGraph;
import com.agentbridge.orchestrator.error.TransformException;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Bidirectional translator between one protocol's native shape and the
 * canonical graph.
 *
 * Implementations must be deterministic: the same native input always yields
 * the same graph. Native fields with no canonical equivalent are written into
 * the adapter's {@link com.agentbridge.orchestrator.canonical.ExtensionNamespace}
 * unless the report lists them as lossy with a reason.
 *
 * <p>Round-trip expectation: {@code fromCanonical(toCanonical(x))} approximates
 * {@code x}, losing only features the protocol genuinely cannot express.
 * {@link com.agentbridge.orchestrator.harness.RoundTripHarness} checks this.
 */
public interface ProtocolAdapter {

    /** Identity, version and capability declaration. */
    AdapterManifest manifest();

    default String protocolId() { return manifest().protocolId(); }

    /**
     * Native → canonical.
     *
     * @throws TransformException when the required identity field is absent
     *                            or the payload cannot be bound
     */
    CanonicalResult toCanonical(NativePayload payload, TransformOptions options);

    /**
     * Canonical → native. Own extension entries are restored into native shape.
     *
     * @throws TransformException if the graph lacks its Agent node
     */
    NativeResult fromCanonical(CanonicalGraph graph, TransformOptions options);

    ValidationResult validate(NativePayload payload);

    default List<AdapterCapability> getCapabilities() {
        return manifest().capabilities();
    }

    default boolean supportsFeature(String name) {
        return getCapabilities().stream().anyMatch(c -> c.name().equals(name));
    }

    /**
     * Asynchronous variant of {@link #toCanonical}. Adapters that fetch remote
     * schemas override this to stay non-blocking; the default runs the
     * synchronous transform on the supplied executor.
     */
    default CompletableFuture<CanonicalResult> toCanonicalAsync(NativePayload payload,
                                                                TransformOptions options,
                                                                Executor executor) {
        return CompletableFuture.supplyAsync(() -> toCanonical(payload, options), executor);
    }
}
