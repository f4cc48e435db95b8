package com.agentbridge.orchestrator.service;

import com.agentbridge.orchestrator.adapter.CanonicalResult;
import com.agentbridge.orchestrator.adapter.NativePayload;
import com.agentbridge.orchestrator.adapter.NativeResult;
import com.agentbridge.orchestrator.adapter.ProtocolAdapter;
import com.agentbridge.orchestrator.adapter.TransformOptions;
import com.agentbridge.orchestrator.adapter.TransformReport;
import com.agentbridge.orchestrator.adapter.ValidationResult;
import com.agentbridge.orchestrator.cache.CacheKey;
import com.agentbridge.orchestrator.cache.TranslationCache;
import com.agentbridge.orchestrator.error.AdapterNotFoundException;
import com.agentbridge.orchestrator.error.CacheException;
import com.agentbridge.orchestrator.error.ErrorCategory;
import com.agentbridge.orchestrator.error.FidelityThresholdException;
import com.agentbridge.orchestrator.error.StoreException;
import com.agentbridge.orchestrator.error.TransformException;
import com.agentbridge.orchestrator.error.TranslationTimeoutException;
import com.agentbridge.orchestrator.registry.AdapterRegistry;
import com.agentbridge.orchestrator.store.AgentSnapshot;
import com.agentbridge.orchestrator.store.CanonicalStore;
import com.agentbridge.orchestrator.store.SnapshotMetadata;
import com.agentbridge.orchestrator.store.SnapshotRef;
import com.agentbridge.orchestrator.store.TranslationActivity;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;

/**
 * Runs translations: source adapter → canonical graph → (optional snapshot)
 * → target adapter, with fidelity accounting, caching and an audit record
 * for every attempt.
 *
 * <p>Only adapter-not-found, store failures and async timeouts escape as
 * exceptions. Every data-quality problem (invalid payload, failed transform,
 * fidelity below the requested bound) comes back as a response with
 * {@code success=false} and populated errors.
 *
 * <p>Metrics:
 * <pre>
 *   agentbridge.translation.duration{source, target, status}
 *   agentbridge.translation.calls{source, target, status}
 * </pre>
 */
public class TranslationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TranslationOrchestrator.class);

    /** Source format recorded for re-exports of stored snapshots. */
    public static final String CANONICAL = "canonical";

    private record Adapters(ProtocolAdapter source, ProtocolAdapter target) {}

    private final AdapterRegistry                       registry;
    private final CanonicalStore                        store;
    private final TranslationCache<TranslationResponse> cache;
    private final MeterRegistry                         meterRegistry;
    private final Clock                                 clock;
    private final Executor                              executor;

    public TranslationOrchestrator(AdapterRegistry registry,
                                   CanonicalStore store,
                                   TranslationCache<TranslationResponse> cache,
                                   MeterRegistry meterRegistry,
                                   Clock clock,
                                   Executor executor) {
        this.registry      = registry;
        this.store         = store;
        this.cache         = cache;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
        this.executor      = executor;
    }

    // ------------------------------------------------------------------
    // Single hop
    // ------------------------------------------------------------------

    /**
     * Translate one native payload into another protocol.
     *
     * @throws AdapterNotFoundException if either protocol has no enabled adapter
     * @throws StoreException           if persisting the snapshot fails
     * @throws IllegalArgumentException on a malformed request
     */
    public TranslationResponse translate(TranslationRequest request) {
        long start = System.nanoTime();
        String translationId = UUID.randomUUID().toString();
        MDC.put("translation", translationId);
        if (request.agentId() != null) MDC.put("agentId", request.agentId());
        try {
            Adapters adapters = resolve(request.agentId(), request.sourceFormat(), request.targetFormat(), start);

            Optional<TranslationResponse> hit = cacheLookup(request);
            if (hit.isPresent()) {
                recordMetrics(request.sourceFormat(), request.targetFormat(), "cache_hit", start);
                log.debug("Cache hit for {} {}→{}", request.agentId(), request.sourceFormat(), request.targetFormat());
                return hit.get();
            }

            CanonicalResult forward;
            try {
                forward = sourceStage(adapters.source(), request);
            } catch (TransformException e) {
                return sourceFailed(request, e, start);
            }
            return targetStage(request, adapters, forward, start);
        } finally {
            MDC.remove("translation");
            MDC.remove("agentId");
        }
    }

    /**
     * As {@link #translate}, with the source stage run asynchronously on the
     * orchestrator's executor and bounded by {@code timeout}. A timeout
     * completes the future with {@link TranslationTimeoutException} before
     * anything is written to the store, so the call can be retried.
     */
    public CompletableFuture<TranslationResponse> translateAsync(TranslationRequest request, Duration timeout) {
        long start = System.nanoTime();
        Adapters adapters;
        try {
            adapters = resolve(request.agentId(), request.sourceFormat(), request.targetFormat(), start);
        } catch (AdapterNotFoundException e) {
            return CompletableFuture.failedFuture(e);
        }

        Optional<TranslationResponse> hit = cacheLookup(request);
        if (hit.isPresent()) {
            recordMetrics(request.sourceFormat(), request.targetFormat(), "cache_hit", start);
            return CompletableFuture.completedFuture(hit.get());
        }

        try {
            validateSource(adapters.source(), request);
        } catch (TransformException e) {
            return CompletableFuture.completedFuture(sourceFailed(request, e, start));
        }

        return adapters.source()
                .toCanonicalAsync(request.sourceData(), transformOptions(request), executor)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((forward, ex) -> {
                    if (ex == null) {
                        return targetStage(request, adapters, forward, start);
                    }
                    Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                    if (cause instanceof TimeoutException) {
                        String operation = request.sourceFormat() + ".toCanonical";
                        audit(failedActivity(request.agentId(), request.sourceFormat(), request.targetFormat(), start));
                        recordMetrics(request.sourceFormat(), request.targetFormat(), "timeout", start);
                        log.warn("{} timed out after {} ms", operation, timeout.toMillis());
                        throw new TranslationTimeoutException(operation, timeout);
                    }
                    if (cause instanceof TransformException te) {
                        return sourceFailed(request, te, start);
                    }
                    if (cause instanceof RuntimeException re) throw re;
                    throw new CompletionException(cause);
                });
    }

    // ------------------------------------------------------------------
    // Re-export from the store
    // ------------------------------------------------------------------

    /**
     * Export a stored snapshot through {@code targetFormat}'s fromCanonical.
     * Total fidelity is the reverse fidelity alone.
     *
     * @param version null for the latest
     */
    public TranslationResponse translateFromStore(String agentId, String targetFormat, Integer version) {
        long start = System.nanoTime();
        MDC.put("agentId", agentId);
        try {
            ProtocolAdapter target = registry.getAdapter(targetFormat).orElseThrow(() -> {
                audit(failedActivity(agentId, CANONICAL, targetFormat, start));
                recordMetrics(CANONICAL, targetFormat, "adapter_not_found", start);
                return new AdapterNotFoundException(targetFormat);
            });

            Optional<AgentSnapshot> snapshot = store.getAgentSnapshot(agentId, version);
            if (snapshot.isEmpty()) {
                String what = version == null ? "any snapshot" : "snapshot v" + version;
                return finish(agentId, CANONICAL, targetFormat, null, null, null, null,
                        new ArrayList<>(), errors(ErrorCategory.STORE, List.of("Agent '" + agentId + "' has no " + what)),
                        start);
            }

            AgentSnapshot s = snapshot.get();
            NativeResult reverse;
            try {
                reverse = target.fromCanonical(s.graph(), TransformOptions.forAgent(agentId));
            } catch (TransformException e) {
                return finish(agentId, CANONICAL, targetFormat, null, null, null, s.version(),
                        new ArrayList<>(), errors(ErrorCategory.TRANSFORM, List.of(e.getMessage())), start);
            }
            List<String> warnings = new ArrayList<>(reverse.report().warnings());
            if (!reverse.report().success()) {
                return finish(agentId, CANONICAL, targetFormat, null, reverse.report(), null, s.version(),
                        warnings, errors(ErrorCategory.TRANSFORM, reverse.report().errors()), start);
            }
            registry.recordUsage(targetFormat, reverse.report().fidelityScore());
            return finish(agentId, CANONICAL, targetFormat, null, reverse.report(), reverse.payload(),
                    s.version(), warnings, List.of(), start);
        } finally {
            MDC.remove("agentId");
        }
    }

    // ------------------------------------------------------------------
    // Multi-hop chains
    // ------------------------------------------------------------------

    public ChainResult translateChain(NativePayload sourceData, List<String> formats, TranslationOptions options) {
        return translateChain(null, sourceData, formats, options);
    }

    /**
     * Pairwise {@link #translate} over {@code formats}, each hop's output
     * feeding the next. Cumulative fidelity is the product of the hops'
     * total fidelity. Persisting applies to the final hop only. The first
     * failing hop aborts the chain with everything reported so far.
     */
    public ChainResult translateChain(String agentId, NativePayload sourceData, List<String> formats,
                                      TranslationOptions options) {
        if (formats == null || formats.size() < 2) {
            throw new IllegalArgumentException("A chain needs at least two formats");
        }
        if (!formats.get(0).equals(sourceData.protocolId())) {
            throw new IllegalArgumentException("Chain starts at '" + formats.get(0)
                    + "' but sourceData is tagged '" + sourceData.protocolId() + "'");
        }
        TranslationOptions base = options == null ? TranslationOptions.defaults() : options;

        List<TranslationResponse> hops = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<TranslationError> errors = new ArrayList<>();
        NativePayload current = sourceData;
        String currentAgent = agentId;
        double cumulative = 1.0;
        Integer version = null;

        for (int i = 0; i + 1 < formats.size(); i++) {
            String from = formats.get(i);
            String to = formats.get(i + 1);
            boolean lastHop = i + 2 == formats.size();
            TranslationResponse hop = translate(new TranslationRequest(currentAgent, from, to, current,
                    base.withPersist(base.persist() && lastHop)));
            hops.add(hop);

            String prefix = "hop " + (i + 1) + " (" + from + "→" + to + "): ";
            hop.warnings().forEach(w -> warnings.add(prefix + w));
            hop.errors().forEach(e -> errors.add(new TranslationError(e.category(), prefix + e.message())));
            if (!hop.success()) {
                log.info("Chain {} aborted at hop {}", formats, i + 1);
                return new ChainResult(false, hop.agentId() != null ? hop.agentId() : currentAgent,
                        formats, null, 0.0, null, hops, warnings, errors);
            }
            cumulative *= hop.totalFidelity();
            current = hop.targetData();
            currentAgent = hop.agentId();
            version = hop.snapshotVersion();
        }

        log.info("Chain {} completed for {} with cumulative fidelity {}", formats, currentAgent, cumulative);
        return new ChainResult(true, currentAgent, formats, current, cumulative, version, hops, warnings, errors);
    }

    // ------------------------------------------------------------------
    // Stages
    // ------------------------------------------------------------------

    private Adapters resolve(String agentId, String sourceFormat, String targetFormat, long start) {
        Optional<ProtocolAdapter> source = registry.getAdapter(sourceFormat);
        Optional<ProtocolAdapter> target = registry.getAdapter(targetFormat);
        if (source.isEmpty() || target.isEmpty()) {
            audit(failedActivity(agentId, sourceFormat, targetFormat, start));
            recordMetrics(sourceFormat, targetFormat, "adapter_not_found", start);
            throw new AdapterNotFoundException(source.isEmpty() ? sourceFormat : targetFormat);
        }
        return new Adapters(source.get(), target.get());
    }

    private Optional<TranslationResponse> cacheLookup(TranslationRequest request) {
        if (!request.options().useCache() || request.agentId() == null) return Optional.empty();
        try {
            return cache.get(new CacheKey(request.agentId(), request.sourceFormat(), request.targetFormat()))
                    .map(TranslationResponse::asCached);
        } catch (CacheException e) {
            log.warn("Cache lookup failed, translating uncached: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private void validateSource(ProtocolAdapter source, TranslationRequest request) {
        ValidationResult validation = source.validate(request.sourceData());
        List<String> problems = new ArrayList<>(validation.errors());
        if (request.options().strict()) problems.addAll(validation.warnings());
        if (!problems.isEmpty()) {
            throw new TransformException("Invalid " + request.sourceFormat() + " payload: "
                    + String.join("; ", problems));
        }
    }

    private CanonicalResult sourceStage(ProtocolAdapter source, TranslationRequest request) {
        validateSource(source, request);
        return source.toCanonical(request.sourceData(), transformOptions(request));
    }

    private static TransformOptions transformOptions(TranslationRequest request) {
        return new TransformOptions(request.agentId(), request.options().strict());
    }

    private TranslationResponse sourceFailed(TranslationRequest request, TransformException e, long start) {
        log.info("Source transform {} failed: {}", request.sourceFormat(), e.getMessage());
        return finish(request.agentId(), request.sourceFormat(), request.targetFormat(), null, null, null, null,
                new ArrayList<>(), List.of(TranslationError.of(e)), start);
    }

    /** Steps after the source transform: threshold, persist, target transform, audit, cache. */
    private TranslationResponse targetStage(TranslationRequest request, Adapters adapters,
                                            CanonicalResult forward, long start) {
        String agentId = forward.agentId();
        String source = request.sourceFormat();
        String target = request.targetFormat();
        TranslationOptions options = request.options();
        TransformReport fwd = forward.report();
        List<String> warnings = new ArrayList<>(fwd.warnings());
        MDC.put("agentId", agentId);

        if (!fwd.success()) {
            return finish(agentId, source, target, fwd, null, null, null,
                    warnings, errors(ErrorCategory.TRANSFORM, fwd.errors()), start);
        }

        // Nothing is persisted or rendered unless the graph describes exactly one agent.
        try {
            forward.graph().requireAgentNode();
        } catch (TransformException e) {
            log.info("Rejected {} {}→{}: {}", agentId, source, target, e.getMessage());
            return finish(agentId, source, target, fwd, null, null, null,
                    warnings, List.of(TranslationError.of(e)), start);
        }

        if (options.maxFidelityLoss() != null && fwd.fidelityScore() < 1.0 - options.maxFidelityLoss()) {
            FidelityThresholdException e = new FidelityThresholdException(fwd.fidelityScore(),
                    1.0 - options.maxFidelityLoss());
            log.info("Rejected {} {}→{}: {}", agentId, source, target, e.getMessage());
            return finish(agentId, source, target, fwd, null, null, null,
                    warnings, List.of(TranslationError.of(e)), start);
        }

        Integer version = null;
        if (options.persist()) {
            try {
                SnapshotRef ref = store.createAgentSnapshot(agentId, forward.graph(),
                        new SnapshotMetadata(clock.instant(), source, fwd.fidelityScore()));
                version = ref.version();
            } catch (StoreException e) {
                audit(failedActivity(agentId, source, target, start));
                recordMetrics(source, target, "store_error", start);
                throw e;
            }
            cache.invalidate(agentId);
        }

        NativeResult reverse;
        try {
            reverse = adapters.target().fromCanonical(forward.graph(), TransformOptions.forAgent(agentId));
        } catch (TransformException e) {
            return finish(agentId, source, target, fwd, null, null, version,
                    warnings, List.of(TranslationError.of(e)), start);
        }
        TransformReport rev = reverse.report();
        warnings.addAll(rev.warnings());
        if (!rev.success()) {
            return finish(agentId, source, target, fwd, rev, null, version,
                    warnings, errors(ErrorCategory.TRANSFORM, rev.errors()), start);
        }

        registry.recordUsage(source, fwd.fidelityScore());
        registry.recordUsage(target, rev.fidelityScore());
        TranslationResponse response = finish(agentId, source, target, fwd, rev, reverse.payload(), version,
                warnings, List.of(), start);
        registry.recordPair(source, target, response.totalFidelity());

        if (options.useCache()) {
            try {
                cache.put(new CacheKey(agentId, source, target), response);
            } catch (CacheException e) {
                log.warn("Could not cache translation of {}: {}", agentId, e.getMessage());
            }
        }
        return response;
    }

    /**
     * Append the activity record, record metrics and build the response.
     * Success means no errors and a reverse report; total fidelity is the
     * product of the reports present.
     */
    private TranslationResponse finish(String agentId, String source, String target,
                                       TransformReport fwd, TransformReport rev, NativePayload targetData,
                                       Integer version, List<String> warnings, List<TranslationError> errors,
                                       long start) {
        boolean success = errors.isEmpty() && rev != null;
        double total = success
                ? (fwd == null ? 1.0 : fwd.fidelityScore()) * rev.fidelityScore()
                : 0.0;
        long durationMs = elapsedMs(start);
        List<String> lost = Stream.concat(
                        fwd == null ? Stream.<String>empty() : fwd.lostFields().stream(),
                        rev == null ? Stream.<String>empty() : rev.lostFields().stream())
                .distinct()
                .toList();

        TranslationActivity activity = new TranslationActivity(UUID.randomUUID(), clock.instant(), agentId,
                source, target, total, lost, durationMs, success);
        List<String> allWarnings = new ArrayList<>(warnings);
        if (!audit(activity)) {
            allWarnings.add("Translation activity could not be recorded");
        }
        recordMetrics(source, target, success ? "success" : "failure", start);
        if (success) {
            log.info("Translated {} {}→{} fidelity={} version={}", agentId, source, target, total, version);
        }
        return new TranslationResponse(success, agentId, source, target, targetData, fwd, rev, total, version,
                allWarnings, errors, false, durationMs);
    }

    private TranslationActivity failedActivity(String agentId, String source, String target, long start) {
        return new TranslationActivity(UUID.randomUUID(), clock.instant(), agentId, source, target,
                0.0, List.of(), elapsedMs(start), false);
    }

    // The audit log is append-only and best effort from the caller's point of view.
    private boolean audit(TranslationActivity activity) {
        try {
            store.recordTranslation(activity);
            return true;
        } catch (RuntimeException e) {
            log.warn("Failed to record translation activity {}: {}", activity.id(), e.getMessage());
            return false;
        }
    }

    private static List<TranslationError> errors(ErrorCategory category, List<String> messages) {
        return messages.stream().map(m -> new TranslationError(category, m)).toList();
    }

    private void recordMetrics(String source, String target, String status, long start) {
        meterRegistry.timer("agentbridge.translation.duration",
                "source", source, "target", target, "status", status)
                .record(Duration.ofNanos(System.nanoTime() - start));
        meterRegistry.counter("agentbridge.translation.calls",
                "source", source, "target", target, "status", status).increment();
    }

    private static long elapsedMs(long start) {
        return (System.nanoTime() - start) / 1_000_000;
    }
}
