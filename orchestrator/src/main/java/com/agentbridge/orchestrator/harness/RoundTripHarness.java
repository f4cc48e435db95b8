package com.agentbridge.orchestrator.harness;

import com.agentbridge.orchestrator.adapter.CanonicalResult;
import com.agentbridge.orchestrator.adapter.NativePayload;
import com.agentbridge.orchestrator.adapter.NativeResult;
import com.agentbridge.orchestrator.adapter.ProtocolAdapter;
import com.agentbridge.orchestrator.adapter.TransformOptions;
import com.agentbridge.orchestrator.canonical.CanonicalGraph;
import com.agentbridge.orchestrator.canonical.Iri;
import com.agentbridge.orchestrator.diff.InformationLoss;
import com.agentbridge.orchestrator.diff.SemanticDiff;
import com.agentbridge.orchestrator.error.BridgeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Admission gate for adapters and adapter pairs.
 *
 * <p>A round trip compares {@code toCanonical(x)} with
 * {@code toCanonical(fromCanonical(toCanonical(x)))}, both produced by the
 * same adapter so each side is read the same way. A cross-framework test
 * runs source → canonical → target → canonical → source and multiplies the
 * forward and reverse fidelity; that product must meet the pair's threshold.
 */
public class RoundTripHarness {

    private static final Logger log = LoggerFactory.getLogger(RoundTripHarness.class);

    private final SemanticDiff diff;
    private final double       regressionTolerance;

    public RoundTripHarness(SemanticDiff diff) {
        this(diff, 0.0);
    }

    /** @param regressionTolerance how far the suite mean may drop below the baseline before it counts as a regression */
    public RoundTripHarness(SemanticDiff diff, double regressionTolerance) {
        this.diff                = diff;
        this.regressionTolerance = regressionTolerance;
    }

    // ------------------------------------------------------------------
    // Single cases
    // ------------------------------------------------------------------

    public HarnessResult runTest(ProtocolAdapter adapter, NativePayload sample, double minFidelity) {
        return runTest(adapter.protocolId() + " round trip", adapter, sample, minFidelity);
    }

    public HarnessResult runTest(String name, ProtocolAdapter adapter, NativePayload sample, double minFidelity) {
        long start = System.nanoTime();
        try {
            CanonicalResult original = adapter.toCanonical(sample, TransformOptions.defaults());
            TransformOptions pinned = TransformOptions.forAgent(original.agentId());
            NativeResult back = adapter.fromCanonical(original.graph(), pinned);
            CanonicalResult reread = adapter.toCanonical(back.payload(), pinned);

            InformationLoss loss = diff.calculateInformationLoss(original.graph(), reread.graph());
            boolean exact = original.graph().equals(reread.graph());
            double fidelity = exact ? 1.0 : loss.overallFidelity();
            boolean passed = exact || fidelity >= minFidelity;
            return new HarnessResult(name, adapter.protocolId(), null, fidelity, fidelity, fidelity, minFidelity,
                    exact, passed, names(loss), elapsedMs(start),
                    passed ? null : belowThreshold(fidelity, minFidelity, loss));
        } catch (BridgeException e) {
            return errored(name, adapter.protocolId(), null, minFidelity, start, e);
        }
    }

    public HarnessResult runCrossFrameworkTest(ProtocolAdapter source, NativePayload sample,
                                               ProtocolAdapter target, double minFidelity) {
        return runCrossFrameworkTest(source.protocolId() + " → " + target.protocolId(),
                source, sample, target, minFidelity);
    }

    public HarnessResult runCrossFrameworkTest(String name, ProtocolAdapter source, NativePayload sample,
                                               ProtocolAdapter target, double minFidelity) {
        long start = System.nanoTime();
        try {
            CanonicalResult g1 = source.toCanonical(sample, TransformOptions.defaults());
            TransformOptions pinned = TransformOptions.forAgent(g1.agentId());

            NativeResult inTarget = target.fromCanonical(g1.graph(), pinned);
            CanonicalGraph g2 = target.toCanonical(inTarget.payload(), pinned).graph();
            NativeResult backInSource = source.fromCanonical(g2, pinned);
            CanonicalGraph g3 = source.toCanonical(backInSource.payload(), pinned).graph();

            InformationLoss forwardLoss = diff.calculateInformationLoss(g1.graph(), g2);
            InformationLoss reverseLoss = diff.calculateInformationLoss(g2, g3);
            double forward = forwardLoss.overallFidelity();
            double reverse = reverseLoss.overallFidelity();
            double fidelity = forward * reverse;
            boolean exact = g1.graph().equals(g3);
            boolean passed = fidelity >= minFidelity;

            return new HarnessResult(name, source.protocolId(), target.protocolId(), forward, reverse, fidelity,
                    minFidelity, exact, passed, names(forwardLoss), elapsedMs(start),
                    passed ? null : belowThreshold(fidelity, minFidelity, forwardLoss));
        } catch (BridgeException e) {
            return errored(name, source.protocolId(), target.protocolId(), minFidelity, start, e);
        }
    }

    // ------------------------------------------------------------------
    // Suites
    // ------------------------------------------------------------------

    public SuiteReport runSuite(String suiteName, List<HarnessCase> cases, FidelityBaseline baseline) {
        long start = System.nanoTime();
        List<HarnessResult> results = new ArrayList<>();
        for (HarnessCase c : cases) {
            HarnessResult r = c.target() == null
                    ? runTest(c.name(), c.source(), c.sample(), c.minFidelity())
                    : runCrossFrameworkTest(c.name(), c.source(), c.sample(), c.target(), c.minFidelity());
            if (!r.passed()) log.warn("Harness case '{}' failed: {}", r.name(), r.failureMessage());
            results.add(r);
        }

        int passed = (int) results.stream().filter(HarnessResult::passed).count();
        double mean = results.stream().mapToDouble(HarnessResult::fidelity).average().orElse(1.0);
        Double baselineMean = baseline == null ? null : baseline.meanFidelity();
        boolean regressed = baselineMean != null && mean < baselineMean - regressionTolerance;
        if (regressed) {
            log.warn("Suite '{}' mean fidelity {} regressed against baseline {}", suiteName, mean, baselineMean);
        }

        SuiteReport report = new SuiteReport(suiteName, results, passed, results.size() - passed, mean,
                baselineMean, regressed, elapsedMs(start));
        log.info("Suite '{}': {} passed, {} failed, mean fidelity {}", suiteName, report.passed(),
                report.failed(), String.format(Locale.ROOT, "%.4f", mean));
        return report;
    }

    public SuiteReport runSuite(String suiteName, List<HarnessCase> cases) {
        return runSuite(suiteName, cases, null);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static HarnessResult errored(String name, String source, String target, double minFidelity,
                                         long start, BridgeException e) {
        return new HarnessResult(name, source, target, 0.0, 0.0, 0.0, minFidelity, false, false,
                List.of(), elapsedMs(start), e.getCategory() + ": " + e.getMessage());
    }

    private static String belowThreshold(double fidelity, double minFidelity, InformationLoss loss) {
        return String.format(Locale.ROOT, "fidelity %.4f below threshold %.4f; lost predicates %s in %s",
                fidelity, minFidelity, names(loss), loss.lostCategories());
    }

    private static List<String> names(InformationLoss loss) {
        return loss.lostPredicates().stream().map(Iri::value).sorted().toList();
    }

    private static long elapsedMs(long start) {
        return (System.nanoTime() - start) / 1_000_000;
    }
}
