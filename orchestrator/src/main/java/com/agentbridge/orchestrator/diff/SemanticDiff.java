package com.agentbridge.orchestrator.diff;

import com.agentbridge.orchestrator.canonical.CanonicalGraph;
import com.agentbridge.orchestrator.canonical.Iri;
import com.agentbridge.orchestrator.canonical.Triple;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Triple-level comparison of canonical graphs.
 *
 * <p>Triples match only when subject, predicate and object (lexical form and
 * datatype) are all equal. Similarity is the Jaccard index over those
 * triples, so {@code diff(a, b).similarity() == diff(b, a).similarity()}.
 */
@Component
public class SemanticDiff {

    static final double SIMILARITY_WEIGHT = 0.7;
    static final double PREDICATE_WEIGHT  = 0.3;

    public GraphDiff diff(CanonicalGraph left, CanonicalGraph right) {
        Set<Triple> common = new HashSet<>(left.triples());
        common.retainAll(right.triples());
        Set<Triple> leftOnly = new HashSet<>(left.triples());
        leftOnly.removeAll(common);
        Set<Triple> rightOnly = new HashSet<>(right.triples());
        rightOnly.removeAll(common);

        int union = common.size() + leftOnly.size() + rightOnly.size();
        double similarity = union == 0 ? 1.0 : (double) common.size() / union;

        Set<Iri> predicates = new TreeSet<>();
        predicates.addAll(left.predicates());
        predicates.addAll(right.predicates());
        List<PredicateBreakdown> breakdown = predicates.stream()
                .map(p -> {
                    int l = count(leftOnly, p), r = count(rightOnly, p), c = count(common, p);
                    return new PredicateBreakdown(p, l, r, c, (double) c / (l + r + c));
                })
                .toList();

        return new GraphDiff(leftOnly, rightOnly, common, similarity, breakdown);
    }

    public InformationLoss calculateInformationLoss(CanonicalGraph original, CanonicalGraph reconstructed) {
        GraphDiff diff = diff(original, reconstructed);

        double tripleRetention = original.isEmpty() ? 1.0 : (double) diff.common().size() / original.size();

        Set<Iri> before = original.predicates();
        Set<Iri> after = reconstructed.predicates();
        Set<Iri> lost = new LinkedHashSet<>(before);
        lost.removeAll(after);
        Set<Iri> added = new LinkedHashSet<>(after);
        added.removeAll(before);
        double predicateRetention = before.isEmpty() ? 1.0
                : (double) (before.size() - lost.size()) / before.size();

        double overall = SIMILARITY_WEIGHT * diff.similarity() + PREDICATE_WEIGHT * predicateRetention;
        return new InformationLoss(tripleRetention, 1.0 - tripleRetention, predicateRetention,
                lost, added, overall);
    }

    /** Plain-text report with predicate breakdowns ordered worst first. */
    public String formatReport(GraphDiff diff) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "similarity: %.4f (common %d, left-only %d, right-only %d)%n",
                diff.similarity(), diff.common().size(), diff.leftOnly().size(), diff.rightOnly().size()));
        diff.perPredicate().stream()
                .sorted(Comparator.comparingDouble(PredicateBreakdown::similarity)
                        .thenComparing(PredicateBreakdown::predicate))
                .forEach(b -> sb.append(String.format(Locale.ROOT, "  %.4f  %s  (common %d, left-only %d, right-only %d)%n",
                        b.similarity(), b.predicate().value(), b.common(), b.leftOnly(), b.rightOnly())));
        return sb.toString();
    }

    private static int count(Set<Triple> triples, Iri predicate) {
        return (int) triples.stream().filter(t -> t.predicate().equals(predicate)).count();
    }
}
