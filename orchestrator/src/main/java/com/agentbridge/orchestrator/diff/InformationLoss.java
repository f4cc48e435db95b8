package com.agentbridge.orchestrator.diff;

import com.agentbridge.orchestrator.canonical.Iri;
import com.agentbridge.orchestrator.canonical.SemanticCategory;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * How much of an original graph survived reconstruction.
 *
 * <p>{@code predicateRetention} looks only at which predicates are still
 * present, so it separates structural loss (a whole kind of statement gone)
 * from value loss (same predicates, different values).
 */
public record InformationLoss(
        double   tripleRetention,
        double   tripleLoss,
        double   predicateRetention,
        Set<Iri> lostPredicates,
        Set<Iri> addedPredicates,
        double   overallFidelity) {

    public InformationLoss {
        lostPredicates  = Set.copyOf(lostPredicates);
        addedPredicates = Set.copyOf(addedPredicates);
    }

    /** Categories of the lost core predicates. Lost extension predicates have no category. */
    public Set<SemanticCategory> lostCategories() {
        Set<SemanticCategory> out = EnumSet.noneOf(SemanticCategory.class);
        lostPredicates.stream()
                .map(SemanticCategory::of)
                .flatMap(Optional::stream)
                .forEach(out::add);
        return out;
    }
}
