package com.agentbridge.orchestrator.diff;

import com.agentbridge.orchestrator.canonical.Triple;

import java.util.List;
import java.util.Set;

public record GraphDiff(
        Set<Triple>              leftOnly,
        Set<Triple>              rightOnly,
        Set<Triple>              common,
        double                   similarity,
        List<PredicateBreakdown> perPredicate) {

    public GraphDiff {
        leftOnly     = Set.copyOf(leftOnly);
        rightOnly    = Set.copyOf(rightOnly);
        common       = Set.copyOf(common);
        perPredicate = List.copyOf(perPredicate);
    }

    public boolean identical() {
        return leftOnly.isEmpty() && rightOnly.isEmpty();
    }
}
