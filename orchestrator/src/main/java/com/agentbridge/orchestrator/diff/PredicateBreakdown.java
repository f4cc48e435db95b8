package com.agentbridge.orchestrator.diff;

import com.agentbridge.orchestrator.canonical.Iri;

/** Triple counts for one predicate; similarity is common / union for that predicate. */
public record PredicateBreakdown(Iri predicate, int leftOnly, int rightOnly, int common, double similarity) {}
