package com.agentbridge.orchestrator.canonical;

import java.util.Objects;

/**
 * Identifier of a node or predicate in the canonical graph.
 */
public record Iri(String value) implements Term, Comparable<Iri> {

    public Iri {
        Objects.requireNonNull(value, "iri");
        if (value.isBlank()) throw new IllegalArgumentException("IRI must not be blank");
    }

    public static Iri of(String value) { return new Iri(value); }

    @Override
    public int compareTo(Iri other) { return value.compareTo(other.value); }

    @Override
    public String toString() { return "<" + value + ">"; }
}
