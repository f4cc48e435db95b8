package com.agentbridge.orchestrator.canonical;

import java.util.Comparator;
import java.util.Objects;

/**
 * Atomic statement of the canonical graph. Equality is exact on all three parts.
 */
public record Triple(Iri subject, Iri predicate, Term object) {

    /** Stable order used for serialization and reports. */
    public static final Comparator<Triple> ORDER = Comparator
            .comparing((Triple t) -> t.subject().value())
            .thenComparing(t -> t.predicate().value())
            .thenComparing(t -> t.object().value())
            .thenComparing(t -> t.object() instanceof Literal l ? l.datatype().value() : "");

    public Triple {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(object, "object");
    }

    public static Triple of(Iri subject, Iri predicate, Term object) {
        return new Triple(subject, predicate, object);
    }

    public static Triple literal(Iri subject, Iri predicate, String value) {
        return new Triple(subject, predicate, Literal.of(value));
    }
}
