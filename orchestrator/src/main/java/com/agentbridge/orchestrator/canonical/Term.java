package com.agentbridge.orchestrator.canonical;

/**
 * Object position of a {@link Triple}: either an {@link Iri} or a typed {@link Literal}.
 */
public interface Term {

    /** IRI string or literal lexical form. */
    String value();

    default boolean isIri() { return this instanceof Iri; }
}
