package com.agentbridge.orchestrator.canonical;

import com.agentbridge.orchestrator.error.TransformException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Immutable, unordered set of triples describing one agent at one point in time.
 *
 * A well-formed graph has exactly one node typed {@link Vocabulary#AGENT}.
 * The builder does not enforce this so that adapters and tests can describe
 * broken input; consumers call {@link #requireAgentNode()}.
 */
public final class CanonicalGraph {

    private static final CanonicalGraph EMPTY = new CanonicalGraph(Set.of());

    private final Set<Triple> triples;

    private CanonicalGraph(Set<Triple> triples) {
        this.triples = triples;
    }

    public static CanonicalGraph empty() { return EMPTY; }

    public static CanonicalGraph of(Collection<Triple> triples) {
        return new CanonicalGraph(Collections.unmodifiableSet(new LinkedHashSet<>(triples)));
    }

    public static Builder builder() { return new Builder(); }

    // ------------------------------------------------------------------
    // Structure
    // ------------------------------------------------------------------

    public Set<Triple> triples() { return triples; }
    public int size()            { return triples.size(); }
    public boolean isEmpty()     { return triples.isEmpty(); }

    public boolean contains(Triple triple) { return triples.contains(triple); }

    /** Subjects typed as Agent. */
    public List<Iri> agentNodes() {
        return triples.stream()
                .filter(t -> t.predicate().equals(Vocabulary.RDF_TYPE) && t.object().equals(Vocabulary.AGENT))
                .map(Triple::subject)
                .distinct()
                .sorted()
                .toList();
    }

    /** The single Agent node, or empty when there is none or more than one. */
    public Optional<Iri> agentNode() {
        List<Iri> nodes = agentNodes();
        return nodes.size() == 1 ? Optional.of(nodes.get(0)) : Optional.empty();
    }

    /** @throws TransformException unless the graph has exactly one Agent node */
    public Iri requireAgentNode() {
        List<Iri> nodes = agentNodes();
        if (nodes.isEmpty()) {
            throw new TransformException("Canonical graph has no node typed " + Vocabulary.AGENT.value());
        }
        if (nodes.size() > 1) {
            throw new TransformException("Canonical graph describes " + nodes.size() + " agents: " + nodes);
        }
        return nodes.get(0);
    }

    public Set<Iri> predicates() {
        return triples.stream().map(Triple::predicate).collect(Collectors.toCollection(TreeSet::new));
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public List<Term> objects(Iri subject, Iri predicate) {
        return triples.stream()
                .filter(t -> t.subject().equals(subject) && t.predicate().equals(predicate))
                .sorted(Triple.ORDER)
                .map(Triple::object)
                .toList();
    }

    public List<Iri> iris(Iri subject, Iri predicate) {
        return objects(subject, predicate).stream()
                .filter(Iri.class::isInstance)
                .map(Iri.class::cast)
                .toList();
    }

    public List<String> literals(Iri subject, Iri predicate) {
        return objects(subject, predicate).stream()
                .filter(Literal.class::isInstance)
                .map(Term::value)
                .toList();
    }

    public Optional<String> literal(Iri subject, Iri predicate) {
        return literals(subject, predicate).stream().findFirst();
    }

    public List<Triple> about(Iri subject) {
        return triples.stream()
                .filter(t -> t.subject().equals(subject))
                .sorted(Triple.ORDER)
                .toList();
    }

    /** Extension triples owned by the given protocol. */
    public List<Triple> extensionTriples(String protocolId) {
        ExtensionNamespace ns = ExtensionNamespace.of(protocolId);
        return triples.stream()
                .filter(t -> ns.owns(t.predicate()))
                .sorted(Triple.ORDER)
                .toList();
    }

    /** Extension triples owned by any protocol other than the given one. */
    public List<Triple> foreignExtensionTriples(String protocolId) {
        ExtensionNamespace ns = ExtensionNamespace.of(protocolId);
        return triples.stream()
                .filter(t -> ExtensionNamespace.isExtension(t.predicate()) && !ns.owns(t.predicate()))
                .sorted(Triple.ORDER)
                .toList();
    }

    /** Triples reachable from {@code root} within {@code maxDepth} hops. */
    public CanonicalGraph subgraph(Iri root, int maxDepth) {
        return CanonicalGraph.of(GraphTraversal.describe(this, root, maxDepth));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CanonicalGraph other && triples.equals(other.triples);
    }

    @Override
    public int hashCode() { return triples.hashCode(); }

    @Override
    public String toString() { return "CanonicalGraph[" + triples.size() + " triples]"; }

    // ------------------------------------------------------------------
    // Builder
    // ------------------------------------------------------------------

    public static final class Builder {

        private final Set<Triple> triples = new LinkedHashSet<>();

        private Builder() {}

        public Builder add(Triple triple) {
            triples.add(triple);
            return this;
        }

        public Builder addAll(Collection<Triple> more) {
            triples.addAll(more);
            return this;
        }

        public Builder add(Iri subject, Iri predicate, Term object) {
            return add(new Triple(subject, predicate, object));
        }

        public Builder type(Iri subject, Iri type) {
            return add(subject, Vocabulary.RDF_TYPE, type);
        }

        /** Adds a string literal; null or blank values are skipped. */
        public Builder literal(Iri subject, Iri predicate, String value) {
            if (value != null && !value.isBlank()) add(subject, predicate, Literal.of(value));
            return this;
        }

        /** Adds a typed literal; null values are skipped. */
        public Builder literal(Iri subject, Iri predicate, Literal value) {
            if (value != null) add(subject, predicate, value);
            return this;
        }

        public CanonicalGraph build() {
            return CanonicalGraph.of(triples);
        }
    }
}
