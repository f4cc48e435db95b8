package com.agentbridge.orchestrator.adapter;

import com.agentbridge.orchestrator.canonical.CanonicalGraph;
import com.agentbridge.orchestrator.canonical.ExtensionNamespace;
import com.agentbridge.orchestrator.canonical.Iri;
import com.agentbridge.orchestrator.canonical.Literal;
import com.agentbridge.orchestrator.canonical.Term;
import com.agentbridge.orchestrator.canonical.Triple;
import com.agentbridge.orchestrator.canonical.Vocabulary;
import com.agentbridge.orchestrator.error.TransformException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read access to a canonical graph that remembers which triples an adapter
 * consumed, so that whatever is left over can be reported and carried
 * forward instead of vanishing.
 */
public final class CanonicalReader {

    private final CanonicalGraph graph;
    private final Iri            agent;
    private final Set<Triple>    consumed = new HashSet<>();

    private CanonicalReader(CanonicalGraph graph, Iri agent) {
        this.graph = graph;
        this.agent = agent;
    }

    /** @throws TransformException if the graph lacks exactly one Agent node */
    public static CanonicalReader of(CanonicalGraph graph) {
        Iri agent = graph.requireAgentNode();
        CanonicalReader reader = new CanonicalReader(graph, agent);
        reader.consumed.add(Triple.of(agent, Vocabulary.RDF_TYPE, Vocabulary.AGENT));
        return reader;
    }

    public Iri agent()            { return agent; }
    public CanonicalGraph graph() { return graph; }

    /** Agent id encoded in the agent node IRI, if it is one of ours. */
    public Optional<String> agentId() { return Vocabulary.agentIdOf(agent); }

    // ------------------------------------------------------------------
    // Literals
    // ------------------------------------------------------------------

    public Optional<String> literal(Iri predicate) {
        return literal(agent, predicate);
    }

    /** First literal value in triple order; any further values stay unconsumed. */
    public Optional<String> literal(Iri subject, Iri predicate) {
        for (Term term : graph.objects(subject, predicate)) {
            if (term instanceof Literal l) {
                consumed.add(Triple.of(subject, predicate, l));
                return Optional.of(l.value());
            }
        }
        return Optional.empty();
    }

    /** Literal that may hold JSON, returned as-is together with its datatype. */
    public Optional<Literal> typedLiteral(Iri subject, Iri predicate) {
        for (Term term : graph.objects(subject, predicate)) {
            if (term instanceof Literal l) {
                consumed.add(Triple.of(subject, predicate, l));
                return Optional.of(l);
            }
        }
        return Optional.empty();
    }

    public List<String> literals(Iri predicate) {
        List<String> out = new ArrayList<>();
        for (Term term : graph.objects(agent, predicate)) {
            if (term instanceof Literal l) {
                consumed.add(Triple.of(agent, predicate, l));
                out.add(l.value());
            }
        }
        return out;
    }

    public Optional<Long> integer(Iri subject, Iri predicate) {
        return literal(subject, predicate).map(v -> parse(predicate, v, Long::parseLong));
    }

    public Optional<Double> decimal(Iri subject, Iri predicate) {
        return literal(subject, predicate).map(v -> parse(predicate, v, Double::parseDouble));
    }

    public Optional<Boolean> bool(Iri subject, Iri predicate) {
        return literal(subject, predicate).map(Boolean::parseBoolean);
    }

    // ------------------------------------------------------------------
    // Child nodes
    // ------------------------------------------------------------------

    /**
     * IRI-valued objects of the agent for {@code predicate}, e.g. its tools.
     * Consumes the link triples and the children's rdf:type statements.
     */
    public List<Iri> children(Iri predicate, Iri childType) {
        List<Iri> out = new ArrayList<>();
        for (Term term : graph.objects(agent, predicate)) {
            if (term instanceof Iri child) {
                consumed.add(Triple.of(agent, predicate, child));
                consumed.add(Triple.of(child, Vocabulary.RDF_TYPE, childType));
                out.add(child);
            }
        }
        return out;
    }

    // ------------------------------------------------------------------
    // Extensions and leftovers
    // ------------------------------------------------------------------

    /** Extension triples owned by {@code protocolId}; all are consumed. */
    public List<Triple> ownExtensions(String protocolId) {
        List<Triple> own = graph.extensionTriples(protocolId);
        consumed.addAll(own);
        return own;
    }

    public Optional<Triple> ownExtension(String protocolId, String fieldPath) {
        Iri predicate = ExtensionNamespace.of(protocolId).predicate(fieldPath);
        return graph.objects(agent, predicate).stream()
                .findFirst()
                .map(o -> {
                    Triple t = Triple.of(agent, predicate, o);
                    consumed.add(t);
                    return t;
                });
    }

    /** Triples nothing has consumed yet, in stable order. */
    public List<Triple> leftovers() {
        return graph.triples().stream()
                .filter(t -> !consumed.contains(t))
                .sorted(Triple.ORDER)
                .toList();
    }

    /**
     * Human-readable path of a triple relative to the agent node,
     * e.g. {@code "role"} or {@code "tool/search.inputSchema"}.
     */
    public String pathOf(Triple t) {
        String local = ExtensionNamespace.fieldPathOf(t.predicate())
                .map(p -> "ext:" + ExtensionNamespace.protocolOf(t.predicate()).orElse("?") + "/" + p)
                .orElseGet(() -> localName(t.predicate()));
        if (t.subject().equals(agent)) return local;
        String prefix = agent.value() + "/";
        String subject = t.subject().value().startsWith(prefix)
                ? t.subject().value().substring(prefix.length())
                : t.subject().value();
        return subject + "." + local;
    }

    private static String localName(Iri iri) {
        String v = iri.value();
        int cut = Math.max(v.lastIndexOf('#'), v.lastIndexOf('/'));
        return cut >= 0 ? v.substring(cut + 1) : v;
    }

    private interface Parser<T> { T parse(String value); }

    private static <T> T parse(Iri predicate, String value, Parser<T> parser) {
        try {
            return parser.parse(value);
        } catch (NumberFormatException e) {
            throw new TransformException("Malformed value '" + value + "' for " + predicate.value(), e);
        }
    }
}
