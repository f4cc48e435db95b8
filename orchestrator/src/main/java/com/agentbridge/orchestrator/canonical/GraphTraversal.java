package com.agentbridge.orchestrator.canonical;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Breadth-first walk over IRI-valued objects.
 *
 * Canonical graphs may contain cycles (a tool pointing back at its agent,
 * for instance), so every walk keeps a visited set and stops at maxDepth.
 */
public final class GraphTraversal {

    private GraphTraversal() {}

    /** Nodes reachable from {@code start} within {@code maxDepth} hops, start included. */
    public static Set<Iri> reachable(CanonicalGraph graph, Iri start, int maxDepth) {
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");

        Set<Iri> visited = new LinkedHashSet<>();
        Deque<Iri> frontier = new ArrayDeque<>();
        visited.add(start);
        frontier.add(start);

        for (int depth = 0; depth < maxDepth && !frontier.isEmpty(); depth++) {
            Deque<Iri> next = new ArrayDeque<>();
            for (Iri node : frontier) {
                for (Triple t : graph.about(node)) {
                    if (t.object() instanceof Iri target && !isClass(t) && visited.add(target)) {
                        next.add(target);
                    }
                }
            }
            frontier = next;
        }
        return visited;
    }

    /** All triples whose subject is reachable from {@code start} within {@code maxDepth} hops. */
    public static List<Triple> describe(CanonicalGraph graph, Iri start, int maxDepth) {
        Set<Iri> nodes = reachable(graph, start, maxDepth);
        List<Triple> out = new ArrayList<>();
        Set<Triple> seen = new HashSet<>();
        for (Iri node : nodes) {
            for (Triple t : graph.about(node)) {
                if (seen.add(t)) out.add(t);
            }
        }
        return out;
    }

    // rdf:type objects are classes, not neighbours.
    private static boolean isClass(Triple t) {
        return t.predicate().equals(Vocabulary.RDF_TYPE);
    }
}
