package com.agentbridge.orchestrator.store;

import com.agentbridge.orchestrator.canonical.CanonicalGraph;
import com.agentbridge.orchestrator.canonical.Iri;
import com.agentbridge.orchestrator.canonical.Vocabulary;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/** Summary building and criteria matching shared by the store implementations. */
public final class Discovery {

    private Discovery() {}

    public static AgentSummary summarize(AgentSnapshot latest) {
        CanonicalGraph graph = latest.graph();
        Iri agent = Vocabulary.agentIri(latest.agentId());
        String name = graph.literal(agent, Vocabulary.NAME)
                .or(() -> graph.literal(agent, Vocabulary.ROLE))
                .orElse(latest.agentId());
        return new AgentSummary(latest.agentId(), name, latest.version(),
                latest.metadata().sourceFormat(), latest.metadata().timestamp(),
                capabilities(graph, agent));
    }

    public static boolean matches(AgentSnapshot latest, DiscoveryCriteria criteria) {
        CanonicalGraph graph = latest.graph();
        Iri agent = Vocabulary.agentIri(latest.agentId());

        if (criteria.capability() != null && !capabilities(graph, agent).contains(criteria.capability())) {
            return false;
        }
        if (criteria.protocol() != null
                && !criteria.protocol().equals(latest.metadata().sourceFormat())
                && !graph.literals(agent, Vocabulary.SUPPORTS_PROTOCOL).contains(criteria.protocol())) {
            return false;
        }
        if (criteria.textQuery() != null && !criteria.textQuery().isBlank()) {
            String needle = criteria.textQuery().toLowerCase(Locale.ROOT);
            return Stream.of(Vocabulary.NAME, Vocabulary.DESCRIPTION, Vocabulary.ROLE, Vocabulary.GOAL)
                    .flatMap(p -> graph.literals(agent, p).stream())
                    .anyMatch(v -> v.toLowerCase(Locale.ROOT).contains(needle));
        }
        return true;
    }

    // Tool names followed by declared capabilities.
    private static List<String> capabilities(CanonicalGraph graph, Iri agent) {
        List<String> out = new ArrayList<>();
        for (Iri tool : graph.iris(agent, Vocabulary.HAS_TOOL)) {
            graph.literal(tool, Vocabulary.NAME).ifPresent(out::add);
        }
        out.addAll(graph.literals(agent, Vocabulary.HAS_CAPABILITY));
        return out.stream().distinct().toList();
    }
}
