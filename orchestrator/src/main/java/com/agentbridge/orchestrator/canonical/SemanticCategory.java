package com.agentbridge.orchestrator.canonical;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.agentbridge.orchestrator.canonical.Vocabulary.*;

/**
 * Closed set of semantic categories every adapter maps into.
 * Each core predicate belongs to exactly one category; extension
 * predicates belong to none.
 */
public enum SemanticCategory {

    IDENTITY(RDF_TYPE, NAME, DESCRIPTION, VERSION, ROLE, GOAL, BACKSTORY, TAG),
    CAPABILITIES(HAS_TOOL, HAS_CAPABILITY, INPUT_SCHEMA, OUTPUT_SCHEMA),
    INSTRUCTIONS(SYSTEM_PROMPT, INSTRUCTION, HAS_PROMPT, PROMPT_ARGUMENTS),
    STATE(MEMORY_ENABLED, MEMORY_TYPE, CONTEXT_WINDOW, HAS_RESOURCE, RESOURCE_URI, MIME_TYPE),
    EXECUTION(LLM_PROVIDER, LLM_MODEL, TEMPERATURE, MAX_TOKENS, MAX_ITERATIONS,
              ALLOW_DELEGATION, SUPPORTS_PROTOCOL, ENDPOINT);

    private final Set<Iri> predicates;

    SemanticCategory(Iri... predicates) {
        this.predicates = Set.of(predicates);
    }

    public Set<Iri> predicates() { return predicates; }

    private static final Map<Iri, SemanticCategory> BY_PREDICATE = Stream.of(values())
            .flatMap(c -> c.predicates.stream().map(p -> Map.entry(p, c)))
            .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));

    /** Category of a core predicate; empty for extension or unknown predicates. */
    public static Optional<SemanticCategory> of(Iri predicate) {
        return Optional.ofNullable(BY_PREDICATE.get(predicate));
    }

    public static boolean isCore(Iri predicate) {
        return BY_PREDICATE.containsKey(predicate);
    }
}
