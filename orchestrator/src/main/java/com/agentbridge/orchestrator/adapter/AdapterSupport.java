package com.agentbridge.orchestrator.adapter;

import com.agentbridge.orchestrator.canonical.CanonicalGraph;
import com.agentbridge.orchestrator.canonical.ExtensionNamespace;
import com.agentbridge.orchestrator.canonical.Iri;
import com.agentbridge.orchestrator.canonical.Literal;
import com.agentbridge.orchestrator.canonical.Term;
import com.agentbridge.orchestrator.canonical.Triple;
import com.agentbridge.orchestrator.canonical.Vocabulary;
import com.agentbridge.orchestrator.error.TransformException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Helpers shared by the hand-written adapters: binding native maps onto typed
 * records, JSON literals, the extension namespace and the passthrough field.
 *
 * JSON is written with map keys sorted so that equal payloads always produce
 * equal literals, which keeps toCanonical deterministic.
 */
public final class AdapterSupport {

    /** Native field carrying canonical triples the target protocol cannot express. */
    public static final String PASSTHROUGH_FIELD = "x-agentbridge";

    private static final ObjectMapper JSON = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private AdapterSupport() {}

    // ------------------------------------------------------------------
    // Binding and JSON
    // ------------------------------------------------------------------

    /** Bind a native payload onto the adapter's typed view of it. */
    public static <T> T bind(NativePayload payload, Class<T> type) {
        try {
            return JSON.convertValue(payload.data(), type);
        } catch (IllegalArgumentException e) {
            throw new TransformException("Cannot read " + payload.protocolId()
                    + " payload: " + e.getMessage(), e);
        }
    }

    /** Bind a nested native value, e.g. one element of a heterogeneous list. */
    public static <T> T convert(Object value, Class<T> type) {
        try {
            return JSON.convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw new TransformException("Cannot read " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    /** Typed record back to a plain map, dropping null fields. */
    public static Map<String, Object> toMap(Object value) {
        Map<String, Object> map = JSON.convertValue(value, MAP_TYPE);
        map.values().removeIf(v -> v == null);
        return map;
    }

    public static String toJson(Object value) {
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new TransformException("JSON serialization failed", e);
        }
    }

    public static Object fromJson(String json) {
        try {
            return JSON.readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            throw new TransformException("Malformed JSON literal: " + e.getOriginalMessage(), e);
        }
    }

    /** Normalized JSON text of any value, so semantically equal schemas compare equal. */
    public static Literal jsonLiteral(Object value) {
        return Literal.ofJson(toJson(value));
    }

    /** Value of a literal, parsing JSON literals. */
    public static Object valueOf(Term term) {
        if (term instanceof Literal l && l.isJson()) return fromJson(l.value());
        return term.value();
    }

    /** Decoded last path segment of a child node IRI, used when its name literal is missing. */
    public static String lastSegment(Iri child) {
        String v = child.value();
        return URLDecoder.decode(v.substring(v.lastIndexOf('/') + 1), StandardCharsets.UTF_8);
    }

    public static String resolveAgentId(TransformOptions options, String identity) {
        if (options != null && options.agentId() != null && !options.agentId().isBlank()) {
            return options.agentId();
        }
        return Vocabulary.slug(identity);
    }

    // ------------------------------------------------------------------
    // Extension namespace
    // ------------------------------------------------------------------

    /** Write one native field into the adapter's extension namespace. */
    public static void preserve(String protocolId, String field, Object value, Iri agent,
                                CanonicalGraph.Builder graph, TransformReport.Builder report,
                                String reason) {
        if (value == null) return;
        Iri predicate = ExtensionNamespace.of(protocolId).predicate(field);
        graph.add(agent, predicate, value instanceof String s ? Literal.of(s) : jsonLiteral(value));
        report.unmapped(field, reason);
    }

    /** Every top-level field outside {@code known} goes to the extension namespace. */
    public static void preserveUnknown(String protocolId, Map<String, Object> data, Set<String> known,
                                       Iri agent, CanonicalGraph.Builder graph,
                                       TransformReport.Builder report) {
        data.forEach((field, value) -> {
            if (!known.contains(field) && !PASSTHROUGH_FIELD.equals(field)) {
                preserve(protocolId, field, value, agent, graph, report,
                        "no canonical equivalent; kept in extension namespace");
            }
        });
    }

    /** Own extension entries back into top-level native fields the adapter has not already set. */
    public static void restoreOwnExtensions(CanonicalReader reader, String protocolId,
                                            Map<String, Object> out, TransformReport.Builder report) {
        restoreOwnExtensions(reader, protocolId, out, report, Set.of());
    }

    /** As above, skipping extension fields the adapter has already restored into nested positions. */
    public static void restoreOwnExtensions(CanonicalReader reader, String protocolId,
                                            Map<String, Object> out, TransformReport.Builder report,
                                            Set<String> handled) {
        for (Triple t : reader.ownExtensions(protocolId)) {
            String field = ExtensionNamespace.fieldPathOf(t.predicate()).orElseThrow();
            if (handled.contains(field)) continue;
            out.putIfAbsent(field, valueOf(t.object()));
            report.mapped(field);
        }
    }

    // ------------------------------------------------------------------
    // Passthrough of what the target protocol cannot express
    // ------------------------------------------------------------------

    /**
     * Report every unconsumed triple and carry it in {@link #PASSTHROUGH_FIELD},
     * so a later hop back into a richer protocol can restore it.
     */
    public static void carryLeftovers(CanonicalReader reader, String protocolId,
                                      Map<String, Object> out, TransformReport.Builder report) {
        List<Triple> leftovers = reader.leftovers();
        if (leftovers.isEmpty()) return;

        List<Map<String, Object>> carried = new ArrayList<>();
        for (Triple t : leftovers) {
            String path = reader.pathOf(t);
            if (ExtensionNamespace.isExtension(t.predicate())) {
                report.unmapped(path, "foreign extension; carried in " + PASSTHROUGH_FIELD);
            } else {
                report.lossy(path, "no " + protocolId + " equivalent; carried in " + PASSTHROUGH_FIELD);
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("s", t.subject().value());
            entry.put("p", t.predicate().value());
            entry.put("o", t.object().value());
            if (t.object() instanceof Literal l) entry.put("datatype", l.datatype().value());
            carried.add(entry);
        }
        Map<String, Object> passthrough = new LinkedHashMap<>();
        passthrough.put("agent", reader.agent().value());
        passthrough.put("triples", carried);
        out.put(PASSTHROUGH_FIELD, passthrough);
    }

    /**
     * Re-emit triples carried by an earlier {@link #carryLeftovers}, rewriting
     * the old agent IRI to the current one.
     *
     * <p>Entries that are not objects with non-blank {@code s} and {@code p}
     * and a scalar {@code o} are skipped with a warning. Only a literal
     * {@code o} (one with a {@code datatype}) may be blank. So are entries typing a node as
     * {@code core:Agent}: the adapter has already typed its own agent node and
     * a graph holds exactly one.
     */
    public static void restorePassthrough(Map<String, Object> data, Iri agent,
                                          CanonicalGraph.Builder graph, TransformReport.Builder report) {
        Object raw = data.get(PASSTHROUGH_FIELD);
        if (raw == null) return;
        if (!(raw instanceof Map<?, ?> passthrough) || !(passthrough.get("triples") instanceof List<?> triples)) {
            report.warning("Ignoring malformed " + PASSTHROUGH_FIELD + " field");
            return;
        }
        String oldAgent = text(passthrough.get("agent"));
        for (int i = 0; i < triples.size(); i++) {
            Optional<Triple> triple = passthroughTriple(triples.get(i), oldAgent, agent);
            if (triple.isEmpty()) {
                report.warning("Skipping malformed " + PASSTHROUGH_FIELD + " entry " + i);
                continue;
            }
            Triple t = triple.get();
            if (t.predicate().equals(Vocabulary.RDF_TYPE) && t.object().equals(Vocabulary.AGENT)) {
                report.warning("Skipping " + PASSTHROUGH_FIELD + " entry " + i + " typing "
                        + t.subject().value() + " as an agent");
                continue;
            }
            graph.add(t.subject(), t.predicate(), t.object());
        }
        report.mapped(PASSTHROUGH_FIELD);
    }

    private static Optional<Triple> passthroughTriple(Object item, String oldAgent, Iri agent) {
        if (!(item instanceof Map<?, ?> entry)) return Optional.empty();
        String s = text(entry.get("s"));
        String p = text(entry.get("p"));
        Object o = entry.get("o");
        Object datatype = entry.get("datatype");
        if (s == null || p == null || o == null || o instanceof Map<?, ?> || o instanceof List<?>) {
            return Optional.empty();
        }
        // Literal values may be blank; IRIs and datatypes may not.
        if (datatype == null ? text(o) == null : text(datatype) == null) return Optional.empty();

        Iri subject = Iri.of(oldAgent == null ? s : rebase(s, oldAgent, agent.value()));
        Term object = datatype == null
                ? Iri.of(oldAgent == null ? text(o) : rebase(text(o), oldAgent, agent.value()))
                : new Literal(String.valueOf(o), Iri.of(text(datatype)));
        return Optional.of(new Triple(subject, Iri.of(p), object));
    }

    /** Non-blank string form of a scalar JSON value, or null. */
    private static String text(Object value) {
        if (value == null || value instanceof Map<?, ?> || value instanceof List<?>) return null;
        String s = String.valueOf(value);
        return s.isBlank() ? null : s;
    }

    private static String rebase(String iri, String oldAgent, String newAgent) {
        if (iri.equals(oldAgent)) return newAgent;
        if (iri.startsWith(oldAgent + "/")) return newAgent + iri.substring(oldAgent.length());
        return iri;
    }
}
