package com.agentbridge.orchestrator.store;

import com.agentbridge.orchestrator.canonical.CanonicalGraph;
import com.agentbridge.orchestrator.canonical.Iri;
import com.agentbridge.orchestrator.canonical.Literal;
import com.agentbridge.orchestrator.canonical.Term;
import com.agentbridge.orchestrator.canonical.Triple;
import com.agentbridge.orchestrator.error.StoreException;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

/**
 * Canonical graph ⇄ JSON text, one {@code {s, p, o, datatype?}} object per
 * triple in {@link Triple#ORDER}. A missing datatype marks an IRI object.
 */
public class GraphCodec {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Row(String s, String p, String o, String datatype) {}

    private static final TypeReference<List<Row>> ROWS = new TypeReference<>() {};
    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public GraphCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encode(CanonicalGraph graph) {
        List<Row> rows = graph.triples().stream()
                .sorted(Triple.ORDER)
                .map(t -> new Row(t.subject().value(), t.predicate().value(), t.object().value(),
                        t.object() instanceof Literal l ? l.datatype().value() : null))
                .toList();
        try {
            return mapper.writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new StoreException("Cannot encode canonical graph", e);
        }
    }

    public CanonicalGraph decode(String json) {
        try {
            List<Row> rows = mapper.readValue(json, ROWS);
            return CanonicalGraph.of(rows.stream().map(GraphCodec::toTriple).toList());
        } catch (JsonProcessingException e) {
            throw new StoreException("Stored canonical graph is corrupt: " + e.getOriginalMessage(), e);
        }
    }

    public String encodeList(List<String> values) {
        try {
            return mapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new StoreException("Cannot encode list", e);
        }
    }

    public List<String> decodeList(String json) {
        try {
            return mapper.readValue(json, STRINGS);
        } catch (JsonProcessingException e) {
            throw new StoreException("Stored list is corrupt: " + e.getOriginalMessage(), e);
        }
    }

    private static Triple toTriple(Row row) {
        Term object = row.datatype() == null
                ? Iri.of(row.o())
                : new Literal(row.o(), Iri.of(row.datatype()));
        return Triple.of(Iri.of(row.s()), Iri.of(row.p()), object);
    }
}
