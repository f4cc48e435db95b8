package com.agentbridge.orchestrator.canonical;

import java.util.Objects;

/**
 * Typed literal value. Two literals are equal only when both the lexical form
 * and the datatype match, so "1"^^xsd:integer and "1"^^xsd:string differ.
 */
public record Literal(String value, Iri datatype) implements Term {

    public Literal {
        Objects.requireNonNull(value, "lexical value");
        Objects.requireNonNull(datatype, "datatype");
    }

    public static Literal of(String value)        { return new Literal(value, Vocabulary.XSD_STRING); }
    public static Literal ofInteger(long value)   { return new Literal(Long.toString(value), Vocabulary.XSD_INTEGER); }
    public static Literal ofDecimal(double value) { return new Literal(Double.toString(value), Vocabulary.XSD_DECIMAL); }
    public static Literal ofBoolean(boolean value){ return new Literal(Boolean.toString(value), Vocabulary.XSD_BOOLEAN); }
    public static Literal ofJson(String json)     { return new Literal(json, Vocabulary.RDF_JSON); }

    public boolean isJson() { return Vocabulary.RDF_JSON.equals(datatype); }

    @Override
    public String toString() { return "\"" + value + "\"^^" + datatype; }
}
