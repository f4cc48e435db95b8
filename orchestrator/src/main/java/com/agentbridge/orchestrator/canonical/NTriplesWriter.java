package com.agentbridge.orchestrator.canonical;

/**
 * Serializes a canonical graph as N-Triples, one statement per line in
 * {@link Triple#ORDER}, so identical graphs always produce identical text.
 */
public final class NTriplesWriter {

    private NTriplesWriter() {}

    public static String write(CanonicalGraph graph) {
        StringBuilder sb = new StringBuilder();
        graph.triples().stream().sorted(Triple.ORDER).forEach(t -> {
            sb.append(iri(t.subject())).append(' ')
              .append(iri(t.predicate())).append(' ')
              .append(term(t.object())).append(" .\n");
        });
        return sb.toString();
    }

    private static String term(Term term) {
        if (term instanceof Iri i) return iri(i);
        Literal l = (Literal) term;
        String quoted = "\"" + escape(l.value()) + "\"";
        return Vocabulary.XSD_STRING.equals(l.datatype()) ? quoted : quoted + "^^" + iri(l.datatype());
    }

    private static String iri(Iri iri) {
        return "<" + iri.value() + ">";
    }

    static String escape(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (char c : s.toCharArray()) {
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"'  -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default   -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
