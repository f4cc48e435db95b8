package com.agentbridge.orchestrator.canonical;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Reserved per-adapter namespace for native fields with no core equivalent.
 *
 * Predicates look like {@code https://agentbridge.dev/ext/mcp#transport.env}:
 * the protocol id owns everything after {@code /ext/<id>#}. Extension triples
 * always hang off the agent node and carry a string or JSON literal.
 */
public record ExtensionNamespace(String protocolId) {

    public static final String BASE = "https://agentbridge.dev/ext/";

    public ExtensionNamespace {
        if (protocolId == null || protocolId.isBlank() || protocolId.contains("#") || protocolId.contains("/")) {
            throw new IllegalArgumentException("Invalid protocol id for extension namespace: " + protocolId);
        }
    }

    public static ExtensionNamespace of(String protocolId) {
        return new ExtensionNamespace(protocolId);
    }

    public String prefix() { return BASE + protocolId + "#"; }

    /** Predicate for a dotted native field path, e.g. {@code "transport.env"}. */
    public Iri predicate(String fieldPath) {
        return Iri.of(prefix() + Vocabulary.encode(fieldPath));
    }

    public boolean owns(Iri predicate) {
        return predicate.value().startsWith(prefix());
    }

    public static boolean isExtension(Iri predicate) {
        return predicate.value().startsWith(BASE);
    }

    /** Owning protocol of an extension predicate. */
    public static Optional<String> protocolOf(Iri predicate) {
        String v = predicate.value();
        if (!v.startsWith(BASE)) return Optional.empty();
        int hash = v.indexOf('#', BASE.length());
        return hash < 0 ? Optional.empty() : Optional.of(v.substring(BASE.length(), hash));
    }

    /** Native field path encoded in an extension predicate. */
    public static Optional<String> fieldPathOf(Iri predicate) {
        String v = predicate.value();
        int hash = v.indexOf('#', BASE.length());
        if (!v.startsWith(BASE) || hash < 0) return Optional.empty();
        return Optional.of(URLDecoder.decode(v.substring(hash + 1), StandardCharsets.UTF_8));
    }
}
