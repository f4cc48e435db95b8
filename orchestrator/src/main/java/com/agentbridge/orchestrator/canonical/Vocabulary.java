package com.agentbridge.orchestrator.canonical;

import com.agentbridge.orchestrator.error.TransformException;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;

/**
 * The protocol-neutral core ontology.
 *
 * Only framework-independent terms live here. Anything specific to one
 * protocol is minted under {@link ExtensionNamespace} instead.
 */
public final class Vocabulary {

    public static final String CORE_NS   = "https://agentbridge.dev/ontology#";
    public static final String AGENT_NS  = "https://agentbridge.dev/agent/";
    public static final String RDF_NS    = "http://www.w3.org/1999/02/22-rdf-syntax-ns#";
    public static final String XSD_NS    = "http://www.w3.org/2001/XMLSchema#";

    // ------------------------------------------------------------------
    // Datatypes
    // ------------------------------------------------------------------

    public static final Iri XSD_STRING  = Iri.of(XSD_NS + "string");
    public static final Iri XSD_INTEGER = Iri.of(XSD_NS + "integer");
    public static final Iri XSD_DECIMAL = Iri.of(XSD_NS + "decimal");
    public static final Iri XSD_BOOLEAN = Iri.of(XSD_NS + "boolean");
    public static final Iri RDF_JSON    = Iri.of(RDF_NS + "JSON");

    // ------------------------------------------------------------------
    // Classes
    // ------------------------------------------------------------------

    public static final Iri RDF_TYPE = Iri.of(RDF_NS + "type");
    public static final Iri AGENT    = core("Agent");
    public static final Iri TOOL     = core("Tool");
    public static final Iri PROMPT   = core("Prompt");
    public static final Iri RESOURCE = core("Resource");

    // ------------------------------------------------------------------
    // Identity
    // ------------------------------------------------------------------

    public static final Iri NAME        = core("name");
    public static final Iri DESCRIPTION = core("description");
    public static final Iri VERSION     = core("version");
    public static final Iri ROLE        = core("role");
    public static final Iri GOAL        = core("goal");
    public static final Iri BACKSTORY   = core("backstory");
    public static final Iri TAG         = core("tag");

    // ------------------------------------------------------------------
    // Capabilities
    // ------------------------------------------------------------------

    public static final Iri HAS_TOOL       = core("hasTool");
    public static final Iri HAS_CAPABILITY = core("hasCapability");
    public static final Iri INPUT_SCHEMA   = core("inputSchema");
    public static final Iri OUTPUT_SCHEMA  = core("outputSchema");

    // ------------------------------------------------------------------
    // Instructions
    // ------------------------------------------------------------------

    public static final Iri SYSTEM_PROMPT    = core("systemPrompt");
    public static final Iri INSTRUCTION      = core("instruction");
    public static final Iri HAS_PROMPT       = core("hasPrompt");
    public static final Iri PROMPT_ARGUMENTS = core("promptArguments");

    // ------------------------------------------------------------------
    // State
    // ------------------------------------------------------------------

    public static final Iri MEMORY_ENABLED = core("memoryEnabled");
    public static final Iri MEMORY_TYPE    = core("memoryType");
    public static final Iri CONTEXT_WINDOW = core("contextWindow");
    public static final Iri HAS_RESOURCE   = core("hasResource");
    public static final Iri RESOURCE_URI   = core("resourceUri");
    public static final Iri MIME_TYPE      = core("mimeType");

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    public static final Iri LLM_PROVIDER      = core("llmProvider");
    public static final Iri LLM_MODEL         = core("llmModel");
    public static final Iri TEMPERATURE       = core("temperature");
    public static final Iri MAX_TOKENS        = core("maxTokens");
    public static final Iri MAX_ITERATIONS    = core("maxIterations");
    public static final Iri ALLOW_DELEGATION  = core("allowDelegation");
    public static final Iri SUPPORTS_PROTOCOL = core("supportsProtocol");
    public static final Iri ENDPOINT          = core("endpoint");

    private Vocabulary() {}

    public static Iri core(String localName) {
        return Iri.of(CORE_NS + localName);
    }

    // ------------------------------------------------------------------
    // Identifier construction scoped to an agent
    // ------------------------------------------------------------------

    public static Iri agentIri(String agentId) {
        return Iri.of(AGENT_NS + encode(agentId));
    }

    /** Child node of an agent, e.g. {@code .../agent/ada/tool/search}. */
    public static Iri childIri(String agentId, String kind, String name) {
        return Iri.of(AGENT_NS + encode(agentId) + "/" + kind + "/" + encode(name));
    }

    /** Inverse of {@link #agentIri}; empty for IRIs outside the agent namespace or child nodes. */
    public static Optional<String> agentIdOf(Iri iri) {
        if (!iri.value().startsWith(AGENT_NS)) return Optional.empty();
        String rest = iri.value().substring(AGENT_NS.length());
        if (rest.isEmpty() || rest.contains("/")) return Optional.empty();
        return Optional.of(URLDecoder.decode(rest, StandardCharsets.UTF_8));
    }

    /**
     * Derive a stable agent id from a display name: lower-case, runs of
     * anything but letters and digits collapse to a single '-'.
     *
     * @throws TransformException if nothing identifying is left
     */
    public static String slug(String name) {
        if (name == null) throw new TransformException("Cannot derive an agent id from a null name");
        String slug = name.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-+|-+$)", "");
        if (slug.isEmpty()) {
            throw new TransformException("Cannot derive an agent id from name '" + name + "'");
        }
        return slug;
    }

    static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
