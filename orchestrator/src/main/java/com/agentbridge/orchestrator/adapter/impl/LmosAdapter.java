package com.agentbridge.orchestrator.adapter.impl;

import com.agentbridge.orchestrator.adapter.*;
import com.agentbridge.orchestrator.canonical.CanonicalGraph;
import com.agentbridge.orchestrator.canonical.Iri;
import com.agentbridge.orchestrator.canonical.Literal;
import com.agentbridge.orchestrator.error.TransformException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import static com.agentbridge.orchestrator.canonical.Vocabulary.*;

/**
 * LMOS agent descriptions, a W3C Thing Description profile.
 *
 * <p>{@code title} is the identity field. Actions become tool nodes with
 * input/output schemas; the {@code lmos:} prefixed blocks carry capabilities,
 * LLM configuration, memory and supported protocols. {@code @context},
 * {@code id} and {@code forms} are kept in the {@code lmos} extension namespace.
 */
@Component
public class LmosAdapter implements ProtocolAdapter {

    public static final String PROTOCOL = "lmos";

    static final String ACTION_TITLES = "actionTitles";

    private static final Set<String> KNOWN_FIELDS = Set.of(
            "title", "description", "version", "actions",
            "lmos:capabilities", "lmos:llmConfig", "lmos:memory", "lmos:protocols");

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ThingDescription(String title, String description, Map<String, Object> version,
                            Map<String, Action> actions,
                            @JsonProperty("lmos:capabilities") List<String> capabilities,
                            @JsonProperty("lmos:llmConfig")    LlmConfig llmConfig,
                            @JsonProperty("lmos:memory")       Memory memory,
                            @JsonProperty("lmos:protocols")    Map<String, Boolean> protocols) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Action(String title, String description, Map<String, Object> input, Map<String, Object> output) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record LlmConfig(String provider, String model, Double temperature, Long maxTokens, String systemPrompt) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Memory(String type, Long contextWindow) {}

    private static final AdapterManifest MANIFEST = new AdapterManifest(
            PROTOCOL, "1.0.0",
            "LMOS Thing Description: actions, capabilities, LLM and memory configuration.",
            List.of(
                    new AdapterCapability("actions", "Actions with input and output schemas", true),
                    new AdapterCapability("capabilities", "Declared capability names", true),
                    new AdapterCapability("llm-config", "Provider, model, sampling and system prompt", true),
                    new AdapterCapability("memory", "Memory type and context window", true),
                    new AdapterCapability("protocols", "Supported interaction protocols", true)));

    @Override public AdapterManifest manifest() { return MANIFEST; }

    // ------------------------------------------------------------------
    // Native → canonical
    // ------------------------------------------------------------------

    @Override
    public CanonicalResult toCanonical(NativePayload payload, TransformOptions options) {
        TransformReport.Builder report = TransformReport.builder();
        ThingDescription td = AdapterSupport.bind(payload, ThingDescription.class);
        if (td.title() == null || td.title().isBlank()) {
            throw new TransformException("lmos payload is missing required identity field 'title'");
        }

        String agentId = AdapterSupport.resolveAgentId(options, td.title());
        Iri agent = agentIri(agentId);
        CanonicalGraph.Builder graph = CanonicalGraph.builder().type(agent, AGENT);

        graph.literal(agent, NAME, td.title());
        report.mapped("title");
        if (td.description() != null) {
            graph.literal(agent, DESCRIPTION, td.description());
            report.mapped("description");
        }
        if (td.version() != null) {
            Object instance = td.version().get("instance");
            if (instance != null) {
                graph.literal(agent, VERSION, String.valueOf(instance));
                report.mapped("version.instance");
            }
            td.version().keySet().stream()
                    .filter(k -> !"instance".equals(k))
                    .forEach(k -> report.lossy("version." + k, "only the instance version is kept"));
        }

        Map<String, Object> titles = new TreeMap<>();
        if (td.actions() != null) {
            td.actions().forEach((actionName, action) -> {
                Iri node = childIri(agentId, "tool", actionName);
                graph.add(agent, HAS_TOOL, node).type(node, TOOL).literal(node, NAME, actionName);
                if (action != null) {
                    graph.literal(node, DESCRIPTION, action.description());
                    if (action.input() != null) graph.literal(node, INPUT_SCHEMA, AdapterSupport.jsonLiteral(action.input()));
                    if (action.output() != null) graph.literal(node, OUTPUT_SCHEMA, AdapterSupport.jsonLiteral(action.output()));
                    if (action.title() != null) titles.put(actionName, action.title());
                }
                report.mapped("actions." + actionName);
            });
        }
        if (!titles.isEmpty()) {
            AdapterSupport.preserve(PROTOCOL, ACTION_TITLES, titles, agent, graph, report,
                    "action titles have no canonical equivalent");
        }

        if (td.capabilities() != null) {
            td.capabilities().forEach(c -> graph.literal(agent, HAS_CAPABILITY, c));
            report.mapped("lmos:capabilities");
        }

        LlmConfig llm = td.llmConfig();
        if (llm != null) {
            graph.literal(agent, LLM_PROVIDER, llm.provider())
                 .literal(agent, LLM_MODEL, llm.model())
                 .literal(agent, SYSTEM_PROMPT, llm.systemPrompt());
            if (llm.temperature() != null) graph.literal(agent, TEMPERATURE, Literal.ofDecimal(llm.temperature()));
            if (llm.maxTokens() != null) graph.literal(agent, MAX_TOKENS, Literal.ofInteger(llm.maxTokens()));
            report.mapped("lmos:llmConfig");
        }

        if (td.memory() != null) {
            graph.literal(agent, MEMORY_ENABLED, Literal.ofBoolean(true))
                 .literal(agent, MEMORY_TYPE, td.memory().type());
            if (td.memory().contextWindow() != null) {
                graph.literal(agent, CONTEXT_WINDOW, Literal.ofInteger(td.memory().contextWindow()));
            }
            report.mapped("lmos:memory");
        }

        if (td.protocols() != null) {
            td.protocols().forEach((protocol, supported) -> {
                if (Boolean.TRUE.equals(supported)) {
                    graph.literal(agent, SUPPORTS_PROTOCOL, protocol);
                    report.mapped("lmos:protocols." + protocol);
                } else {
                    report.lossy("lmos:protocols." + protocol, "unsupported protocols are not recorded");
                }
            });
        }

        AdapterSupport.preserveUnknown(PROTOCOL, payload.data(), KNOWN_FIELDS, agent, graph, report);
        AdapterSupport.restorePassthrough(payload.data(), agent, graph, report);
        report.warnings(validate(payload).warnings());

        return new CanonicalResult(graph.build(), agentId, report.build());
    }

    // ------------------------------------------------------------------
    // Canonical → native
    // ------------------------------------------------------------------

    @Override
    @SuppressWarnings("unchecked")
    public NativeResult fromCanonical(CanonicalGraph graph, TransformOptions options) {
        TransformReport.Builder report = TransformReport.builder();
        CanonicalReader reader = CanonicalReader.of(graph);
        Map<String, Object> out = new LinkedHashMap<>();

        String title = reader.literal(NAME).orElse(null);
        if (title == null) {
            title = reader.agentId().orElseThrow(() ->
                    new TransformException("Agent node has neither a name nor an agent id"));
            report.warning("Agent has no name; using its id '" + title + "' as title");
        } else {
            report.mapped("title");
        }
        out.put("title", title);
        reader.literal(DESCRIPTION).ifPresent(v -> { out.put("description", v); report.mapped("description"); });
        reader.literal(VERSION).ifPresent(v -> {
            out.put("version", Map.of("instance", v));
            report.mapped("version.instance");
        });

        Map<String, Object> titles = reader.ownExtension(PROTOCOL, ACTION_TITLES)
                .map(t -> AdapterSupport.valueOf(t.object()))
                .filter(Map.class::isInstance)
                .map(m -> (Map<String, Object>) m)
                .orElse(Map.of());
        if (!titles.isEmpty()) report.mapped(ACTION_TITLES);

        Map<String, Object> actions = new LinkedHashMap<>();
        for (Iri node : reader.children(HAS_TOOL, TOOL)) {
            String actionName = reader.literal(node, NAME).orElseGet(() -> AdapterSupport.lastSegment(node));
            Object actionTitle = titles.get(actionName);
            Action action = new Action(
                    actionTitle == null ? null : String.valueOf(actionTitle),
                    reader.literal(node, DESCRIPTION).orElse(null),
                    schema(reader.typedLiteral(node, INPUT_SCHEMA)),
                    schema(reader.typedLiteral(node, OUTPUT_SCHEMA)));
            actions.put(actionName, AdapterSupport.toMap(action));
            report.mapped("actions." + actionName);
        }
        if (!actions.isEmpty()) out.put("actions", actions);

        List<String> capabilities = reader.literals(HAS_CAPABILITY);
        if (!capabilities.isEmpty()) {
            out.put("lmos:capabilities", capabilities);
            report.mapped("lmos:capabilities");
        }

        Iri a = reader.agent();
        LlmConfig llm = new LlmConfig(
                reader.literal(LLM_PROVIDER).orElse(null),
                reader.literal(LLM_MODEL).orElse(null),
                reader.decimal(a, TEMPERATURE).orElse(null),
                reader.integer(a, MAX_TOKENS).orElse(null),
                reader.literal(SYSTEM_PROMPT).orElse(null));
        Map<String, Object> llmMap = AdapterSupport.toMap(llm);
        if (!llmMap.isEmpty()) {
            out.put("lmos:llmConfig", llmMap);
            report.mapped("lmos:llmConfig");
        }

        Optional<Boolean> memoryEnabled = reader.bool(a, MEMORY_ENABLED);
        Optional<String> memoryType = reader.literal(MEMORY_TYPE);
        Optional<Long> contextWindow = reader.integer(a, CONTEXT_WINDOW);
        if (memoryEnabled.orElse(memoryType.isPresent() || contextWindow.isPresent())) {
            out.put("lmos:memory", AdapterSupport.toMap(
                    new Memory(memoryType.orElse(null), contextWindow.orElse(null))));
            report.mapped("lmos:memory");
        } else if (memoryEnabled.isPresent()) {
            report.lossy("memoryEnabled", "a disabled memory block cannot be expressed");
        }

        List<String> protocols = reader.literals(SUPPORTS_PROTOCOL);
        if (!protocols.isEmpty()) {
            Map<String, Boolean> supported = new LinkedHashMap<>();
            protocols.forEach(p -> supported.put(p, true));
            out.put("lmos:protocols", supported);
            report.mapped("lmos:protocols");
        }

        AdapterSupport.restoreOwnExtensions(reader, PROTOCOL, out, report, Set.of(ACTION_TITLES));
        AdapterSupport.carryLeftovers(reader, PROTOCOL, out, report);

        return new NativeResult(NativePayload.of(PROTOCOL, out), report.build());
    }

    // ------------------------------------------------------------------
    // Validation
    // ------------------------------------------------------------------

    @Override
    public ValidationResult validate(NativePayload payload) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Map<String, Object> data = payload.data();

        if (!(data.get("title") instanceof String title) || title.isBlank()) {
            errors.add("'title' is required");
        }
        if (data.get("id") == null) {
            warnings.add("thing description has no 'id'");
        }
        Object actions = data.get("actions");
        if (actions != null && !(actions instanceof Map<?, ?>)) {
            errors.add("'actions' must be an object keyed by action name");
        }
        Object protocols = data.get("lmos:protocols");
        if (protocols != null && !(protocols instanceof Map<?, ?>)) {
            errors.add("'lmos:protocols' must map protocol names to booleans");
        }
        return ValidationResult.of(errors, warnings);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> schema(Optional<Literal> literal) {
        return literal.map(AdapterSupport::valueOf)
                .filter(Map.class::isInstance)
                .map(m -> (Map<String, Object>) m)
                .orElse(null);
    }
}
