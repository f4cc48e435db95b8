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

import static com.agentbridge.orchestrator.canonical.Vocabulary.*;

/**
 * CrewAI agent definitions (role/goal schema).
 *
 * <p>{@code role} is the identity field. {@code llm} is either a
 * {@code "provider/model"} string or an object with provider, model,
 * temperature and max_tokens. Tools are referenced by name only, so a tool's
 * description and schema cannot be written back and are carried in the
 * passthrough field.
 */
@Component
public class CrewAiAdapter implements ProtocolAdapter {

    public static final String PROTOCOL = "crewai";

    private static final Set<String> KNOWN_FIELDS = Set.of(
            "name", "role", "goal", "backstory", "tools", "llm", "allow_delegation",
            "max_iter", "memory", "system_template", "verbose");

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Agent(String name, String role, String goal, String backstory,
                 List<Object> tools, Object llm,
                 @JsonProperty("allow_delegation") Boolean allowDelegation,
                 @JsonProperty("max_iter")         Long maxIter,
                 Boolean memory,
                 @JsonProperty("system_template")  String systemTemplate,
                 Boolean verbose) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Llm(String provider, String model, Double temperature,
               @JsonProperty("max_tokens") Long maxTokens) {}

    private static final AdapterManifest MANIFEST = new AdapterManifest(
            PROTOCOL, "1.0.0",
            "CrewAI agent: role, goal, backstory, named tools and LLM settings.",
            List.of(
                    new AdapterCapability("role-goal", "Role, goal and backstory identity", true),
                    new AdapterCapability("tools", "Tools referenced by name", true),
                    new AdapterCapability("llm-config", "Provider, model and sampling settings", true),
                    new AdapterCapability("delegation", "Delegation to other crew members", true),
                    new AdapterCapability("memory", "Crew memory toggle", true)));

    @Override public AdapterManifest manifest() { return MANIFEST; }

    // ------------------------------------------------------------------
    // Native → canonical
    // ------------------------------------------------------------------

    @Override
    public CanonicalResult toCanonical(NativePayload payload, TransformOptions options) {
        TransformReport.Builder report = TransformReport.builder();
        Agent src = AdapterSupport.bind(payload, Agent.class);
        if (src.role() == null || src.role().isBlank()) {
            throw new TransformException("crewai payload is missing required identity field 'role'");
        }

        String agentId = AdapterSupport.resolveAgentId(options,
                src.name() != null && !src.name().isBlank() ? src.name() : src.role());
        Iri agent = agentIri(agentId);
        CanonicalGraph.Builder graph = CanonicalGraph.builder().type(agent, AGENT);

        graph.literal(agent, ROLE, src.role());
        report.mapped("role");
        if (src.name() != null) { graph.literal(agent, NAME, src.name()); report.mapped("name"); }
        if (src.goal() != null) { graph.literal(agent, GOAL, src.goal()); report.mapped("goal"); }
        if (src.backstory() != null) { graph.literal(agent, BACKSTORY, src.backstory()); report.mapped("backstory"); }
        if (src.systemTemplate() != null) {
            graph.literal(agent, SYSTEM_PROMPT, src.systemTemplate());
            report.mapped("system_template");
        }

        if (src.tools() != null) {
            for (Object raw : src.tools()) {
                String toolName = toolName(raw);
                Iri node = childIri(agentId, "tool", toolName);
                graph.add(agent, HAS_TOOL, node).type(node, TOOL).literal(node, NAME, toolName);
                if (raw instanceof Map<?, ?> m && m.size() > 1) {
                    report.lossy("tools[" + toolName + "]", "only the tool name is kept");
                } else {
                    report.mapped("tools[" + toolName + "]");
                }
            }
        }

        if (src.llm() != null) {
            Llm llm = llm(src.llm());
            graph.literal(agent, LLM_PROVIDER, llm.provider());
            graph.literal(agent, LLM_MODEL, llm.model());
            if (llm.temperature() != null) graph.literal(agent, TEMPERATURE, Literal.ofDecimal(llm.temperature()));
            if (llm.maxTokens() != null) graph.literal(agent, MAX_TOKENS, Literal.ofInteger(llm.maxTokens()));
            report.mapped("llm");
        }
        if (src.allowDelegation() != null) {
            graph.literal(agent, ALLOW_DELEGATION, Literal.ofBoolean(src.allowDelegation()));
            report.mapped("allow_delegation");
        }
        if (src.maxIter() != null) {
            graph.literal(agent, MAX_ITERATIONS, Literal.ofInteger(src.maxIter()));
            report.mapped("max_iter");
        }
        if (src.memory() != null) {
            graph.literal(agent, MEMORY_ENABLED, Literal.ofBoolean(src.memory()));
            report.mapped("memory");
        }
        if (src.verbose() != null) {
            report.lossy("verbose", "runtime logging switch, not part of the agent description");
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
    public NativeResult fromCanonical(CanonicalGraph graph, TransformOptions options) {
        TransformReport.Builder report = TransformReport.builder();
        CanonicalReader reader = CanonicalReader.of(graph);
        Map<String, Object> out = new LinkedHashMap<>();

        Optional<String> name = reader.literal(NAME);
        Optional<String> role = reader.literal(ROLE);
        if (role.isPresent()) {
            out.put("role", role.get());
            report.mapped("role");
        } else {
            String fallback = name.or(reader::agentId).orElseThrow(() ->
                    new TransformException("Agent node has no role, name or agent id"));
            out.put("role", fallback);
            report.warning("Agent has no role; using '" + fallback + "'");
        }
        name.ifPresent(n -> { out.put("name", n); report.mapped("name"); });
        reader.literal(GOAL).ifPresent(v -> { out.put("goal", v); report.mapped("goal"); });
        reader.literal(BACKSTORY).ifPresent(v -> { out.put("backstory", v); report.mapped("backstory"); });
        reader.literal(SYSTEM_PROMPT).ifPresent(v -> { out.put("system_template", v); report.mapped("system_template"); });

        List<String> tools = new ArrayList<>();
        for (Iri node : reader.children(HAS_TOOL, TOOL)) {
            String toolName = reader.literal(node, NAME).orElseGet(() -> AdapterSupport.lastSegment(node));
            tools.add(toolName);
            report.mapped("tools[" + toolName + "]");
        }
        if (!tools.isEmpty()) out.put("tools", tools);

        Optional<String> provider = reader.literal(LLM_PROVIDER);
        Optional<String> model = reader.literal(LLM_MODEL);
        Optional<Double> temperature = reader.decimal(reader.agent(), TEMPERATURE);
        Optional<Long> maxTokens = reader.integer(reader.agent(), MAX_TOKENS);
        if (provider.isPresent() || model.isPresent() || temperature.isPresent() || maxTokens.isPresent()) {
            if (temperature.isEmpty() && maxTokens.isEmpty() && model.isPresent()) {
                out.put("llm", provider.map(p -> p + "/" + model.get()).orElse(model.get()));
            } else {
                out.put("llm", AdapterSupport.toMap(new Llm(provider.orElse(null), model.orElse(null),
                        temperature.orElse(null), maxTokens.orElse(null))));
            }
            report.mapped("llm");
        }
        reader.bool(reader.agent(), ALLOW_DELEGATION)
              .ifPresent(v -> { out.put("allow_delegation", v); report.mapped("allow_delegation"); });
        reader.integer(reader.agent(), MAX_ITERATIONS)
              .ifPresent(v -> { out.put("max_iter", v); report.mapped("max_iter"); });
        reader.bool(reader.agent(), MEMORY_ENABLED)
              .ifPresent(v -> { out.put("memory", v); report.mapped("memory"); });

        AdapterSupport.restoreOwnExtensions(reader, PROTOCOL, out, report);
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

        if (!(data.get("role") instanceof String role) || role.isBlank()) {
            errors.add("'role' is required");
        }
        if (data.get("goal") == null) {
            warnings.add("agent has no 'goal'");
        }
        Object tools = data.get("tools");
        if (tools != null && !(tools instanceof List<?>)) {
            errors.add("'tools' must be a list of tool names");
        }
        Object llm = data.get("llm");
        if (llm != null && !(llm instanceof String) && !(llm instanceof Map<?, ?>)) {
            errors.add("'llm' must be a string or an object");
        }
        return ValidationResult.of(errors, warnings);
    }

    // Tool objects are accepted on input; only their name survives in CrewAI's model.
    private static String toolName(Object raw) {
        if (raw instanceof String s && !s.isBlank()) return s;
        if (raw instanceof Map<?, ?> m && m.get("name") instanceof String s && !s.isBlank()) return s;
        throw new TransformException("crewai tool entries must be tool names");
    }

    static Llm llm(Object raw) {
        if (raw instanceof String s) {
            int slash = s.indexOf('/');
            return slash > 0
                    ? new Llm(s.substring(0, slash), s.substring(slash + 1), null, null)
                    : new Llm(null, s, null, null);
        }
        return AdapterSupport.convert(raw, Llm.class);
    }
}
