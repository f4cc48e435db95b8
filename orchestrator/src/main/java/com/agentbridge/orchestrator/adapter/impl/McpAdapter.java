package com.agentbridge.orchestrator.adapter.impl;

import com.agentbridge.orchestrator.adapter.*;
import com.agentbridge.orchestrator.canonical.CanonicalGraph;
import com.agentbridge.orchestrator.canonical.Iri;
import com.agentbridge.orchestrator.error.TransformException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.agentbridge.orchestrator.canonical.Vocabulary.*;

/**
 * Model Context Protocol server descriptions (tool-calling schema).
 *
 * <pre>
 * { "name": "...", "version": "...", "description": "...",
 *   "tools":     [ "search" | {"name", "description", "inputSchema"} ],
 *   "resources": [ {"uri", "name", "description", "mimeType"} ],
 *   "prompts":   [ {"name", "description", "arguments"} ] }
 * </pre>
 *
 * Transport and server capability blocks have no core equivalent and travel
 * in the {@code mcp} extension namespace.
 */
@Component
public class McpAdapter implements ProtocolAdapter {

    public static final String PROTOCOL = "mcp";

    private static final Set<String> KNOWN_FIELDS =
            Set.of("name", "version", "description", "tools", "resources", "prompts");

    // ------------------------------------------------------------------
    // Native shape
    // ------------------------------------------------------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Server(String name, String version, String description,
                  List<Object> tools, List<Resource> resources, List<Prompt> prompts) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Tool(String name, String description, Map<String, Object> inputSchema) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Resource(String uri, String name, String description, String mimeType) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Prompt(String name, String description, List<Map<String, Object>> arguments) {}

    private static final AdapterManifest MANIFEST = new AdapterManifest(
            PROTOCOL, "1.0.0",
            "Model Context Protocol server: tools, resources and prompt templates.",
            List.of(
                    new AdapterCapability("tools", "Tool definitions with JSON input schemas", true),
                    new AdapterCapability("resources", "Context resources addressed by URI", true),
                    new AdapterCapability("prompts", "Prompt templates with arguments", true),
                    new AdapterCapability("transport", "stdio/http/sse transport block (extension)", true)));

    @Override public AdapterManifest manifest() { return MANIFEST; }

    // ------------------------------------------------------------------
    // Native → canonical
    // ------------------------------------------------------------------

    @Override
    public CanonicalResult toCanonical(NativePayload payload, TransformOptions options) {
        TransformReport.Builder report = TransformReport.builder();
        Server server = AdapterSupport.bind(payload, Server.class);
        if (server.name() == null || server.name().isBlank()) {
            throw new TransformException("mcp payload is missing required identity field 'name'");
        }

        String agentId = AdapterSupport.resolveAgentId(options, server.name());
        Iri agent = agentIri(agentId);
        CanonicalGraph.Builder graph = CanonicalGraph.builder().type(agent, AGENT);

        graph.literal(agent, NAME, server.name());
        report.mapped("name");
        if (server.version() != null) {
            graph.literal(agent, VERSION, server.version());
            report.mapped("version");
        }
        if (server.description() != null) {
            graph.literal(agent, DESCRIPTION, server.description());
            report.mapped("description");
        }

        for (Tool tool : tools(server)) {
            Iri node = childIri(agentId, "tool", tool.name());
            graph.add(agent, HAS_TOOL, node).type(node, TOOL)
                 .literal(node, NAME, tool.name())
                 .literal(node, DESCRIPTION, tool.description());
            if (tool.inputSchema() != null) {
                graph.literal(node, INPUT_SCHEMA, AdapterSupport.jsonLiteral(tool.inputSchema()));
            }
            report.mapped("tools[" + tool.name() + "]");
        }

        if (server.resources() != null) {
            for (Resource res : server.resources()) {
                String key = res.name() != null ? res.name() : res.uri();
                if (key == null) {
                    report.lossy("resources[]", "resource without name or uri");
                    continue;
                }
                Iri node = childIri(agentId, "resource", key);
                graph.add(agent, HAS_RESOURCE, node).type(node, RESOURCE)
                     .literal(node, NAME, res.name())
                     .literal(node, RESOURCE_URI, res.uri())
                     .literal(node, DESCRIPTION, res.description())
                     .literal(node, MIME_TYPE, res.mimeType());
                report.mapped("resources[" + key + "]");
            }
        }

        if (server.prompts() != null) {
            for (Prompt prompt : server.prompts()) {
                if (prompt.name() == null) {
                    report.lossy("prompts[]", "prompt without name");
                    continue;
                }
                Iri node = childIri(agentId, "prompt", prompt.name());
                graph.add(agent, HAS_PROMPT, node).type(node, PROMPT)
                     .literal(node, NAME, prompt.name())
                     .literal(node, DESCRIPTION, prompt.description());
                if (prompt.arguments() != null) {
                    graph.literal(node, PROMPT_ARGUMENTS, AdapterSupport.jsonLiteral(prompt.arguments()));
                }
                report.mapped("prompts[" + prompt.name() + "]");
            }
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

        String name = reader.literal(NAME).orElse(null);
        if (name == null) {
            name = reader.agentId().orElseThrow(() ->
                    new TransformException("Agent node has neither a name nor an agent id"));
            report.warning("Agent has no name; using its id '" + name + "'");
        } else {
            report.mapped("name");
        }
        out.put("name", name);
        reader.literal(VERSION).ifPresent(v -> { out.put("version", v); report.mapped("version"); });
        reader.literal(DESCRIPTION).ifPresent(v -> { out.put("description", v); report.mapped("description"); });

        List<Object> tools = new ArrayList<>();
        for (Iri node : reader.children(HAS_TOOL, TOOL)) {
            String toolName = reader.literal(node, NAME).orElseGet(() -> AdapterSupport.lastSegment(node));
            String description = reader.literal(node, DESCRIPTION).orElse(null);
            Object schema = reader.typedLiteral(node, INPUT_SCHEMA).map(AdapterSupport::valueOf).orElse(null);
            if (description == null && schema == null) {
                tools.add(toolName);
            } else {
                tools.add(AdapterSupport.toMap(new Tool(toolName, description, asMap(schema))));
            }
            report.mapped("tools[" + toolName + "]");
        }
        if (!tools.isEmpty()) out.put("tools", tools);

        List<Map<String, Object>> resources = new ArrayList<>();
        for (Iri node : reader.children(HAS_RESOURCE, RESOURCE)) {
            Resource res = new Resource(
                    reader.literal(node, RESOURCE_URI).orElse(null),
                    reader.literal(node, NAME).orElse(null),
                    reader.literal(node, DESCRIPTION).orElse(null),
                    reader.literal(node, MIME_TYPE).orElse(null));
            resources.add(AdapterSupport.toMap(res));
            report.mapped("resources[" + AdapterSupport.lastSegment(node) + "]");
        }
        if (!resources.isEmpty()) out.put("resources", resources);

        List<Map<String, Object>> prompts = new ArrayList<>();
        for (Iri node : reader.children(HAS_PROMPT, PROMPT)) {
            Map<String, Object> prompt = new LinkedHashMap<>();
            prompt.put("name", reader.literal(node, NAME).orElseGet(() -> AdapterSupport.lastSegment(node)));
            reader.literal(node, DESCRIPTION).ifPresent(d -> prompt.put("description", d));
            reader.typedLiteral(node, PROMPT_ARGUMENTS)
                  .ifPresent(a -> prompt.put("arguments", AdapterSupport.valueOf(a)));
            prompts.add(prompt);
            report.mapped("prompts[" + prompt.get("name") + "]");
        }
        if (!prompts.isEmpty()) out.put("prompts", prompts);

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

        if (!(data.get("name") instanceof String name) || name.isBlank()) {
            errors.add("'name' is required");
        }
        Object tools = data.get("tools");
        if (tools != null && !(tools instanceof List<?>)) {
            errors.add("'tools' must be a list");
        } else if (tools != null) {
            for (Object tool : (List<?>) tools) {
                if (tool instanceof Map<?, ?> m) {
                    if (m.get("name") == null) errors.add("every tool needs a 'name'");
                    else if (m.get("description") == null) warnings.add("tool '" + m.get("name") + "' has no description");
                } else if (!(tool instanceof String)) {
                    errors.add("tool entries must be names or objects");
                }
            }
        }
        return ValidationResult.of(errors, warnings);
    }

    private static List<Tool> tools(Server server) {
        if (server.tools() == null) return List.of();
        List<Tool> out = new ArrayList<>();
        for (Object raw : server.tools()) {
            Tool tool = raw instanceof String s
                    ? new Tool(s, null, null)
                    : AdapterSupport.convert(raw, Tool.class);
            if (tool.name() == null || tool.name().isBlank()) {
                throw new TransformException("mcp tool entry is missing its 'name'");
            }
            out.add(tool);
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object schema) {
        return schema instanceof Map<?, ?> m ? (Map<String, Object>) m : null;
    }
}
