package com.agentbridge.orchestrator.adapter.impl;

import com.agentbridge.orchestrator.Samples;
import com.agentbridge.orchestrator.adapter.*;
import com.agentbridge.orchestrator.canonical.CanonicalGraph;
import com.agentbridge.orchestrator.canonical.ExtensionNamespace;
import com.agentbridge.orchestrator.canonical.Iri;
import com.agentbridge.orchestrator.error.TransformException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.agentbridge.orchestrator.canonical.Vocabulary.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class McpAdapterTest {

    final McpAdapter adapter = new McpAdapter();

    // ------------------------------------------------------------------
    // toCanonical
    // ------------------------------------------------------------------

    @Test
    void toCanonical_mapsIdentityToolsResourcesAndPrompts() {
        CanonicalResult result = adapter.toCanonical(Samples.mcp(), TransformOptions.defaults());
        CanonicalGraph graph = result.graph();
        Iri agent = agentIri("research-assistant");

        assertThat(result.agentId()).isEqualTo("research-assistant");
        assertThat(graph.requireAgentNode()).isEqualTo(agent);
        assertThat(graph.literal(agent, NAME)).contains("Research Assistant");
        assertThat(graph.literal(agent, VERSION)).contains("1.2.0");
        assertThat(graph.iris(agent, HAS_TOOL)).containsExactlyInAnyOrder(
                childIri("research-assistant", "tool", "search"),
                childIri("research-assistant", "tool", "fetch"));
        assertThat(graph.objects(childIri("research-assistant", "tool", "fetch"), INPUT_SCHEMA)).hasSize(1);
        assertThat(graph.iris(agent, HAS_RESOURCE)).hasSize(1);
        assertThat(graph.iris(agent, HAS_PROMPT)).hasSize(1);
    }

    @Test
    void toCanonical_unknownFields_goToExtensionNamespace() {
        CanonicalResult result = adapter.toCanonical(Samples.mcp(), TransformOptions.defaults());

        assertThat(result.graph().extensionTriples("mcp"))
                .extracting(t -> ExtensionNamespace.fieldPathOf(t.predicate()).orElseThrow())
                .containsExactly("transport");
        assertThat(result.report().unmappedFields()).extracting(FieldIssue::path).containsExactly("transport");
        // one unmapped field at 0.9 credit among otherwise mapped fields
        assertThat(result.report().fidelityScore()).isLessThan(1.0).isGreaterThan(0.95);
    }

    @Test
    void toCanonical_explicitAgentId_winsOverName() {
        CanonicalResult result = adapter.toCanonical(Samples.mcp(), TransformOptions.forAgent("ra-7"));

        assertThat(result.agentId()).isEqualTo("ra-7");
        assertThat(result.graph().requireAgentNode()).isEqualTo(agentIri("ra-7"));
    }

    @Test
    void toCanonical_isDeterministic() {
        CanonicalGraph first = adapter.toCanonical(Samples.mcp(), TransformOptions.defaults()).graph();
        CanonicalGraph second = adapter.toCanonical(Samples.mcp(), TransformOptions.defaults()).graph();

        assertThat(first).isEqualTo(second);
    }

    @Test
    void toCanonical_missingName_throws() {
        NativePayload nameless = NativePayload.of("mcp", Map.of("tools", List.of("search")));

        assertThatThrownBy(() -> adapter.toCanonical(nameless, TransformOptions.defaults()))
                .isInstanceOf(TransformException.class)
                .hasMessageContaining("'name'");
    }

    // ------------------------------------------------------------------
    // fromCanonical
    // ------------------------------------------------------------------

    @Test
    void fromCanonical_restoresNativeShape() {
        CanonicalResult forward = adapter.toCanonical(Samples.mcp(), TransformOptions.defaults());

        NativeResult back = adapter.fromCanonical(forward.graph(), TransformOptions.forAgent(forward.agentId()));
        Map<String, Object> data = back.payload().data();

        assertThat(back.payload().protocolId()).isEqualTo("mcp");
        assertThat(data).containsEntry("name", "Research Assistant").containsEntry("version", "1.2.0");
        assertThat((List<Object>) data.get("tools")).contains("search");
        assertThat(data).containsEntry("transport", Map.of("type", "stdio", "command", "research-server"));
        assertThat(data).doesNotContainKey(AdapterSupport.PASSTHROUGH_FIELD);
        assertThat(back.report().fidelityScore()).isEqualTo(1.0);
    }

    @Test
    void fromCanonical_roleHasNoMcpEquivalent_carriedInPassthrough() {
        Iri agent = agentIri("ada");
        CanonicalGraph graph = CanonicalGraph.builder()
                .type(agent, AGENT)
                .literal(agent, NAME, "Ada")
                .literal(agent, ROLE, "Analyst")
                .build();

        NativeResult back = adapter.fromCanonical(graph, TransformOptions.forAgent("ada"));

        assertThat(back.payload().data()).containsKey(AdapterSupport.PASSTHROUGH_FIELD);
        assertThat(back.report().lostFields()).containsExactly("role");

        CanonicalResult reread = adapter.toCanonical(back.payload(), TransformOptions.forAgent("ada"));
        assertThat(reread.graph()).isEqualTo(graph);
    }

    @Test
    void fromCanonical_withoutName_fallsBackToAgentId() {
        Iri agent = agentIri("ada");
        CanonicalGraph graph = CanonicalGraph.builder().type(agent, AGENT).build();

        NativeResult back = adapter.fromCanonical(graph, TransformOptions.forAgent("ada"));

        assertThat(back.payload().data()).containsEntry("name", "ada");
        assertThat(back.report().warnings()).anyMatch(w -> w.contains("no name"));
    }

    // ------------------------------------------------------------------
    // validate
    // ------------------------------------------------------------------

    @Test
    void validate_reportsErrorsAndWarnings() {
        ValidationResult result = adapter.validate(NativePayload.of("mcp", Map.of(
                "tools", List.of(Map.of("name", "fetch"), 42))));

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).contains("'name' is required", "tool entries must be names or objects");
        assertThat(result.warnings()).containsExactly("tool 'fetch' has no description");
    }

    @Test
    void validate_sample_isClean() {
        ValidationResult result = adapter.validate(Samples.mcp());

        assertThat(result.valid()).isTrue();
        assertThat(result.warnings()).isEmpty();
    }
}
