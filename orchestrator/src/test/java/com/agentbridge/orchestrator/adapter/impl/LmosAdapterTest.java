package com.agentbridge.orchestrator.adapter.impl;

import com.agentbridge.orchestrator.Samples;
import com.agentbridge.orchestrator.adapter.*;
import com.agentbridge.orchestrator.canonical.CanonicalGraph;
import com.agentbridge.orchestrator.canonical.Iri;
import com.agentbridge.orchestrator.canonical.Literal;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.agentbridge.orchestrator.canonical.Vocabulary.*;
import static org.assertj.core.api.Assertions.assertThat;

class LmosAdapterTest {

    final LmosAdapter adapter = new LmosAdapter();

    @Test
    void toCanonical_mapsActionsAsTools() {
        CanonicalGraph graph = adapter.toCanonical(Samples.lmos(), TransformOptions.defaults()).graph();

        Iri tool = childIri("weather-agent", "tool", "getForecast");
        assertThat(graph.iris(agentIri("weather-agent"), HAS_TOOL)).containsExactly(tool);
        assertThat(graph.literal(tool, DESCRIPTION)).contains("Forecast for a city");
        assertThat(graph.objects(tool, INPUT_SCHEMA)).hasSize(1);
        assertThat(graph.objects(tool, OUTPUT_SCHEMA)).hasSize(1);
    }

    @Test
    void toCanonical_mapsLlmMemoryAndProtocols() {
        CanonicalGraph graph = adapter.toCanonical(Samples.lmos(), TransformOptions.defaults()).graph();
        Iri agent = agentIri("weather-agent");

        assertThat(graph.literal(agent, VERSION)).contains("2.0.1");
        assertThat(graph.literals(agent, HAS_CAPABILITY)).containsExactly("forecasting");
        assertThat(graph.objects(agent, TEMPERATURE)).containsExactly(Literal.ofDecimal(0.2));
        assertThat(graph.objects(agent, CONTEXT_WINDOW)).containsExactly(Literal.ofInteger(8000));
        assertThat(graph.literal(agent, MEMORY_TYPE)).contains("conversation");
        assertThat(graph.literals(agent, SUPPORTS_PROTOCOL)).containsExactlyInAnyOrder("mcp", "a2a");
    }

    @Test
    void toCanonical_keepsThingDescriptionFieldsInExtensions() {
        CanonicalResult result = adapter.toCanonical(Samples.lmos(), TransformOptions.defaults());

        assertThat(result.report().unmappedFields()).extracting(FieldIssue::path)
                .containsExactlyInAnyOrder("@context", "id", LmosAdapter.ACTION_TITLES);
    }

    @Test
    void toCanonical_disabledProtocolAndExtraVersionKeys_areLossy() {
        NativePayload payload = NativePayload.of("lmos", Map.of(
                "id", "urn:x", "title", "X",
                "version", Map.of("instance", "1", "model", "3"),
                "lmos:protocols", Map.of("a2a", false)));

        TransformReport report = adapter.toCanonical(payload, TransformOptions.defaults()).report();

        assertThat(report.lostFields()).containsExactlyInAnyOrder("version.model", "lmos:protocols.a2a");
    }

    @Test
    void fromCanonical_roundTripsSample() {
        CanonicalResult forward = adapter.toCanonical(Samples.lmos(), TransformOptions.defaults());

        NativeResult back = adapter.fromCanonical(forward.graph(), TransformOptions.forAgent(forward.agentId()));
        Map<String, Object> data = back.payload().data();

        assertThat(data).containsEntry("title", "Weather Agent")
                .containsEntry("id", "urn:agent:weather")
                .containsEntry("version", Map.of("instance", "2.0.1"))
                .containsEntry("lmos:memory", Map.of("type", "conversation", "contextWindow", 8000));
        assertThat(data).doesNotContainKey(LmosAdapter.ACTION_TITLES);
        @SuppressWarnings("unchecked")
        Map<String, Object> action = (Map<String, Object>) ((Map<String, Object>) data.get("actions")).get("getForecast");
        assertThat(action).containsEntry("title", "Get forecast");

        CanonicalResult reread = adapter.toCanonical(back.payload(), TransformOptions.forAgent(forward.agentId()));
        assertThat(reread.graph()).isEqualTo(forward.graph());
    }

    @Test
    void validate_missingId_isAWarning() {
        ValidationResult result = adapter.validate(NativePayload.of("lmos", Map.of("title", "X")));

        assertThat(result.valid()).isTrue();
        assertThat(result.warnings()).containsExactly("thing description has no 'id'");
    }

    @Test
    void validate_actionsMustBeKeyed() {
        ValidationResult result = adapter.validate(NativePayload.of("lmos", Map.of("title", "X", "id", "u",
                "actions", "getForecast")));

        assertThat(result.errors()).containsExactly("'actions' must be an object keyed by action name");
    }
}
