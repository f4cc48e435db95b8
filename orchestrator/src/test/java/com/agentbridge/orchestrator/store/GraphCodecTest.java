package com.agentbridge.orchestrator.store;

import com.agentbridge.orchestrator.canonical.CanonicalGraph;
import com.agentbridge.orchestrator.canonical.Iri;
import com.agentbridge.orchestrator.canonical.Literal;
import com.agentbridge.orchestrator.error.StoreException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.agentbridge.orchestrator.canonical.Vocabulary.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphCodecTest {

    final GraphCodec codec = new GraphCodec(new ObjectMapper());

    @Test
    void decode_restoresIrisAndTypedLiterals() {
        Iri ada = agentIri("ada");
        Iri tool = childIri("ada", "tool", "search");
        CanonicalGraph graph = CanonicalGraph.builder()
                .type(ada, AGENT)
                .add(ada, HAS_TOOL, tool)
                .literal(ada, MAX_TOKENS, Literal.ofInteger(512))
                .literal(ada, NAME, "Ada")
                .build();

        assertThat(codec.decode(codec.encode(graph))).isEqualTo(graph);
    }

    @Test
    void encode_isIndependentOfInsertionOrder() {
        Iri ada = agentIri("ada");
        CanonicalGraph a = CanonicalGraph.builder().literal(ada, NAME, "Ada").literal(ada, ROLE, "R").build();
        CanonicalGraph b = CanonicalGraph.builder().literal(ada, ROLE, "R").literal(ada, NAME, "Ada").build();

        assertThat(codec.encode(a)).isEqualTo(codec.encode(b));
    }

    @Test
    void decode_corruptJson_throwsStoreException() {
        assertThatThrownBy(() -> codec.decode("[{\"s\":"))
                .isInstanceOf(StoreException.class)
                .hasMessageContaining("corrupt");
    }

    @Test
    void lists_roundTrip() {
        assertThat(codec.decodeList(codec.encodeList(List.of("role", "tools[x]")))).containsExactly("role", "tools[x]");
    }
}
