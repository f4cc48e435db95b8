package com.agentbridge.orchestrator.api;

import com.agentbridge.orchestrator.canonical.CanonicalGraph;
import com.agentbridge.orchestrator.canonical.Vocabulary;
import com.agentbridge.orchestrator.error.AdapterNotFoundException;
import com.agentbridge.orchestrator.error.ErrorCategory;
import com.agentbridge.orchestrator.service.AgentCatalogService;
import com.agentbridge.orchestrator.service.AgentDetails;
import com.agentbridge.orchestrator.service.AgentExport;
import com.agentbridge.orchestrator.service.ImportResult;
import com.agentbridge.orchestrator.service.TranslationError;
import com.agentbridge.orchestrator.store.AgentSummary;
import com.agentbridge.orchestrator.store.CompactionResult;
import com.agentbridge.orchestrator.store.DiscoveryCriteria;
import com.agentbridge.orchestrator.store.HistoryEntry;
import com.agentbridge.orchestrator.store.SnapshotMetadata;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for AgentController. The catalog service is a mock.
 */
@WebMvcTest(AgentController.class)
class AgentControllerTest {

    static final Instant T0 = Instant.parse("2026-04-01T08:00:00Z");

    @Autowired MockMvc               mockMvc;
    @MockitoBean AgentCatalogService catalog;

    // ------------------------------------------------------------------
    // GET /agents
    // ------------------------------------------------------------------

    @Test
    void list_withoutFilters_listsEveryAgent() throws Exception {
        when(catalog.listAgents()).thenReturn(List.of(summary()));

        mockMvc.perform(get("/agents"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].agentId").value("ada"))
                .andExpect(jsonPath("$[0].capabilities[0]").value("search"));
    }

    @Test
    void list_withFilters_discovers() throws Exception {
        when(catalog.discoverAgents(new DiscoveryCriteria("search", null, "research")))
                .thenReturn(List.of(summary()));

        mockMvc.perform(get("/agents").param("capability", "search").param("q", "research"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
    }

    // ------------------------------------------------------------------
    // POST /agents/import
    // ------------------------------------------------------------------

    @Test
    void importAgent_success_returns201() throws Exception {
        when(catalog.importAgent(eq("mcp"), any(), isNull()))
                .thenReturn(new ImportResult(true, "ada", 1, 0.95, List.of(), List.of()));

        mockMvc.perform(post("/agents/import")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sourceFormat":"mcp","data":{"name":"Ada"}}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.version").value(1))
                .andExpect(jsonPath("$.agentId").value("ada"));
    }

    @Test
    void importAgent_invalidPayload_returns422() throws Exception {
        when(catalog.importAgent(eq("crewai"), any(), eq("bob")))
                .thenReturn(new ImportResult(false, null, null, 0.0, List.of(),
                        List.of(new TranslationError(ErrorCategory.TRANSFORM, "'role' is required"))));

        mockMvc.perform(post("/agents/import")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sourceFormat":"crewai","agentId":"bob","data":{"goal":"x"}}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errors[0].message").value("'role' is required"));
    }

    @Test
    void importAgent_unknownFormat_returns404() throws Exception {
        when(catalog.importAgent(eq("autogen"), any(), any())).thenThrow(new AdapterNotFoundException("autogen"));

        mockMvc.perform(post("/agents/import")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sourceFormat":"autogen","data":{"name":"Ada"}}
                                """))
                .andExpect(status().isNotFound());
    }

    @Test
    void importAgent_missingData_returns400() throws Exception {
        mockMvc.perform(post("/agents/import")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sourceFormat":"mcp"}
                                """))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------
    // GET /agents/{id}
    // ------------------------------------------------------------------

    @Test
    void get_knownAgent_returnsDetails() throws Exception {
        CanonicalGraph graph = CanonicalGraph.builder()
                .type(Vocabulary.agentIri("ada"), Vocabulary.AGENT)
                .literal(Vocabulary.agentIri("ada"), Vocabulary.NAME, "Ada")
                .build();
        when(catalog.getAgent("ada")).thenReturn(Optional.of(new AgentDetails(summary(),
                new SnapshotMetadata(T0, "mcp", 1.0), graph.triples().stream().toList(),
                List.of(new HistoryEntry(1, T0, "mcp", 1.0, false)))));

        mockMvc.perform(get("/agents/ada"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary.name").value("Ada"))
                .andExpect(jsonPath("$.triples.length()").value(2))
                .andExpect(jsonPath("$.history[0].version").value(1));
    }

    @Test
    void get_unknownAgent_returns404() throws Exception {
        when(catalog.getAgent("ghost")).thenReturn(Optional.empty());

        mockMvc.perform(get("/agents/ghost"))
                .andExpect(status().isNotFound());
    }

    @Test
    void history_unknownAgent_returns404() throws Exception {
        when(catalog.getHistory("ghost")).thenReturn(List.of());

        mockMvc.perform(get("/agents/ghost/history"))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // Export / trace / maintenance
    // ------------------------------------------------------------------

    @Test
    void export_ntriples_returnsText() throws Exception {
        when(catalog.exportAgent("ada", "ntriples", null)).thenReturn(Optional.of(new AgentExport("ada", 2,
                "ntriples", "<https://agentbridge.dev/agent/ada> ... .\n", 1.0, List.of(), List.of())));

        mockMvc.perform(get("/agents/ada/export").param("format", "ntriples"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value(2))
                .andExpect(jsonPath("$.fidelity").value(1.0));
    }

    @Test
    void export_missingVersion_returns404() throws Exception {
        when(catalog.exportAgent("ada", "mcp", 9)).thenReturn(Optional.empty());

        mockMvc.perform(get("/agents/ada/export").param("format", "mcp").param("version", "9"))
                .andExpect(status().isNotFound());
    }

    @Test
    void trace_unknownAgent_returns404() throws Exception {
        when(catalog.traceSubject(eq("ghost"), isNull(), anyInt())).thenReturn(Optional.empty());

        mockMvc.perform(get("/agents/ghost/trace"))
                .andExpect(status().isNotFound());
    }

    @Test
    void compact_defaultsToKeepingLatest() throws Exception {
        when(catalog.compact(1)).thenReturn(new CompactionResult(3, List.of("ada")));

        mockMvc.perform(post("/agents/compact"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.prunedSnapshots").value(3));

        verify(catalog).compact(1);
    }

    @Test
    void compact_zeroRetention_returns400() throws Exception {
        when(catalog.compact(0)).thenThrow(new IllegalArgumentException("keepLatest must be >= 1"));

        mockMvc.perform(post("/agents/compact").param("keepLatest", "0"))
                .andExpect(status().isBadRequest());
    }

    private static AgentSummary summary() {
        return new AgentSummary("ada", "Ada", 1, "mcp", T0, List.of("search"));
    }
}
