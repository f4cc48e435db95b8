package com.agentbridge.orchestrator.api;

import com.agentbridge.orchestrator.adapter.NativePayload;
import com.agentbridge.orchestrator.adapter.TransformReport;
import com.agentbridge.orchestrator.error.AdapterNotFoundException;
import com.agentbridge.orchestrator.error.ErrorCategory;
import com.agentbridge.orchestrator.error.StoreException;
import com.agentbridge.orchestrator.registry.AdapterRegistry;
import com.agentbridge.orchestrator.registry.CompatibilityMatrix;
import com.agentbridge.orchestrator.service.ChainResult;
import com.agentbridge.orchestrator.service.TranslationError;
import com.agentbridge.orchestrator.service.TranslationOptions;
import com.agentbridge.orchestrator.service.TranslationOrchestrator;
import com.agentbridge.orchestrator.service.TranslationRequest;
import com.agentbridge.orchestrator.service.TranslationResponse;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for TranslationController.
 *
 * Only the web layer and ApiExceptionHandler are loaded; the orchestrator
 * and registry are mocks.
 */
@WebMvcTest(TranslationController.class)
class TranslationControllerTest {

    @Autowired MockMvc                    mockMvc;
    @MockitoBean TranslationOrchestrator  orchestrator;
    @MockitoBean AdapterRegistry          registry;

    // ------------------------------------------------------------------
    // POST /translations
    // ------------------------------------------------------------------

    @Test
    void translate_success_returns200WithReports() throws Exception {
        when(orchestrator.translate(any())).thenReturn(response(true, List.of()));

        mockMvc.perform(post("/translations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sourceFormat":"mcp","targetFormat":"crewai",
                                 "sourceData":{"name":"Ada","tools":["search"]},
                                 "options":{"useCache":true,"maxFidelityLoss":0.2}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.agentId").value("ada"))
                .andExpect(jsonPath("$.targetData.protocolId").value("crewai"))
                .andExpect(jsonPath("$.targetData.data.role").value("Ada"))
                .andExpect(jsonPath("$.totalFidelity").value(0.9));

        ArgumentCaptor<TranslationRequest> captor = ArgumentCaptor.forClass(TranslationRequest.class);
        verify(orchestrator).translate(captor.capture());
        assertThat(captor.getValue().options()).isEqualTo(new TranslationOptions(true, false, 0.2, false));
        assertThat(captor.getValue().sourceData().data()).containsEntry("name", "Ada");
    }

    @Test
    void translate_dataQualityFailure_returns422WithBody() throws Exception {
        when(orchestrator.translate(any())).thenReturn(response(false,
                List.of(new TranslationError(ErrorCategory.FIDELITY_THRESHOLD, "fidelity 0.5 below 0.8"))));

        mockMvc.perform(post("/translations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sourceFormat":"mcp","targetFormat":"crewai","sourceData":{"name":"Ada"}}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errors[0].category").value("FIDELITY_THRESHOLD"));
    }

    @Test
    void translate_unknownAdapter_returns404() throws Exception {
        when(orchestrator.translate(any())).thenThrow(new AdapterNotFoundException("autogen"));

        mockMvc.perform(post("/translations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sourceFormat":"mcp","targetFormat":"autogen","sourceData":{"name":"Ada"}}
                                """))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.category").value("ADAPTER_NOT_FOUND"));
    }

    @Test
    void translate_storeFailure_returns503() throws Exception {
        when(orchestrator.translate(any())).thenThrow(new StoreException("connection refused"));

        mockMvc.perform(post("/translations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sourceFormat":"mcp","targetFormat":"crewai","sourceData":{"name":"Ada"},
                                 "options":{"persist":true}}
                                """))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.category").value("STORE"))
                .andExpect(jsonPath("$.message").value("connection refused"));
    }

    @Test
    void translate_missingSourceData_returns400() throws Exception {
        mockMvc.perform(post("/translations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sourceFormat":"mcp","targetFormat":"crewai"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.category").value("BAD_REQUEST"));

        verify(orchestrator, never()).translate(any());
    }

    @Test
    void translate_invalidFidelityBound_returns400() throws Exception {
        mockMvc.perform(post("/translations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sourceFormat":"mcp","targetFormat":"crewai","sourceData":{"name":"Ada"},
                                 "options":{"maxFidelityLoss":1.5}}
                                """))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------
    // POST /translations/chain
    // ------------------------------------------------------------------

    @Test
    void chain_success_returns200() throws Exception {
        NativePayload last = NativePayload.of("mcp", Map.of("name", "Ada"));
        when(orchestrator.translateChain(eq("ada"), any(), eq(List.of("mcp", "crewai", "mcp")), any()))
                .thenReturn(new ChainResult(true, "ada", List.of("mcp", "crewai", "mcp"), last, 0.81, null,
                        List.of(), List.of("hop 1 (mcp→crewai): Agent has no role; using 'Ada'"), List.of()));

        mockMvc.perform(post("/translations/chain")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"agentId":"ada","formats":["mcp","crewai","mcp"],"sourceData":{"name":"Ada"}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cumulativeFidelity").value(0.81))
                .andExpect(jsonPath("$.finalData.protocolId").value("mcp"))
                .andExpect(jsonPath("$.warnings[0]").value("hop 1 (mcp→crewai): Agent has no role; using 'Ada'"));
    }

    @Test
    void chain_failedHop_returns422() throws Exception {
        when(orchestrator.translateChain(isNull(), any(), any(), any()))
                .thenReturn(new ChainResult(false, null, List.of("mcp", "lmos"), null, 0.0, null, List.of(),
                        List.of(), List.of(new TranslationError(ErrorCategory.TRANSFORM, "hop 1 (mcp→lmos): bad"))));

        mockMvc.perform(post("/translations/chain")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"formats":["mcp","lmos"],"sourceData":{"tools":[]}}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.cumulativeFidelity").value(0.0));
    }

    @Test
    void chain_withoutFormats_returns400() throws Exception {
        mockMvc.perform(post("/translations/chain")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sourceData":{"name":"Ada"}}
                                """))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------
    // GET /translations/compatibility
    // ------------------------------------------------------------------

    @Test
    void compatibility_listsObservedPairs() throws Exception {
        CompatibilityMatrix matrix = new CompatibilityMatrix();
        matrix.record("mcp", "crewai", 0.8);
        matrix.record("mcp", "crewai", 0.6);
        when(registry.compatibility()).thenReturn(matrix);

        mockMvc.perform(get("/translations/compatibility"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].source").value("mcp"))
                .andExpect(jsonPath("$[0].target").value("crewai"))
                .andExpect(jsonPath("$[0].translations").value(2));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static TranslationResponse response(boolean success, List<TranslationError> errors) {
        TransformReport forward = TransformReport.builder().mapped("name").build();
        return new TranslationResponse(success, "ada", "mcp", "crewai",
                success ? NativePayload.of("crewai", Map.of("role", "Ada")) : null,
                forward, success ? forward : null, success ? 0.9 : 0.0, null,
                List.of(), errors, false, 3);
    }
}
