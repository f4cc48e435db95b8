package com.agentbridge.orchestrator.api;

import com.agentbridge.orchestrator.adapter.NativePayload;
import com.agentbridge.orchestrator.api.dto.ChainRequest;
import com.agentbridge.orchestrator.api.dto.TranslateRequest;
import com.agentbridge.orchestrator.registry.AdapterRegistry;
import com.agentbridge.orchestrator.registry.CompatibilityMatrix;
import com.agentbridge.orchestrator.service.ChainResult;
import com.agentbridge.orchestrator.service.TranslationOrchestrator;
import com.agentbridge.orchestrator.service.TranslationResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for translations.
 *
 * POST /translations                 : single-hop translation
 * POST /translations/chain           : multi-hop translation
 * GET  /translations/compatibility   : observed fidelity per protocol pair
 *
 * A translation that fails on data quality answers 422 with the full
 * response body, so callers still see the reports and errors.
 */
@RestController
@RequestMapping("/translations")
public class TranslationController {

    private final TranslationOrchestrator orchestrator;
    private final AdapterRegistry         registry;

    public TranslationController(TranslationOrchestrator orchestrator, AdapterRegistry registry) {
        this.orchestrator = orchestrator;
        this.registry     = registry;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/translations \
     *     -H "Content-Type: application/json" \
     *     -d '{"sourceFormat":"mcp","targetFormat":"crewai","sourceData":{"name":"Ada","tools":["search"]}}'
     */
    @PostMapping
    public ResponseEntity<TranslationResponse> translate(@RequestBody TranslateRequest req) {
        TranslationResponse response = orchestrator.translate(req.toServiceRequest());
        return ResponseEntity.status(response.success() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY)
                .body(response);
    }

    @PostMapping("/chain")
    public ResponseEntity<ChainResult> chain(@RequestBody ChainRequest req) {
        if (req.formats() == null || req.formats().isEmpty() || req.sourceData() == null) {
            throw new IllegalArgumentException("formats and sourceData are required");
        }
        ChainResult result = orchestrator.translateChain(req.agentId(),
                NativePayload.of(req.formats().get(0), req.sourceData()),
                req.formats(), req.translationOptions());
        return ResponseEntity.status(result.success() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY)
                .body(result);
    }

    @GetMapping("/compatibility")
    public List<CompatibilityMatrix.Entry> compatibility() {
        return registry.compatibility().entries();
    }
}
