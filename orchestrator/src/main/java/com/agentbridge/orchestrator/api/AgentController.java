package com.agentbridge.orchestrator.api;

import com.agentbridge.orchestrator.api.dto.ImportAgentRequest;
import com.agentbridge.orchestrator.canonical.Triple;
import com.agentbridge.orchestrator.service.AgentCatalogService;
import com.agentbridge.orchestrator.service.AgentDetails;
import com.agentbridge.orchestrator.service.AgentExport;
import com.agentbridge.orchestrator.service.CatalogStats;
import com.agentbridge.orchestrator.service.ImportResult;
import com.agentbridge.orchestrator.store.AgentSummary;
import com.agentbridge.orchestrator.store.CompactionResult;
import com.agentbridge.orchestrator.store.DiscoveryCriteria;
import com.agentbridge.orchestrator.store.HistoryEntry;
import com.agentbridge.orchestrator.store.TranslationActivity;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * REST API over the canonical store.
 *
 * GET  /agents                       : list / discover (capability, protocol, q)
 * GET  /agents/stats                 : store, cache and adapter statistics
 * POST /agents/import                : translate a native payload into a new snapshot
 * POST /agents/compact               : prune superseded snapshot bodies
 * GET  /agents/{id}                  : latest snapshot with history
 * GET  /agents/{id}/history
 * GET  /agents/{id}/activities       : translation audit records
 * GET  /agents/{id}/export           : render as ntriples, json or any protocol
 * GET  /agents/{id}/trace            : triples reachable from a subject
 */
@RestController
@RequestMapping("/agents")
public class AgentController {

    private final AgentCatalogService catalog;

    public AgentController(AgentCatalogService catalog) {
        this.catalog = catalog;
    }

    @GetMapping
    public List<AgentSummary> list(@RequestParam(required = false) String capability,
                                   @RequestParam(required = false) String protocol,
                                   @RequestParam(required = false) String q) {
        if (capability == null && protocol == null && q == null) {
            return catalog.listAgents();
        }
        return catalog.discoverAgents(new DiscoveryCriteria(capability, protocol, q));
    }

    @GetMapping("/stats")
    public CatalogStats stats() {
        return catalog.getStats();
    }

    @PostMapping("/import")
    public ResponseEntity<ImportResult> importAgent(@RequestBody ImportAgentRequest req) {
        if (req.sourceFormat() == null || req.data() == null) {
            throw new IllegalArgumentException("sourceFormat and data are required");
        }
        ImportResult result = catalog.importAgent(req.sourceFormat(), req.data(), req.agentId());
        return ResponseEntity.status(result.success() ? HttpStatus.CREATED : HttpStatus.UNPROCESSABLE_ENTITY)
                .body(result);
    }

    @PostMapping("/compact")
    public CompactionResult compact(@RequestParam(defaultValue = "1") int keepLatest) {
        return catalog.compact(keepLatest);
    }

    @GetMapping("/{id}")
    public AgentDetails get(@PathVariable String id) {
        return catalog.getAgent(id).orElseThrow(() -> notFound(id));
    }

    @GetMapping("/{id}/history")
    public List<HistoryEntry> history(@PathVariable String id) {
        List<HistoryEntry> history = catalog.getHistory(id);
        if (history.isEmpty()) throw notFound(id);
        return history;
    }

    @GetMapping("/{id}/activities")
    public List<TranslationActivity> activities(@PathVariable String id) {
        return catalog.getActivities(id);
    }

    @GetMapping("/{id}/export")
    public AgentExport export(@PathVariable String id,
                              @RequestParam String format,
                              @RequestParam(required = false) Integer version) {
        return catalog.exportAgent(id, format, version).orElseThrow(() -> notFound(id));
    }

    @GetMapping("/{id}/trace")
    public List<Triple> trace(@PathVariable String id,
                              @RequestParam(required = false) String subject,
                              @RequestParam(defaultValue = "3") int depth) {
        return catalog.traceSubject(id, subject, depth).orElseThrow(() -> notFound(id));
    }

    private static ResponseStatusException notFound(String id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Agent not found: " + id);
    }
}
