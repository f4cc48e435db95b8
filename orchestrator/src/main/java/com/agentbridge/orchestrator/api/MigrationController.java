package com.agentbridge.orchestrator.api;

import com.agentbridge.orchestrator.service.MigrationJobService;
import com.agentbridge.orchestrator.service.MigrationRequest;
import com.agentbridge.orchestrator.service.MigrationStatus;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for bulk migrations.
 *
 * POST /migrations              : start a job, returns its id
 * GET  /migrations              : all known jobs
 * GET  /migrations/{id}         : job progress and per-agent outcomes
 * POST /migrations/{id}/cancel  : stop picking up further agents
 */
@RestController
@RequestMapping("/migrations")
public class MigrationController {

    private final MigrationJobService migrations;

    public MigrationController(MigrationJobService migrations) {
        this.migrations = migrations;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, UUID> start(@RequestBody MigrationRequest request) {
        return Map.of("jobId", migrations.start(request));
    }

    @GetMapping
    public List<MigrationStatus> list() {
        return migrations.list();
    }

    @GetMapping("/{id}")
    public MigrationStatus get(@PathVariable UUID id) {
        return migrations.status(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Migration not found: " + id));
    }

    @PostMapping("/{id}/cancel")
    public MigrationStatus cancel(@PathVariable UUID id) {
        get(id);
        migrations.cancel(id);
        return get(id);
    }
}
