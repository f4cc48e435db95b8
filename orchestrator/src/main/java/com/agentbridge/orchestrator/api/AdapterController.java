package com.agentbridge.orchestrator.api;

import com.agentbridge.orchestrator.api.dto.AdapterResponse;
import com.agentbridge.orchestrator.registry.AdapterRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Optional;

/**
 * GET /adapters                  : registered adapters with usage figures
 * GET /adapters?capability=tools : enabled adapters declaring a capability, highest priority first
 * PUT /adapters/{id}/enabled     : enable or disable an adapter
 */
@RestController
@RequestMapping("/adapters")
public class AdapterController {

    private final AdapterRegistry registry;

    public AdapterController(AdapterRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    public List<AdapterResponse> list(@RequestParam(required = false) String capability) {
        List<String> ids = capability == null ? registry.protocolIds() : registry.findByCapability(capability);
        return ids.stream()
                .map(this::view)
                .flatMap(Optional::stream)
                .toList();
    }

    @PutMapping("/{id}/enabled")
    public AdapterResponse setEnabled(@PathVariable String id, @RequestParam boolean value) {
        if (registry.registered(id).isEmpty()) throw notFound(id);
        registry.setEnabled(id, value);
        return view(id).orElseThrow(() -> notFound(id));
    }

    private Optional<AdapterResponse> view(String id) {
        return registry.registered(id).map(a -> AdapterResponse.from(a, registry));
    }

    private static ResponseStatusException notFound(String id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Adapter not registered: " + id);
    }
}
