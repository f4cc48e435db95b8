package com.agentbridge.orchestrator.api.dto;

import com.agentbridge.orchestrator.adapter.AdapterCapability;
import com.agentbridge.orchestrator.adapter.ProtocolAdapter;
import com.agentbridge.orchestrator.registry.AdapterRegistry;

import java.util.List;

/** Read-only view of a registered adapter returned by GET /adapters. */
public record AdapterResponse(
        String                  protocolId,
        String                  version,
        String                  description,
        boolean                 enabled,
        int                     priority,
        long                    calls,
        double                  meanFidelity,
        List<AdapterCapability> capabilities
) {
    public static AdapterResponse from(ProtocolAdapter adapter, AdapterRegistry registry) {
        String id = adapter.protocolId();
        return new AdapterResponse(
                id,
                adapter.manifest().version(),
                adapter.manifest().description(),
                registry.isEnabled(id),
                registry.priorityOf(id),
                registry.usage(id).calls(),
                registry.usage(id).meanFidelity(),
                adapter.getCapabilities()
        );
    }
}
