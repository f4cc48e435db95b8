package com.agentbridge.orchestrator.adapter;

import java.util.List;

/**
 * Identity and documentation contract for an adapter.
 *
 * @param protocolId   Unique protocol id, e.g. "mcp". Also owns the extension namespace.
 * @param version      Adapter version, recorded with every report.
 * @param description  One-line summary of the native schema.
 * @param capabilities Features the adapter can translate; indexed by the registry.
 */
public record AdapterManifest(
        String                  protocolId,
        String                  version,
        String                  description,
        List<AdapterCapability> capabilities) {

    public AdapterManifest {
        capabilities = List.copyOf(capabilities);
    }
}
