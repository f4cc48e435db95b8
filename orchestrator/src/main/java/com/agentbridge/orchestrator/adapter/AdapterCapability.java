package com.agentbridge.orchestrator.adapter;

/**
 * A feature an adapter can translate.
 *
 * @param bidirectional true when the feature survives both toCanonical and fromCanonical
 */
public record AdapterCapability(String name, String description, boolean bidirectional) {}
