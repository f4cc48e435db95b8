package com.agentbridge.orchestrator.api.dto;

import java.util.Map;

/** Request body for POST /agents/import. agentId is optional. */
public record ImportAgentRequest(String sourceFormat, String agentId, Map<String, Object> data) {}
