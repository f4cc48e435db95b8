package com.agentbridge.orchestrator.api.dto;

public record ErrorResponse(String category, String message) {}
