package com.agentbridge.orchestrator.adapter;

/** A field that was not mapped one-to-one, with the reason. */
public record FieldIssue(String path, String reason) {}
