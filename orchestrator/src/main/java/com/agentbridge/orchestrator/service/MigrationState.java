package com.agentbridge.orchestrator.service;

public enum MigrationState {
    RUNNING,
    COMPLETED,
    /** Cancelled by the caller or by the first failure when continueOnError is off. */
    CANCELLED
}
