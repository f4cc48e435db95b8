package com.agentbridge.orchestrator.registry;

/**
 * @param priority higher wins when two adapters claim the same protocol id or capability
 * @param enabled  disabled adapters stay registered but are invisible to lookups
 */
public record RegistrationOptions(int priority, boolean enabled) {

    public static RegistrationOptions defaults() {
        return new RegistrationOptions(0, true);
    }

    public static RegistrationOptions withPriority(int priority) {
        return new RegistrationOptions(priority, true);
    }
}
