package com.agentbridge.orchestrator.store;

/**
 * All fields are optional; null fields match everything.
 *
 * @param capability tool name or declared capability
 * @param protocol   source format of the latest snapshot, or a declared supported protocol
 * @param textQuery  case-insensitive substring of name, description, role or goal
 */
public record DiscoveryCriteria(String capability, String protocol, String textQuery) {

    public static DiscoveryCriteria any() {
        return new DiscoveryCriteria(null, null, null);
    }
}
