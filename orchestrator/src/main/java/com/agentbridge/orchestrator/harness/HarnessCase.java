package com.agentbridge.orchestrator.harness;

import com.agentbridge.orchestrator.adapter.NativePayload;
import com.agentbridge.orchestrator.adapter.ProtocolAdapter;

/**
 * One harness case: a same-adapter round trip when {@code target} is null,
 * otherwise a cross-framework test from {@code source} through {@code target}.
 */
public record HarnessCase(String name, ProtocolAdapter source, ProtocolAdapter target,
                          NativePayload sample, double minFidelity) {

    public static HarnessCase roundTrip(String name, ProtocolAdapter adapter, NativePayload sample,
                                        double minFidelity) {
        return new HarnessCase(name, adapter, null, sample, minFidelity);
    }

    public static HarnessCase crossFramework(String name, ProtocolAdapter source, ProtocolAdapter target,
                                             NativePayload sample, double minFidelity) {
        return new HarnessCase(name, source, target, sample, minFidelity);
    }
}
