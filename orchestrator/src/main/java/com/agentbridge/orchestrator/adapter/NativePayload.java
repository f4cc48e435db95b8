package com.agentbridge.orchestrator.adapter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A native agent description tagged with the protocol it is written in.
 *
 * The orchestrator only ever carries this opaque pair; the shape of
 * {@code data} is known to the owning adapter alone.
 */
public record NativePayload(String protocolId, Map<String, Object> data) {

    public NativePayload {
        Objects.requireNonNull(protocolId, "protocolId");
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static NativePayload of(String protocolId, Map<String, Object> data) {
        return new NativePayload(protocolId, data);
    }
}
