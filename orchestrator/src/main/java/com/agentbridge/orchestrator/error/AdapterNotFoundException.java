package com.agentbridge.orchestrator.error;

public class AdapterNotFoundException extends BridgeException {
    public AdapterNotFoundException(String protocolId) {
        super(ErrorCategory.ADAPTER_NOT_FOUND,
                "No enabled adapter registered for protocol: '" + protocolId + "'");
    }
}
