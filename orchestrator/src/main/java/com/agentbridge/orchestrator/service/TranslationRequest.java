package com.agentbridge.orchestrator.service;

import com.agentbridge.orchestrator.adapter.NativePayload;

/**
 * @param agentId optional; when absent the source adapter derives one from the native identity
 */
public record TranslationRequest(
        String             agentId,
        String             sourceFormat,
        String             targetFormat,
        NativePayload      sourceData,
        TranslationOptions options) {

    public TranslationRequest {
        if (sourceFormat == null || sourceFormat.isBlank()) throw new IllegalArgumentException("sourceFormat is required");
        if (targetFormat == null || targetFormat.isBlank()) throw new IllegalArgumentException("targetFormat is required");
        if (sourceData == null) throw new IllegalArgumentException("sourceData is required");
        if (!sourceFormat.equals(sourceData.protocolId())) {
            throw new IllegalArgumentException("sourceData is tagged '" + sourceData.protocolId()
                    + "' but sourceFormat is '" + sourceFormat + "'");
        }
        if (options == null) options = TranslationOptions.defaults();
    }

    public static TranslationRequest of(NativePayload sourceData, String targetFormat) {
        return new TranslationRequest(null, sourceData.protocolId(), targetFormat, sourceData, null);
    }
}
