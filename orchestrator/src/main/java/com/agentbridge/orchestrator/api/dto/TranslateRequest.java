package com.agentbridge.orchestrator.api.dto;

import com.agentbridge.orchestrator.adapter.NativePayload;
import com.agentbridge.orchestrator.service.TranslationRequest;

import java.util.Map;

/**
 * Request body for POST /translations.
 *
 * Required: sourceFormat, targetFormat, sourceData
 * Optional: agentId (derived from the native identity when absent), options
 */
public record TranslateRequest(String agentId, String sourceFormat, String targetFormat,
                               Map<String, Object> sourceData, OptionsBody options) {

    public TranslationRequest toServiceRequest() {
        if (sourceData == null) throw new IllegalArgumentException("sourceData is required");
        return new TranslationRequest(agentId, sourceFormat, targetFormat,
                NativePayload.of(sourceFormat == null ? "" : sourceFormat, sourceData),
                OptionsBody.toOptions(options));
    }
}
