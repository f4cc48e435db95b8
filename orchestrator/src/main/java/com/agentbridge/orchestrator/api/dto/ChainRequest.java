package com.agentbridge.orchestrator.api.dto;

import com.agentbridge.orchestrator.service.TranslationOptions;

import java.util.List;
import java.util.Map;

/**
 * Request body for POST /translations/chain. The first entry of
 * {@code formats} is the protocol {@code sourceData} is written in.
 */
public record ChainRequest(String agentId, List<String> formats, Map<String, Object> sourceData,
                           OptionsBody options) {

    public TranslationOptions translationOptions() {
        return OptionsBody.toOptions(options);
    }
}
