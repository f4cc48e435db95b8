package com.agentbridge.orchestrator.api.dto;

import com.agentbridge.orchestrator.service.TranslationOptions;

/** Translation options as sent over the wire; every field is optional. */
public record OptionsBody(Boolean useCache, Boolean persist, Double maxFidelityLoss, Boolean strict) {

    static TranslationOptions toOptions(OptionsBody body) {
        if (body == null) return TranslationOptions.defaults();
        return new TranslationOptions(
                Boolean.TRUE.equals(body.useCache()),
                Boolean.TRUE.equals(body.persist()),
                body.maxFidelityLoss(),
                Boolean.TRUE.equals(body.strict()));
    }
}
