package com.agentbridge.orchestrator.harness;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

/**
 * Stored suite mean that later runs must not fall below.
 *
 * <pre>
 * { "suite": "adapters", "meanFidelity": 0.987, "cases": 6, "recordedAt": "2026-01-01T00:00:00Z" }
 * </pre>
 */
public record FidelityBaseline(String suite, double meanFidelity, int cases, Instant recordedAt) {

    private static final ObjectMapper JSON = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();

    public static FidelityBaseline of(SuiteReport report, Instant now) {
        return new FidelityBaseline(report.name(), report.meanFidelity(), report.results().size(), now);
    }

    /** @return empty when no baseline file exists yet */
    public static Optional<FidelityBaseline> read(Path file) {
        if (!Files.exists(file)) return Optional.empty();
        try {
            return Optional.of(JSON.readValue(file.toFile(), FidelityBaseline.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read fidelity baseline " + file, e);
        }
    }

    public void write(Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            JSON.writeValue(file.toFile(), this);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write fidelity baseline " + file, e);
        }
    }
}
