package com.quillmind.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Declared output of one content-generation module invocation.
 *
 * @param moduleName      the module that produced the output
 * @param result          opaque module payload, never inspected by the engine
 * @param executionTimeMs how long the module ran
 * @param qualityMetrics  per-metric self-reported quality scores in [0,1]
 * @param metadata        provenance of the output
 */
public record ModuleResult(
    ModuleName moduleName,
    Object result,
    long executionTimeMs,
    Map<String, Double> qualityMetrics,
    Metadata metadata
) implements Serializable {

    public ModuleResult {
        moduleName = moduleName != null ? moduleName : ModuleName.UNKNOWN;
        // LinkedHashMap keeps null values out of Map.copyOf's way and preserves metric order
        qualityMetrics = qualityMetrics != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(qualityMetrics))
                : Map.of();
        metadata = metadata != null ? metadata : Metadata.now();
    }

    public ModuleResult(ModuleName moduleName, Map<String, Double> qualityMetrics) {
        this(moduleName, null, 0L, qualityMetrics, Metadata.now());
    }

    /** Reads a metric, returning {@code defaultValue} when the module did not report it. */
    public double metric(String name, double defaultValue) {
        Double value = qualityMetrics.get(name);
        return value != null ? value : defaultValue;
    }

    public record Metadata(
        Instant timestamp,
        String version,
        Map<String, Object> configuration
    ) implements Serializable {

        public Metadata {
            configuration = configuration != null
                    ? Collections.unmodifiableMap(new LinkedHashMap<>(configuration))
                    : Map.of();
        }

        public static Metadata now() {
            return new Metadata(Instant.now(), "1.0.0", Map.of());
        }
    }
}
