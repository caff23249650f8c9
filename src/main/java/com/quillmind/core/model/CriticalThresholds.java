package com.quillmind.core.model;

import java.io.Serializable;
import java.util.OptionalDouble;

/**
 * Critical thresholds a module's output must clear along the four core quality axes.
 */
public record CriticalThresholds(
    double coherence,
    double accuracy,
    double consistency,
    double completeness
) implements Serializable {

    /**
     * Looks up a threshold by axis name. Metric names that are not one of the four
     * axes have no threshold of their own.
     */
    public OptionalDouble forMetric(String metric) {
        if (metric == null) {
            return OptionalDouble.empty();
        }
        return switch (metric) {
            case "coherence" -> OptionalDouble.of(coherence);
            case "accuracy" -> OptionalDouble.of(accuracy);
            case "consistency" -> OptionalDouble.of(consistency);
            case "completeness" -> OptionalDouble.of(completeness);
            default -> OptionalDouble.empty();
        };
    }
}
