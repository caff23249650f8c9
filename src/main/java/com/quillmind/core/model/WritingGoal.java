package com.quillmind.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * High-level writing objective the module outputs are validated against.
 */
public record WritingGoal(
    String id,
    String type,
    Requirements requirements,
    Constraints constraints
) implements Serializable {

    public WritingGoal {
        requirements = requirements != null ? requirements : new Requirements(null, null, null, null);
        constraints = constraints != null ? constraints : new Constraints(null, null);
    }

    /** Convenience for the common case where only the threshold matters. */
    public static WritingGoal withThreshold(String id, double qualityThreshold) {
        return new WritingGoal(id, "story", null, new Constraints(qualityThreshold, null));
    }

    /** The goal's quality threshold, or {@code defaultThreshold} when none was set. */
    public double qualityThreshold(double defaultThreshold) {
        Double threshold = constraints.qualityThreshold();
        return threshold != null ? threshold : defaultThreshold;
    }

    public record Requirements(
        QualityLevel qualityLevel,
        String targetAudience,
        String genre,
        Map<String, Object> extras
    ) implements Serializable {

        public Requirements {
            qualityLevel = qualityLevel != null ? qualityLevel : QualityLevel.POLISHED;
            extras = extras != null ? Collections.unmodifiableMap(new LinkedHashMap<>(extras)) : Map.of();
        }
    }

    public record Constraints(
        Double qualityThreshold,
        Map<String, Object> extras
    ) implements Serializable {

        public Constraints {
            extras = extras != null ? Collections.unmodifiableMap(new LinkedHashMap<>(extras)) : Map.of();
        }
    }
}
