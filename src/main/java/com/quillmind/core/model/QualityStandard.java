package com.quillmind.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Scoring rubric for one module kind.
 * <p>
 * {@code minimumScore} decides pass/fail; {@code targetScore} is the level above which
 * no further optimisation is suggested.
 */
public record QualityStandard(
    ModuleName moduleName,
    double minimumScore,
    double targetScore,
    CriticalThresholds criticalThresholds,
    List<String> validationRules,
    List<String> qualityMetrics
) implements Serializable {

    public QualityStandard {
        if (minimumScore > targetScore) {
            throw new IllegalArgumentException(String.format(
                    "Standard for %s has minimumScore %.2f above targetScore %.2f",
                    moduleName, minimumScore, targetScore));
        }
        validationRules = validationRules != null ? List.copyOf(validationRules) : List.of();
        qualityMetrics = qualityMetrics != null ? List.copyOf(qualityMetrics) : List.of();
    }
}
