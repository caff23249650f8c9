package com.quillmind.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate verdict over every check run in one coordinator call.
 * <p>
 * {@code passed} is true exactly when {@code overallScore} reaches the goal's quality
 * threshold. {@code moduleScores} keeps the order in which modules were first scored.
 */
public record QualityValidation(
    double overallScore,
    Map<ModuleName, Double> moduleScores,
    boolean passed,
    List<ImprovementSuggestion> improvements,
    List<QualityCheck> validationDetails,
    Metadata metadata
) implements Serializable {

    public QualityValidation {
        moduleScores = moduleScores != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(moduleScores))
                : Map.of();
        improvements = improvements != null ? List.copyOf(improvements) : List.of();
        validationDetails = validationDetails != null ? List.copyOf(validationDetails) : List.of();
    }

    public record Metadata(
        Instant validationTime,
        int totalChecks,
        int passedChecks,
        int criticalIssues
    ) implements Serializable {}
}
