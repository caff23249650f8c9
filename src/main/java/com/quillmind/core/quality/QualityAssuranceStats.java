package com.quillmind.core.quality;

/**
 * Running totals kept by {@link QualityAssuranceCoordinator}.
 *
 * @param recentValidations number of history entries considered recent, at most ten
 */
public record QualityAssuranceStats(
    long totalValidations,
    double averageValidationTimeMs,
    double qualityImprovementRate,
    double criticalIssueRate,
    int recentValidations
) {}
