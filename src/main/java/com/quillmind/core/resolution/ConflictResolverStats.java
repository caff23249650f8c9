package com.quillmind.core.resolution;

/**
 * Running totals kept by {@link IntelligentConflictResolver}.
 *
 * @param userSatisfaction reserved; no feedback channel feeds it yet
 */
public record ConflictResolverStats(
    long totalConflicts,
    double averageResolutionTimeMs,
    double successRate,
    double userSatisfaction,
    int recentResolutions
) {}
