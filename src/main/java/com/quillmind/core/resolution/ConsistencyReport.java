package com.quillmind.core.resolution;

import com.quillmind.core.model.ModuleName;

import java.util.List;
import java.util.Set;

/**
 * Outcome of checking a batch of resolutions against each other.
 *
 * @param inconsistentModules primary modules whose resolutions use more than one decision type
 * @param overallCoherence    mean narrative impact of the batch, 1.0 when empty
 */
public record ConsistencyReport(
    boolean passed,
    List<String> issues,
    Set<ModuleName> inconsistentModules,
    double overallCoherence
) {

    public ConsistencyReport {
        issues = issues != null ? List.copyOf(issues) : List.of();
        inconsistentModules = inconsistentModules != null ? Set.copyOf(inconsistentModules) : Set.of();
    }
}
