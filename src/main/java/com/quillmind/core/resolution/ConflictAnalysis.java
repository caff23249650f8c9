package com.quillmind.core.resolution;

import com.quillmind.core.model.ConflictSeverity;
import com.quillmind.core.model.ConflictType;
import com.quillmind.core.model.InterModuleConflict;

/**
 * Summary of a conflict before strategy matching.
 *
 * @param complexity in [0,1]; recorded for reporting only
 */
public record ConflictAnalysis(
    ConflictType type,
    ConflictSeverity severity,
    double complexity
) {

    public static ConflictAnalysis of(InterModuleConflict conflict) {
        double complexity = Math.min(1.0,
                conflict.modules().size() * 0.2
                        + conflict.conflictingData().size() * 0.1
                        + conflict.impact().narrativeCoherence() * 0.3
                        + conflict.impact().qualityScore() * 0.4);
        return new ConflictAnalysis(conflict.type(), conflict.severity(), complexity);
    }
}
