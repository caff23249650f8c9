package com.quillmind.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * One validator's verdict on a module or on a group of modules.
 *
 * @param moduleName  module the check is attributed to ({@link ModuleName#SYSTEM} for system-wide checks)
 * @param checkType   e.g. {@code module_validation}, {@code cross_module_coherence}
 * @param passed      whether the check cleared its own bar
 * @param score       score in [0,1]
 * @param issues      human-readable problems found
 * @param suggestions remediation lines
 * @param metadata    timing and rules applied
 */
public record QualityCheck(
    ModuleName moduleName,
    String checkType,
    boolean passed,
    double score,
    List<String> issues,
    List<String> suggestions,
    Metadata metadata
) implements Serializable {

    public static final String MODULE_VALIDATION = "module_validation";
    public static final String CROSS_MODULE_COHERENCE = "cross_module_coherence";
    public static final String CROSS_MODULE_THEMATIC = "cross_module_thematic";
    public static final String CROSS_MODULE_STYLE = "cross_module_style";
    public static final String OVERALL_QUALITY = "overall_quality";

    /** Failed checks scoring below this count as critical issues. */
    public static final double CRITICAL_SCORE = 0.6;

    public QualityCheck {
        issues = issues != null ? List.copyOf(issues) : List.of();
        suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
    }

    public boolean isCritical() {
        return !passed && score < CRITICAL_SCORE;
    }

    public record Metadata(
        Instant timestamp,
        double validationTimeMs,
        List<String> rulesApplied
    ) implements Serializable {

        public Metadata {
            rulesApplied = rulesApplied != null ? List.copyOf(rulesApplied) : List.of();
        }
    }
}
