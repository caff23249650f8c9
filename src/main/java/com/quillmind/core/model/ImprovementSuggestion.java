package com.quillmind.core.model;

import java.io.Serializable;

/**
 * A concrete recommendation derived from a quality check.
 */
public record ImprovementSuggestion(
    ModuleName moduleName,
    String suggestion,
    Priority priority,
    double estimatedImpact,
    String implementation,
    Effort effort
) implements Serializable {}
