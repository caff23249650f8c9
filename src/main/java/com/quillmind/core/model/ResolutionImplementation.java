package com.quillmind.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Ordered plan for applying a resolution decision to the module outputs.
 */
public record ResolutionImplementation(
    List<ResolutionStep> steps,
    long estimatedTimeMs,
    String rollbackPlan,
    List<String> validationChecks
) implements Serializable {

    public ResolutionImplementation {
        steps = steps != null ? List.copyOf(steps) : List.of();
        validationChecks = validationChecks != null ? List.copyOf(validationChecks) : List.of();
    }
}
