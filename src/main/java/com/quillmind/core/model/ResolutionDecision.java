package com.quillmind.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A candidate or chosen way to resolve one conflict.
 */
public record ResolutionDecision(
    ResolutionType type,
    ModuleName primaryModule,
    List<ModuleName> secondaryModules,
    String decision,
    String reasoning,
    double confidence
) implements Serializable {

    public ResolutionDecision {
        secondaryModules = secondaryModules != null ? List.copyOf(secondaryModules) : List.of();
    }

    public ResolutionDecision withConfidence(double newConfidence) {
        return new ResolutionDecision(type, primaryModule, secondaryModules, decision, reasoning, newConfidence);
    }
}
