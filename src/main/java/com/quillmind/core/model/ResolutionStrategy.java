package com.quillmind.core.model;

import java.util.List;
import java.util.function.BiFunction;

/**
 * Registered handling for one {@link ConflictType}.
 *
 * @param resolutionLogic pure function giving the strategy's recommended decision
 */
public record ResolutionStrategy(
    ConflictType type,
    String name,
    String description,
    int priority,
    List<String> applicableConditions,
    BiFunction<InterModuleConflict, WritingContext, ResolutionDecision> resolutionLogic,
    List<String> validationRules
) {

    public ResolutionStrategy {
        applicableConditions = applicableConditions != null ? List.copyOf(applicableConditions) : List.of();
        validationRules = validationRules != null ? List.copyOf(validationRules) : List.of();
    }

    public ResolutionDecision recommend(InterModuleConflict conflict, WritingContext context) {
        return resolutionLogic.apply(conflict, context);
    }
}
