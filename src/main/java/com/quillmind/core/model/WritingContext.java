package com.quillmind.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Situational parameters supplied by the orchestration layer for conflict resolution.
 *
 * @param userId                 owner of the writing session
 * @param documentType           e.g. "novel", "short_story"
 * @param userGoals              free-form goals stated by the user
 * @param writingPhase           current phase
 * @param userExperience         experience level
 * @param currentMode            assistant initiative mode
 * @param sessionDurationMinutes length of the current session
 * @param interactionPatterns    observed behaviour flags
 */
public record WritingContext(
    String userId,
    String documentType,
    List<String> userGoals,
    WritingPhase writingPhase,
    UserExperience userExperience,
    SystemMode currentMode,
    long sessionDurationMinutes,
    InteractionPatterns interactionPatterns
) implements Serializable {

    public WritingContext {
        userGoals = userGoals != null ? List.copyOf(userGoals) : List.of();
        writingPhase = writingPhase != null ? writingPhase : WritingPhase.DRAFTING;
        userExperience = userExperience != null ? userExperience : UserExperience.INTERMEDIATE;
        currentMode = currentMode != null ? currentMode : SystemMode.HYBRID;
        interactionPatterns = interactionPatterns != null
                ? interactionPatterns
                : new InteractionPatterns(false, false, false, false);
    }

    public static WritingContext forMode(String userId, SystemMode mode) {
        return new WritingContext(userId, "novel", List.of(), WritingPhase.DRAFTING,
                UserExperience.INTERMEDIATE, mode, 0L, null);
    }

    public boolean isFullyAuto() {
        return currentMode == SystemMode.FULLY_AUTO;
    }

    public record InteractionPatterns(
        boolean frequentEdits,
        boolean longWritingSessions,
        boolean collaborativeWork,
        boolean researchIntensive
    ) implements Serializable {}
}
