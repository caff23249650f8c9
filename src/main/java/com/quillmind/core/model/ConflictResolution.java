package com.quillmind.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Final, implementable outcome for one conflict.
 *
 * @param conflictId      id of the resolved conflict
 * @param resolution      the chosen decision
 * @param confidence      confidence of the chosen decision
 * @param rationale       why the decision was chosen
 * @param userAligned     whether the user preference weight exceeded 0.7
 * @param narrativeImpact coherence of the narrative after applying the decision
 * @param implementation  steps to apply the decision
 * @param metadata        provenance of the resolution
 */
public record ConflictResolution(
    String conflictId,
    ResolutionDecision resolution,
    double confidence,
    String rationale,
    boolean userAligned,
    double narrativeImpact,
    ResolutionImplementation implementation,
    Metadata metadata
) implements Serializable {

    public static final String FALLBACK_STRATEGY = "Fallback";

    public boolean isFallback() {
        return FALLBACK_STRATEGY.equals(metadata.strategyUsed());
    }

    /**
     * @param complexity           advisory complexity of the conflict, informational only
     * @param narrativeFlowValid   whether the coherence analyzer accepted the narrative flow
     * @param coherenceSuggestions follow-ups suggested by the coherence analyzer
     * @param reResolved           true when the decision was re-derived by the batch consistency pass
     */
    public record Metadata(
        Instant resolutionTime,
        String strategyUsed,
        int alternativesConsidered,
        double userPreferenceWeight,
        double complexity,
        boolean narrativeFlowValid,
        List<String> coherenceSuggestions,
        boolean reResolved
    ) implements Serializable {

        public Metadata {
            coherenceSuggestions = coherenceSuggestions != null ? List.copyOf(coherenceSuggestions) : List.of();
        }
    }
}
