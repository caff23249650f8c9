package com.quillmind.core.resolution;

import com.quillmind.core.model.ConflictType;
import com.quillmind.core.model.InterModuleConflict;
import com.quillmind.core.model.ResolutionDecision;
import com.quillmind.core.model.ResolutionType;
import com.quillmind.core.model.WritingContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Table-driven coherence estimate: a base of {@value #BASE_COHERENCE} plus a bonus for the
 * conflict type and one for the decision type, capped at 1.
 */
public class DefaultNarrativeCoherenceAnalyzer implements NarrativeCoherenceAnalyzer {

    static final double BASE_COHERENCE = 0.8;
    static final double FLOW_CONFIDENCE = 0.7;
    static final double CONFIDENT_ENOUGH = 0.8;

    @Override
    public double analyzeCoherence(InterModuleConflict conflict, ResolutionDecision decision) {
        return Math.min(1.0, BASE_COHERENCE + typeBonus(conflict.type()) + decisionBonus(decision.type()));
    }

    @Override
    public boolean validateNarrativeFlow(ResolutionDecision decision, WritingContext context) {
        return decision.confidence() > FLOW_CONFIDENCE;
    }

    @Override
    public List<String> suggestCoherenceImprovements(ResolutionDecision decision) {
        var suggestions = new ArrayList<String>();
        if (decision.confidence() < CONFIDENT_ENOUGH) {
            suggestions.add("Consider additional context analysis for higher confidence");
        }
        if (decision.type() == ResolutionType.PRIORITIZE) {
            suggestions.add("Evaluate impact on secondary module outputs");
        }
        return suggestions;
    }

    private static double typeBonus(ConflictType type) {
        return switch (type) {
            case EMOTIONAL_NARRATIVE_MISMATCH -> 0.1;
            case PLOT_THEME_INCONSISTENCY -> 0.05;
            case STYLE_VOICE_CONFLICT -> 0.08;
            default -> 0.03;
        };
    }

    private static double decisionBonus(ResolutionType type) {
        return switch (type) {
            case MERGE -> 0.1;
            case PRIORITIZE -> 0.05;
            case RECONCILE -> 0.08;
            default -> 0.02;
        };
    }
}
