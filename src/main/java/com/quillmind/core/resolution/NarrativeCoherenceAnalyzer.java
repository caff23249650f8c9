package com.quillmind.core.resolution;

import com.quillmind.core.model.InterModuleConflict;
import com.quillmind.core.model.ResolutionDecision;
import com.quillmind.core.model.WritingContext;

import java.util.List;

/**
 * Estimates how a resolution decision affects narrative coherence.
 */
public interface NarrativeCoherenceAnalyzer {

    /** Expected coherence after applying the decision, in [0,1]. */
    double analyzeCoherence(InterModuleConflict conflict, ResolutionDecision decision);

    boolean validateNarrativeFlow(ResolutionDecision decision, WritingContext context);

    List<String> suggestCoherenceImprovements(ResolutionDecision decision);
}
