package com.quillmind.core.resolution;

import com.quillmind.core.model.ConflictType;
import com.quillmind.core.model.ModuleName;
import com.quillmind.core.model.ResolutionDecision;
import com.quillmind.core.model.ResolutionStrategy;
import com.quillmind.core.model.ResolutionType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Catalogue of resolution strategies, one per recognised {@link ConflictType}.
 * <p>
 * Each strategy carries a fixed recommended decision. The resolver itself builds its own
 * candidates; the recommendation is what a strategy would choose on its own.
 */
@Component
public class ResolutionStrategyRegistry {

    private final Map<ConflictType, ResolutionStrategy> strategies;

    public ResolutionStrategyRegistry() {
        var table = new EnumMap<ConflictType, ResolutionStrategy>(ConflictType.class);
        for (ResolutionStrategy strategy : defaultStrategies()) {
            table.put(strategy.type(), strategy);
        }
        this.strategies = Collections.unmodifiableMap(table);
    }

    public Optional<ResolutionStrategy> find(ConflictType type) {
        return Optional.ofNullable(strategies.get(type));
    }

    /**
     * @throws MissingStrategyException when the type has no strategy, which is the case for
     *                                  {@link ConflictType#UNRECOGNIZED}
     */
    public ResolutionStrategy require(ConflictType type) {
        return find(type).orElseThrow(() -> new MissingStrategyException(type));
    }

    /** In conflict type declaration order. */
    public List<ResolutionStrategy> all() {
        return new ArrayList<>(strategies.values());
    }

    private static List<ResolutionStrategy> defaultStrategies() {
        return List.of(
                strategy(ConflictType.EMOTIONAL_NARRATIVE_MISMATCH, "Emotional-Narrative Reconciliation",
                        "Reconcile emotional states with narrative flow", 1,
                        List.of("emotional_analysis_present", "narrative_structure_defined"),
                        List.of("emotional_coherence", "narrative_flow", "character_consistency"),
                        new ResolutionDecision(ResolutionType.RECONCILE, ModuleName.EMOTION_ARC,
                                List.of(ModuleName.NARRATIVE_DASHBOARD),
                                "Reconcile emotional states with narrative progression",
                                "Emotional states should align with narrative flow for coherence", 0.85)),
                strategy(ConflictType.PLOT_THEME_INCONSISTENCY, "Plot-Theme Alignment",
                        "Align plot structure with thematic elements", 2,
                        List.of("plot_structure_defined", "thematic_elements_present"),
                        List.of("thematic_coherence", "plot_logic", "symbol_consistency"),
                        new ResolutionDecision(ResolutionType.MERGE, ModuleName.PLOT_STRUCTURE,
                                List.of(ModuleName.THEME_ANALYSIS),
                                "Merge plot structure with thematic elements",
                                "Plot and themes should work together to create meaningful narrative", 0.8)),
                strategy(ConflictType.STYLE_VOICE_CONFLICT, "Style-Voice Harmonization",
                        "Harmonize style choices with character voice", 3,
                        List.of("style_analysis_present", "character_voice_defined"),
                        List.of("voice_consistency", "style_coherence", "character_authenticity"),
                        new ResolutionDecision(ResolutionType.PRIORITIZE, ModuleName.STYLE_PROFILE,
                                List.of(ModuleName.EMOTION_ARC),
                                "Prioritize character voice over style preferences",
                                "Character authenticity is more important than style consistency", 0.75)),
                strategy(ConflictType.CHARACTER_ARC_DISCONTINUITY, "Character Arc Continuity",
                        "Ensure character development follows logical progression", 1,
                        List.of("character_development_present", "emotional_arc_defined"),
                        List.of("character_consistency", "emotional_progression", "motivation_clarity"),
                        new ResolutionDecision(ResolutionType.RECONCILE, ModuleName.EMOTION_ARC,
                                List.of(ModuleName.NARRATIVE_DASHBOARD),
                                "Reconcile character arc with narrative progression",
                                "Character development must align with story progression", 0.9)),
                strategy(ConflictType.THEMATIC_COHERENCE_BREAK, "Thematic Coherence Restoration",
                        "Restore thematic consistency across narrative elements", 2,
                        List.of("thematic_elements_present", "narrative_structure_defined"),
                        List.of("thematic_consistency", "symbol_alignment", "meaning_coherence"),
                        new ResolutionDecision(ResolutionType.MERGE, ModuleName.THEME_ANALYSIS,
                                List.of(ModuleName.EMOTION_ARC, ModuleName.PLOT_STRUCTURE),
                                "Merge thematic elements for coherence",
                                "Themes should be consistent across all narrative elements", 0.8)),
                strategy(ConflictType.STRUCTURAL_TIMING_ISSUE, "Structural Timing Optimization",
                        "Optimize timing and pacing of structural elements", 3,
                        List.of("plot_structure_defined", "narrative_flow_analyzed"),
                        List.of("pacing_consistency", "structural_logic", "timing_coherence"),
                        new ResolutionDecision(ResolutionType.RECONCILE, ModuleName.PLOT_STRUCTURE,
                                List.of(ModuleName.NARRATIVE_DASHBOARD),
                                "Reconcile structural timing with narrative flow",
                                "Structural elements must support optimal pacing", 0.75)),
                strategy(ConflictType.GENRE_CONVENTION_VIOLATION, "Genre Convention Compliance",
                        "Ensure compliance with genre-specific conventions", 2,
                        List.of("genre_defined", "conventions_analyzed"),
                        List.of("genre_compliance", "convention_consistency", "audience_expectations"),
                        new ResolutionDecision(ResolutionType.PRIORITIZE, ModuleName.STYLE_PROFILE,
                                List.of(ModuleName.THEME_ANALYSIS),
                                "Prioritize genre convention compliance",
                                "Genre conventions are critical for audience expectations", 0.85)),
                strategy(ConflictType.AUDIENCE_EXPECTATION_MISMATCH, "Audience Expectation Alignment",
                        "Align content with target audience expectations", 1,
                        List.of("target_audience_defined", "expectations_analyzed"),
                        List.of("audience_alignment", "content_appropriateness", "engagement_optimization"),
                        new ResolutionDecision(ResolutionType.RECONCILE, ModuleName.STYLE_PROFILE,
                                List.of(ModuleName.THEME_ANALYSIS, ModuleName.EMOTION_ARC),
                                "Reconcile content with audience expectations",
                                "Content must meet audience expectations for engagement", 0.8))
        );
    }

    private static ResolutionStrategy strategy(ConflictType type, String name, String description, int priority,
                                               List<String> conditions, List<String> rules,
                                               ResolutionDecision recommended) {
        return new ResolutionStrategy(type, name, description, priority, conditions,
                (conflict, context) -> recommended, rules);
    }
}
