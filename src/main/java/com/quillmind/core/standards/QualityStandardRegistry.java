package com.quillmind.core.standards;

import com.quillmind.core.model.CriticalThresholds;
import com.quillmind.core.model.ModuleName;
import com.quillmind.core.model.QualityStandard;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static table of {@link QualityStandard}s, one per content module.
 * <p>
 * Modules without an entry ({@link ModuleName#UNKNOWN}, {@link ModuleName#SYSTEM}) are never
 * scored individually.
 */
@Component
public class QualityStandardRegistry {

    private final Map<ModuleName, QualityStandard> standards;

    public QualityStandardRegistry() {
        this(defaultStandards());
    }

    public QualityStandardRegistry(List<QualityStandard> standards) {
        var table = new EnumMap<ModuleName, QualityStandard>(ModuleName.class);
        for (QualityStandard standard : standards) {
            if (!standard.moduleName().isContentModule()) {
                throw new IllegalStateException("Standards can only be registered for content modules, got "
                        + standard.moduleName());
            }
            if (table.putIfAbsent(standard.moduleName(), standard) != null) {
                throw new IllegalStateException("Duplicate quality standard for " + standard.moduleName());
            }
        }
        this.standards = Collections.unmodifiableMap(table);
    }

    public Optional<QualityStandard> find(ModuleName moduleName) {
        return Optional.ofNullable(standards.get(moduleName));
    }

    public boolean isRegistered(ModuleName moduleName) {
        return standards.containsKey(moduleName);
    }

    public Map<ModuleName, QualityStandard> all() {
        return standards;
    }

    static List<QualityStandard> defaultStandards() {
        return List.of(
                new QualityStandard(ModuleName.EMOTION_ARC, 0.75, 0.9,
                        new CriticalThresholds(0.8, 0.85, 0.8, 0.75),
                        List.of("emotional_arc_progression", "character_consistency",
                                "emotional_coherence", "motivation_clarity"),
                        List.of("emotional_depth", "character_development",
                                "emotional_progression", "relationship_dynamics")),
                new QualityStandard(ModuleName.NARRATIVE_DASHBOARD, 0.8, 0.92,
                        new CriticalThresholds(0.85, 0.8, 0.85, 0.8),
                        List.of("story_structure", "narrative_flow", "plot_progression", "scene_transitions"),
                        List.of("structural_coherence", "narrative_pacing", "plot_logic", "story_completeness")),
                new QualityStandard(ModuleName.PLOT_STRUCTURE, 0.78, 0.88,
                        new CriticalThresholds(0.8, 0.85, 0.8, 0.75),
                        List.of("plot_coherence", "conflict_resolution", "story_beats", "structural_integrity"),
                        List.of("plot_complexity", "conflict_development",
                                "resolution_satisfaction", "structural_soundness")),
                new QualityStandard(ModuleName.STYLE_PROFILE, 0.82, 0.93,
                        new CriticalThresholds(0.85, 0.8, 0.9, 0.8),
                        List.of("voice_consistency", "style_coherence", "tone_appropriateness", "language_quality"),
                        List.of("style_consistency", "voice_authenticity", "tone_effectiveness", "language_clarity")),
                new QualityStandard(ModuleName.THEME_ANALYSIS, 0.75, 0.87,
                        new CriticalThresholds(0.8, 0.85, 0.8, 0.75),
                        List.of("thematic_coherence", "symbol_consistency", "meaning_depth", "theme_development"),
                        List.of("thematic_strength", "symbol_effectiveness", "meaning_clarity", "theme_integration"))
        );
    }
}
