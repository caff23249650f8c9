package com.quillmind.core.quality;

import com.quillmind.core.model.ModuleName;
import com.quillmind.core.model.QualityCheck;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Checks that themes are carried by the plot and by the emotional arc.
 */
@Component
@Order(2)
public class ThematicIntegrationValidator extends PairwiseAlignmentValidator {

    private static final List<MetricPair> PAIRS = List.of(
            new MetricPair(ModuleName.THEME_ANALYSIS, "thematicCoherence",
                    ModuleName.PLOT_STRUCTURE, "thematicSupport", 0.2,
                    "Thematic elements and plot support are misaligned",
                    "Strengthen plot support for thematic elements"),
            new MetricPair(ModuleName.EMOTION_ARC, "emotionalThemes",
                    ModuleName.THEME_ANALYSIS, "emotionalSupport", 0.15,
                    "Emotional themes lack thematic support",
                    "Develop emotional themes with stronger thematic foundation"));

    public ThematicIntegrationValidator(Clock clock) {
        super(clock);
    }

    @Override
    public String name() {
        return "Thematic Integration Validator";
    }

    @Override
    public String description() {
        return "Validates thematic consistency across modules";
    }

    @Override
    public List<ModuleName> applicableModules() {
        return List.of(ModuleName.EMOTION_ARC, ModuleName.THEME_ANALYSIS, ModuleName.PLOT_STRUCTURE);
    }

    @Override
    public List<String> validationRules() {
        return List.of("thematic_coherence", "symbol_alignment", "meaning_consistency");
    }

    @Override
    protected ModuleName reportingModule() {
        return ModuleName.THEME_ANALYSIS;
    }

    @Override
    protected String checkType() {
        return QualityCheck.CROSS_MODULE_THEMATIC;
    }

    @Override
    protected List<MetricPair> pairs() {
        return PAIRS;
    }
}
