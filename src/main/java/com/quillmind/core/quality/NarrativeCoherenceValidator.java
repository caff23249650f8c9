package com.quillmind.core.quality;

import com.quillmind.core.model.ModuleName;
import com.quillmind.core.model.QualityCheck;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Checks that emotional beats, narrative flow and plot logic agree.
 */
@Component
@Order(1)
public class NarrativeCoherenceValidator extends PairwiseAlignmentValidator {

    private static final List<MetricPair> PAIRS = List.of(
            new MetricPair(ModuleName.EMOTION_ARC, "emotionalCoherence",
                    ModuleName.NARRATIVE_DASHBOARD, "narrativeFlow", 0.2,
                    "Emotional and narrative elements are misaligned",
                    "Reconcile emotional states with narrative progression"),
            new MetricPair(ModuleName.NARRATIVE_DASHBOARD, "structuralCoherence",
                    ModuleName.PLOT_STRUCTURE, "plotLogic", 0.15,
                    "Narrative structure and plot logic are inconsistent",
                    "Align plot structure with narrative flow"));

    public NarrativeCoherenceValidator(Clock clock) {
        super(clock);
    }

    @Override
    public String name() {
        return "Narrative Coherence Validator";
    }

    @Override
    public String description() {
        return "Validates coherence across narrative elements";
    }

    @Override
    public List<ModuleName> applicableModules() {
        return List.of(ModuleName.EMOTION_ARC, ModuleName.NARRATIVE_DASHBOARD, ModuleName.PLOT_STRUCTURE);
    }

    @Override
    public List<String> validationRules() {
        return List.of("narrative_flow", "character_consistency", "plot_logic");
    }

    @Override
    protected ModuleName reportingModule() {
        return ModuleName.NARRATIVE_DASHBOARD;
    }

    @Override
    protected String checkType() {
        return QualityCheck.CROSS_MODULE_COHERENCE;
    }

    @Override
    protected List<MetricPair> pairs() {
        return PAIRS;
    }
}
