package com.quillmind.core.quality;

import com.quillmind.core.model.ModuleName;
import com.quillmind.core.model.QualityCheck;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Checks that style choices match character voice and narrative style.
 */
@Component
@Order(3)
public class StyleVoiceAlignmentValidator extends PairwiseAlignmentValidator {

    private static final List<MetricPair> PAIRS = List.of(
            new MetricPair(ModuleName.STYLE_PROFILE, "voiceConsistency",
                    ModuleName.EMOTION_ARC, "characterVoice", 0.2,
                    "Style voice and character voice are misaligned",
                    "Align style choices with character voice authenticity"),
            new MetricPair(ModuleName.STYLE_PROFILE, "styleCoherence",
                    ModuleName.NARRATIVE_DASHBOARD, "narrativeStyle", 0.15,
                    "Style coherence and narrative style are inconsistent",
                    "Maintain consistent style throughout narrative"));

    public StyleVoiceAlignmentValidator(Clock clock) {
        super(clock);
    }

    @Override
    public String name() {
        return "Style Voice Alignment Validator";
    }

    @Override
    public String description() {
        return "Validates style and voice consistency";
    }

    @Override
    public List<ModuleName> applicableModules() {
        return List.of(ModuleName.STYLE_PROFILE, ModuleName.EMOTION_ARC, ModuleName.NARRATIVE_DASHBOARD);
    }

    @Override
    public List<String> validationRules() {
        return List.of("voice_consistency", "style_coherence", "character_authenticity");
    }

    @Override
    protected ModuleName reportingModule() {
        return ModuleName.STYLE_PROFILE;
    }

    @Override
    protected String checkType() {
        return QualityCheck.CROSS_MODULE_STYLE;
    }

    @Override
    protected List<MetricPair> pairs() {
        return PAIRS;
    }
}
