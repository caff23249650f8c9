package com.quillmind.core.quality;

import com.quillmind.core.config.QuillmindProperties;
import com.quillmind.core.model.ModuleName;
import com.quillmind.core.model.ModuleResult;
import com.quillmind.core.model.QualityCheck;
import com.quillmind.core.model.WritingGoal;
import com.quillmind.core.standards.QualityStandardRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Compares the mean self-reported quality of all registered modules with the goal's threshold.
 * Modules reporting any metric outside [0, 1] are left out of the mean.
 */
@Component
@Order(4)
public class QualityThresholdValidator implements CrossModuleValidator {

    private static final Logger log = LoggerFactory.getLogger(QualityThresholdValidator.class);

    private final QualityStandardRegistry standardRegistry;
    private final QuillmindProperties properties;
    private final Clock clock;

    public QualityThresholdValidator(QualityStandardRegistry standardRegistry,
                                     QuillmindProperties properties,
                                     Clock clock) {
        this.standardRegistry = standardRegistry;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "Quality Threshold Validator";
    }

    @Override
    public String description() {
        return "Validates overall quality thresholds";
    }

    @Override
    public List<ModuleName> applicableModules() {
        return List.of(ModuleName.EMOTION_ARC, ModuleName.NARRATIVE_DASHBOARD, ModuleName.PLOT_STRUCTURE,
                ModuleName.STYLE_PROFILE, ModuleName.THEME_ANALYSIS);
    }

    @Override
    public List<String> validationRules() {
        return List.of("quality_thresholds", "critical_standards", "overall_coherence");
    }

    @Override
    public QualityCheck validate(List<ModuleResult> moduleResults, WritingGoal writingGoal) {
        long start = System.nanoTime();
        var issues = new ArrayList<String>();
        var suggestions = new ArrayList<String>();

        double total = 0.0;
        int moduleCount = 0;
        for (ModuleResult result : moduleResults) {
            if (!standardRegistry.isRegistered(result.moduleName()) || result.qualityMetrics().isEmpty()) {
                continue;
            }
            if (!hasUnitRangeMetrics(result)) {
                log.warn("Module {} reported metrics outside [0, 1], excluded from overall quality",
                        result.moduleName().id());
                continue;
            }
            double moduleTotal = 0.0;
            for (Double value : result.qualityMetrics().values()) {
                moduleTotal += value != null ? value : 0.0;
            }
            total += moduleTotal / result.qualityMetrics().size();
            moduleCount++;
        }
        double score = moduleCount > 0 ? total / moduleCount : 0.0;

        double threshold = writingGoal.qualityThreshold(properties.getDefaultQualityThreshold());
        boolean passed = score >= threshold;

        if (!passed) {
            issues.add("Overall quality " + ScoreFormat.fixed(score) + " below threshold " + ScoreFormat.plain(threshold));
            suggestions.add("Improve module outputs to meet quality requirements");
        }
        if (score < threshold + 0.1) {
            suggestions.add("Consider additional optimizations for higher quality");
        }

        return new QualityCheck(ModuleName.SYSTEM, QualityCheck.OVERALL_QUALITY, passed, score, issues, suggestions,
                new QualityCheck.Metadata(clock.instant(), (System.nanoTime() - start) / 1_000_000.0,
                        validationRules()));
    }

    private static boolean hasUnitRangeMetrics(ModuleResult result) {
        for (Double value : result.qualityMetrics().values()) {
            if (value != null && !(Double.isFinite(value) && value >= 0.0 && value <= 1.0)) {
                return false;
            }
        }
        return true;
    }
}
