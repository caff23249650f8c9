package com.quillmind.core.quality;

import com.quillmind.core.model.ModuleResult;
import com.quillmind.core.model.QualityCheck;
import com.quillmind.core.model.QualityStandard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Scores one {@link ModuleResult} against its module's {@link QualityStandard}.
 * <p>
 * Every metric named by the standard is compared with its critical threshold; the check
 * score is the mean of the metric values. Scoring errors never escape: they are turned into
 * a failed check so the rest of the batch is still validated.
 */
@Component
public class ModuleResultValidator {

    private static final Logger log = LoggerFactory.getLogger(ModuleResultValidator.class);

    /** Threshold for metrics that are not one of the four critical axes. */
    static final double DEFAULT_METRIC_THRESHOLD = 0.8;

    private final Clock clock;

    public ModuleResultValidator(Clock clock) {
        this.clock = clock;
    }

    public QualityCheck validate(ModuleResult result, QualityStandard standard) {
        long start = System.nanoTime();
        try {
            return score(result, standard, start);
        } catch (RuntimeException e) {
            log.warn("Error validating module {}: {}", result.moduleName(), e.getMessage());
            return new QualityCheck(
                    result.moduleName(),
                    QualityCheck.MODULE_VALIDATION,
                    false,
                    0.0,
                    List.of("Validation error: " + (e.getMessage() != null ? e.getMessage() : "Unknown error")),
                    List.of("Review module output and retry validation"),
                    new QualityCheck.Metadata(clock.instant(), elapsedMs(start), List.of()));
        }
    }

    private QualityCheck score(ModuleResult result, QualityStandard standard, long start) {
        var issues = new ArrayList<String>();
        var suggestions = new ArrayList<String>();

        double total = 0.0;
        int checked = 0;
        for (String metric : standard.qualityMetrics()) {
            double value = readMetric(result, metric);
            double threshold = standard.criticalThresholds().forMetric(metric).orElse(DEFAULT_METRIC_THRESHOLD);

            checked++;
            if (value < threshold) {
                issues.add(metric + " below threshold: " + ScoreFormat.plain(value) + " < " + ScoreFormat.plain(threshold));
                suggestions.add("Improve " + metric + " to meet quality standards");
            }
            total += value;
        }

        double score = checked > 0 ? total / checked : 0.0;
        boolean passed = score >= standard.minimumScore();

        if (!passed) {
            suggestions.add("Overall quality needs improvement to meet "
                    + ScoreFormat.plain(standard.minimumScore()) + " threshold");
        }
        if (score < standard.targetScore()) {
            suggestions.add("Consider optimizations to reach target score of "
                    + ScoreFormat.plain(standard.targetScore()));
        }

        log.debug("Module {} scored {} ({} of {} metrics below threshold)",
                result.moduleName(), ScoreFormat.fixed(score), issues.size(), checked);

        return new QualityCheck(
                result.moduleName(),
                QualityCheck.MODULE_VALIDATION,
                passed,
                score,
                issues,
                suggestions,
                new QualityCheck.Metadata(clock.instant(), elapsedMs(start), standard.validationRules()));
    }

    private static double readMetric(ModuleResult result, String metric) {
        double value = result.metric(metric, 0.0);
        if (!Double.isFinite(value) || value < 0.0 || value > 1.0) {
            throw new ModuleValidationException(
                    "Metric " + metric + " of " + result.moduleName() + " is not a score in [0,1]: " + value);
        }
        return value;
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
