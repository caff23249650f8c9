package com.quillmind.core.quality;

import com.quillmind.core.model.ModuleName;
import com.quillmind.core.model.ModuleResult;
import com.quillmind.core.model.QualityCheck;
import com.quillmind.core.model.WritingGoal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Base for validators that compare metric pairs between two modules.
 * <p>
 * Starts from a neutral base score and subtracts a penalty for every pair whose values
 * differ by more than the pair's tolerance. Pairs with a missing module are skipped;
 * a metric the module did not report reads as the neutral base.
 */
abstract class PairwiseAlignmentValidator implements CrossModuleValidator {

    private static final Logger log = LoggerFactory.getLogger(PairwiseAlignmentValidator.class);

    static final double BASE_SCORE = 0.8;
    static final double PASS_SCORE = 0.7;

    /**
     * One metric comparison. The penalty applied on a mismatch equals the tolerance.
     */
    record MetricPair(
        ModuleName leftModule,
        String leftMetric,
        ModuleName rightModule,
        String rightMetric,
        double tolerance,
        String issue,
        String suggestion
    ) {}

    private final Clock clock;

    protected PairwiseAlignmentValidator(Clock clock) {
        this.clock = clock;
    }

    /** Module the resulting check is attributed to. */
    protected abstract ModuleName reportingModule();

    protected abstract String checkType();

    protected abstract List<MetricPair> pairs();

    @Override
    public QualityCheck validate(List<ModuleResult> moduleResults, WritingGoal writingGoal) {
        long start = System.nanoTime();
        var issues = new ArrayList<String>();
        var suggestions = new ArrayList<String>();
        double score = BASE_SCORE;

        for (MetricPair pair : pairs()) {
            var left = find(moduleResults, pair.leftModule());
            var right = find(moduleResults, pair.rightModule());
            if (left.isEmpty() || right.isEmpty()) {
                continue;
            }
            double leftValue = left.get().metric(pair.leftMetric(), BASE_SCORE);
            double rightValue = right.get().metric(pair.rightMetric(), BASE_SCORE);
            if (Math.abs(leftValue - rightValue) > pair.tolerance()) {
                issues.add(pair.issue());
                suggestions.add(pair.suggestion());
                score -= pair.tolerance();
            }
        }

        boolean passed = score >= PASS_SCORE;
        log.debug("{} scored {} with {} misalignment(s)", name(), ScoreFormat.fixed(score), issues.size());

        return new QualityCheck(reportingModule(), checkType(), passed, score, issues, suggestions,
                new QualityCheck.Metadata(clock.instant(), (System.nanoTime() - start) / 1_000_000.0,
                        validationRules()));
    }

    static Optional<ModuleResult> find(List<ModuleResult> moduleResults, ModuleName moduleName) {
        return moduleResults.stream().filter(r -> r.moduleName() == moduleName).findFirst();
    }
}
