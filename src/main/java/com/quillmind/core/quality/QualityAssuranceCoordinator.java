package com.quillmind.core.quality;

import com.quillmind.core.config.QuillmindProperties;
import com.quillmind.core.events.EventBus;
import com.quillmind.core.events.QuillmindEvent;
import com.quillmind.core.history.BoundedHistory;
import com.quillmind.core.logging.MdcContext;
import com.quillmind.core.metrics.QuillmindMetrics;
import com.quillmind.core.model.BatchAbandonedException;
import com.quillmind.core.model.BatchDeadline;
import com.quillmind.core.model.ModuleName;
import com.quillmind.core.model.ModuleResult;
import com.quillmind.core.model.QualityCheck;
import com.quillmind.core.model.QualityStandard;
import com.quillmind.core.model.QualityValidation;
import com.quillmind.core.model.WritingGoal;
import com.quillmind.core.standards.QualityMetricCatalog;
import com.quillmind.core.standards.QualityStandardRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Validates a batch of module outputs, per module and across modules.
 * <p>
 * Each output with a registered {@link QualityStandard} gets a module check; every
 * {@link CrossModuleValidator} then contributes one check for the whole batch. The checks
 * are aggregated into a {@link QualityValidation} with an overall score, per-module scores
 * and a ranked list of improvements.
 * <p>
 * The coordinator keeps a bounded validation history and running statistics. Both are
 * guarded by a single lock, so concurrent batches are safe.
 */
@Service
public class QualityAssuranceCoordinator {

    private static final Logger log = LoggerFactory.getLogger(QualityAssuranceCoordinator.class);

    static final double RATE_DECAY = 0.9;
    static final double RATE_WEIGHT = 0.1;
    static final int RECENT_WINDOW = 10;

    private final QualityStandardRegistry standardRegistry;
    private final ModuleResultValidator moduleValidator;
    private final List<CrossModuleValidator> crossModuleValidators;
    private final ImprovementSuggestionGenerator suggestionGenerator;
    private final QualityMetricCatalog metricCatalog;
    private final QuillmindProperties properties;
    private final QuillmindMetrics metrics;
    private final EventBus eventBus;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final BoundedHistory<QualityValidation> history;
    private long totalValidations;
    private double averageValidationTimeMs;
    private double qualityImprovementRate;
    private double criticalIssueRate;

    public QualityAssuranceCoordinator(QualityStandardRegistry standardRegistry,
                                       ModuleResultValidator moduleValidator,
                                       List<CrossModuleValidator> crossModuleValidators,
                                       ImprovementSuggestionGenerator suggestionGenerator,
                                       QualityMetricCatalog metricCatalog,
                                       QuillmindProperties properties,
                                       @Autowired(required = false) QuillmindMetrics metrics,
                                       @Autowired(required = false) EventBus eventBus,
                                       Clock clock) {
        this.standardRegistry = standardRegistry;
        this.moduleValidator = moduleValidator;
        this.crossModuleValidators = List.copyOf(crossModuleValidators);
        this.suggestionGenerator = suggestionGenerator;
        this.metricCatalog = metricCatalog;
        this.properties = properties;
        this.metrics = metrics;
        this.eventBus = eventBus;
        this.clock = clock;
        this.history = new BoundedHistory<>(properties.getQualityHistoryCapacity());
    }

    public QualityValidation validateResults(List<ModuleResult> moduleResults, WritingGoal writingGoal) {
        return validateResults(moduleResults, writingGoal, BatchDeadline.none());
    }

    /**
     * Validates one batch. The deadline is checked before every module and every cross-module
     * validator; when it has passed, nothing is recorded and {@link BatchAbandonedException} is thrown.
     */
    public QualityValidation validateResults(List<ModuleResult> moduleResults,
                                             WritingGoal writingGoal,
                                             BatchDeadline deadline) {
        Objects.requireNonNull(moduleResults, "moduleResults");
        Objects.requireNonNull(writingGoal, "writingGoal");
        Objects.requireNonNull(deadline, "deadline");

        String batchId = "QV-" + UUID.randomUUID().toString().substring(0, 8);
        long start = System.nanoTime();
        MdcContext.setBatch(batchId);
        try {
            log.info("Validating {} module result(s) for goal {}", moduleResults.size(), writingGoal.id());

            var checks = new ArrayList<QualityCheck>();
            for (ModuleResult result : moduleResults) {
                ensureTimeRemaining(deadline, batchId);
                Optional<QualityStandard> standard = standardRegistry.find(result.moduleName());
                if (standard.isEmpty()) {
                    log.debug("No quality standard for {}, skipping", result.moduleName());
                    continue;
                }
                MdcContext.setModule(batchId, result.moduleName().id());
                try {
                    checks.add(moduleValidator.validate(result, standard.get()));
                } finally {
                    MdcContext.clearElement();
                }
            }

            for (CrossModuleValidator validator : crossModuleValidators) {
                ensureTimeRemaining(deadline, batchId);
                checks.add(validator.validate(moduleResults, writingGoal));
            }

            double threshold = writingGoal.qualityThreshold(properties.getDefaultQualityThreshold());
            double overallScore = overallScore(checks);
            int passedChecks = (int) checks.stream().filter(QualityCheck::passed).count();
            int criticalIssues = (int) checks.stream().filter(QualityCheck::isCritical).count();
            boolean passed = overallScore >= threshold;

            var validation = new QualityValidation(
                    overallScore,
                    moduleScores(checks),
                    passed,
                    suggestionGenerator.generate(checks, properties.getMaxImprovements()),
                    checks,
                    new QualityValidation.Metadata(clock.instant(), checks.size(), passedChecks, criticalIssues));

            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            recordValidation(validation, elapsedMs);
            report(batchId, writingGoal, validation, elapsedMs);

            log.info("Validation {}: overall {} against threshold {} ({}/{} checks passed, {} critical)",
                    passed ? "PASSED" : "FAILED", ScoreFormat.fixed(overallScore), ScoreFormat.plain(threshold),
                    passedChecks, checks.size(), criticalIssues);
            return validation;
        } catch (BatchAbandonedException e) {
            log.warn("Validation batch {} abandoned: {}", batchId, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Quality validation failed for batch {}", batchId, e);
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    public QualityAssuranceStats getPerformanceStats() {
        lock.lock();
        try {
            return new QualityAssuranceStats(totalValidations, averageValidationTimeMs,
                    qualityImprovementRate, criticalIssueRate, history.recent(RECENT_WINDOW).size());
        } finally {
            lock.unlock();
        }
    }

    /** Oldest first. */
    public List<QualityValidation> getValidationHistory() {
        lock.lock();
        try {
            return history.snapshot();
        } finally {
            lock.unlock();
        }
    }

    public Map<ModuleName, QualityStandard> getModuleStandards() {
        return standardRegistry.all();
    }

    public List<CrossModuleValidator> getCrossModuleValidators() {
        return crossModuleValidators;
    }

    public QualityMetricCatalog getQualityMetricCatalog() {
        return metricCatalog;
    }

    // ── Aggregation ─────────────────────────────────────────────────

    /** Mean of the positive check scores; zero-score checks carry no signal. */
    static double overallScore(List<QualityCheck> checks) {
        double total = 0.0;
        int counted = 0;
        for (QualityCheck check : checks) {
            if (check.score() > 0) {
                total += check.score();
                counted++;
            }
        }
        return counted > 0 ? total / counted : 0.0;
    }

    /**
     * Folds positive check scores per module in check order: each new score is averaged with
     * the running value, which starts at zero.
     */
    static Map<ModuleName, Double> moduleScores(List<QualityCheck> checks) {
        var scores = new LinkedHashMap<ModuleName, Double>();
        for (QualityCheck check : checks) {
            if (check.score() <= 0) {
                continue;
            }
            double previous = scores.getOrDefault(check.moduleName(), 0.0);
            scores.put(check.moduleName(), (previous + check.score()) / 2);
        }
        return scores;
    }

    // ── Bookkeeping ─────────────────────────────────────────────────

    private void recordValidation(QualityValidation validation, long elapsedMs) {
        lock.lock();
        try {
            history.append(validation);
            totalValidations++;
            averageValidationTimeMs =
                    (averageValidationTimeMs * (totalValidations - 1) + elapsedMs) / totalValidations;

            if (history.size() >= 2) {
                double latest = history.latest().orElseThrow().overallScore();
                double previous = history.previous().orElseThrow().overallScore();
                qualityImprovementRate = qualityImprovementRate * RATE_DECAY + (latest - previous) * RATE_WEIGHT;
            }
            if (!validation.passed()) {
                criticalIssueRate = criticalIssueRate * RATE_DECAY + RATE_WEIGHT;
            }
        } finally {
            lock.unlock();
        }
    }

    private void report(String batchId, WritingGoal goal, QualityValidation validation, long elapsedMs) {
        if (metrics != null) {
            metrics.recordValidation(validation.passed(), elapsedMs);
            metrics.recordOverallScore(validation.overallScore());
            for (QualityCheck check : validation.validationDetails()) {
                metrics.recordCheck(check.checkType(), check.passed());
            }
        }
        if (eventBus != null) {
            var payload = new LinkedHashMap<String, Object>();
            payload.put("overallScore", validation.overallScore());
            payload.put("passed", validation.passed());
            payload.put("totalChecks", validation.metadata().totalChecks());
            payload.put("criticalIssues", validation.metadata().criticalIssues());
            eventBus.publish(new QuillmindEvent(QuillmindEvent.VALIDATION_COMPLETED, batchId,
                    goal.id(), payload, clock.instant()));
        }
    }

    private void ensureTimeRemaining(BatchDeadline deadline, String batchId) {
        if (deadline.isExpired(clock)) {
            throw new BatchAbandonedException("Validation batch " + batchId + " passed its deadline");
        }
    }
}
