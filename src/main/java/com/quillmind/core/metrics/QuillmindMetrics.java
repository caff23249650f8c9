package com.quillmind.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for quality validation and conflict resolution.
 */
@Service
public class QuillmindMetrics {

    private final MeterRegistry registry;

    public QuillmindMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordValidation(boolean passed, long ms) {
        Timer.builder("quillmind.validation.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
        Counter.builder("quillmind.validation.results")
                .tag("result", passed ? "passed" : "failed")
                .register(registry)
                .increment();
    }

    public void recordOverallScore(double score) {
        DistributionSummary.builder("quillmind.validation.overall_score")
                .register(registry)
                .record(score);
    }

    /**
     * Records one quality check outcome.
     *
     * @param checkType e.g. {@code module_validation}, {@code cross_module_style}
     * @param passed    whether the check passed
     */
    public void recordCheck(String checkType, boolean passed) {
        Counter.builder("quillmind.validation.checks")
                .description("Quality checks by type and outcome")
                .tag("type", checkType)
                .tag("result", passed ? "passed" : "failed")
                .register(registry)
                .increment();
    }

    public void recordResolutionBatch(int conflictCount, long ms) {
        Timer.builder("quillmind.resolution.batch.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
        DistributionSummary.builder("quillmind.resolution.batch.size")
                .register(registry)
                .record(conflictCount);
    }

    /**
     * Records a resolved conflict under the strategy that produced it.
     *
     * @param strategy     strategy name, {@code Fallback} for fallbacks
     * @param decisionType e.g. {@code merge}
     */
    public void recordResolution(String strategy, String decisionType) {
        Counter.builder("quillmind.resolution.total")
                .tag("strategy", strategy)
                .tag("decision", decisionType)
                .register(registry)
                .increment();
    }

    public void recordFallback(String conflictType) {
        Counter.builder("quillmind.resolution.fallbacks")
                .description("Conflicts resolved through the fallback path")
                .tag("conflictType", conflictType)
                .register(registry)
                .increment();
    }

    public void recordConsistencyViolation(boolean reResolved) {
        Counter.builder("quillmind.resolution.consistency_violations")
                .description("Resolution batches that failed the consistency check")
                .tag("reResolved", String.valueOf(reResolved))
                .register(registry)
                .increment();
    }
}
