package com.quillmind.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QuillmindMetricsTest {

    private SimpleMeterRegistry registry;
    private QuillmindMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new QuillmindMetrics(registry);
    }

    @Test
    @DisplayName("recordValidation times the batch and counts by result")
    void recordValidation() {
        metrics.recordValidation(true, 20);
        metrics.recordValidation(false, 30);

        var timer = registry.find("quillmind.validation.duration").timer();
        assertNotNull(timer);
        assertEquals(2, timer.count());
        assertEquals(1.0, registry.find("quillmind.validation.results").tag("result", "passed").counter().count());
        assertEquals(1.0, registry.find("quillmind.validation.results").tag("result", "failed").counter().count());
    }

    @Test
    @DisplayName("recordOverallScore feeds a distribution summary")
    void recordOverallScore() {
        metrics.recordOverallScore(0.8);
        metrics.recordOverallScore(0.6);

        var summary = registry.find("quillmind.validation.overall_score").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(1.4, summary.totalAmount(), 1e-9);
    }

    @Test
    @DisplayName("recordCheck tags by check type")
    void recordCheck() {
        metrics.recordCheck("module_validation", true);
        metrics.recordCheck("overall_quality", false);

        assertNotNull(registry.find("quillmind.validation.checks")
                .tag("type", "module_validation").tag("result", "passed").counter());
        assertNotNull(registry.find("quillmind.validation.checks")
                .tag("type", "overall_quality").tag("result", "failed").counter());
    }

    @Test
    @DisplayName("resolution meters are tagged by strategy and decision")
    void recordResolution() {
        metrics.recordResolutionBatch(3, 120);
        metrics.recordResolution("Plot-Theme Alignment", "merge");
        metrics.recordFallback("unrecognized");
        metrics.recordConsistencyViolation(false);

        assertEquals(1, registry.find("quillmind.resolution.batch.duration").timer().count());
        assertEquals(3.0, registry.find("quillmind.resolution.batch.size").summary().totalAmount());
        assertEquals(1.0, registry.find("quillmind.resolution.total")
                .tag("strategy", "Plot-Theme Alignment").tag("decision", "merge").counter().count());
        assertEquals(1.0, registry.find("quillmind.resolution.fallbacks")
                .tag("conflictType", "unrecognized").counter().count());
        assertEquals(1.0, registry.find("quillmind.resolution.consistency_violations")
                .tag("reResolved", "false").counter().count());
    }
}
