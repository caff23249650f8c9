package com.quillmind.core.resolution;

import com.quillmind.core.config.QuillmindProperties;
import com.quillmind.core.model.ConflictResolution;
import com.quillmind.core.model.ModuleName;
import com.quillmind.core.model.ResolutionDecision;
import com.quillmind.core.model.ResolutionImplementation;
import com.quillmind.core.model.ResolutionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ResolutionConsistencyValidatorTest {

    private QuillmindProperties properties;
    private ResolutionConsistencyValidator validator;

    @BeforeEach
    void setUp() {
        properties = new QuillmindProperties();
        validator = new ResolutionConsistencyValidator(properties);
    }

    private static ConflictResolution resolution(String id, ModuleName primary, ResolutionType type, double impact) {
        var decision = new ResolutionDecision(type, primary, List.of(), "sample", "sample", 0.8);
        return new ConflictResolution(id, decision, 0.8, "sample", false, impact,
                new ResolutionImplementation(List.of(), 0, "none", List.of()),
                new ConflictResolution.Metadata(Instant.EPOCH, "Sample", 1, 0.7, 0.0, true, List.of(), false));
    }

    @Test
    @DisplayName("an empty batch is consistent")
    void emptyBatch() {
        ConsistencyReport report = validator.check(List.of());

        assertTrue(report.passed());
        assertEquals(1.0, report.overallCoherence());
    }

    @Test
    @DisplayName("one decision type per module passes")
    void consistentBatch() {
        ConsistencyReport report = validator.check(List.of(
                resolution("a", ModuleName.EMOTION_ARC, ResolutionType.MERGE, 0.9),
                resolution("b", ModuleName.EMOTION_ARC, ResolutionType.MERGE, 0.95),
                resolution("c", ModuleName.STYLE_PROFILE, ResolutionType.PRIORITIZE, 0.85)));

        assertTrue(report.passed());
        assertTrue(report.issues().isEmpty());
        assertEquals(0.9, report.overallCoherence(), 1e-9);
    }

    @Test
    @DisplayName("mixed decision types for one module are flagged")
    void mixedTypes() {
        ConsistencyReport report = validator.check(List.of(
                resolution("a", ModuleName.EMOTION_ARC, ResolutionType.MERGE, 0.9),
                resolution("b", ModuleName.EMOTION_ARC, ResolutionType.RECONCILE, 0.9),
                resolution("c", ModuleName.STYLE_PROFILE, ResolutionType.PRIORITIZE, 0.9)));

        assertFalse(report.passed());
        assertEquals(Set.of(ModuleName.EMOTION_ARC), report.inconsistentModules());
        assertEquals(List.of("Conflicting resolution types for module emotionArc"), report.issues());
    }

    @Test
    @DisplayName("low mean narrative impact is flagged without naming modules")
    void lowCoherence() {
        ConsistencyReport report = validator.check(List.of(
                resolution("a", ModuleName.EMOTION_ARC, ResolutionType.PRIORITIZE, 0.6),
                resolution("b", ModuleName.PLOT_STRUCTURE, ResolutionType.PRIORITIZE, 0.6)));

        assertFalse(report.passed());
        assertTrue(report.inconsistentModules().isEmpty());
        assertEquals(List.of("Overall narrative coherence below threshold: 0.60"), report.issues());
    }

    @Test
    @DisplayName("coherence minimum follows configuration")
    void configurableMinimum() {
        properties.getResolution().setMinimumBatchCoherence(0.5);

        assertTrue(validator.check(List.of(
                resolution("a", ModuleName.EMOTION_ARC, ResolutionType.PRIORITIZE, 0.6))).passed());
    }
}
