package com.quillmind.core.resolution;

import com.quillmind.core.config.QuillmindProperties;
import com.quillmind.core.events.EventBus;
import com.quillmind.core.events.QuillmindEvent;
import com.quillmind.core.metrics.QuillmindMetrics;
import com.quillmind.core.model.BatchAbandonedException;
import com.quillmind.core.model.BatchDeadline;
import com.quillmind.core.model.ConflictResolution;
import com.quillmind.core.model.ConflictSeverity;
import com.quillmind.core.model.ConflictType;
import com.quillmind.core.model.InterModuleConflict;
import com.quillmind.core.model.ModuleName;
import com.quillmind.core.model.ResolutionDecision;
import com.quillmind.core.model.ResolutionType;
import com.quillmind.core.model.SystemMode;
import com.quillmind.core.model.WritingContext;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link IntelligentConflictResolver} wired with the default engines.
 */
class IntelligentConflictResolverTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private final WritingContext hybrid = WritingContext.forMode("writer-1", SystemMode.HYBRID);
    private final WritingContext fullyAuto = WritingContext.forMode("writer-1", SystemMode.FULLY_AUTO);

    private QuillmindProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private EventBus eventBus;
    private IntelligentConflictResolver resolver;

    @BeforeEach
    void setUp() {
        properties = new QuillmindProperties();
        meterRegistry = new SimpleMeterRegistry();
        eventBus = new EventBus();
        resolver = resolver(new DefaultUserPreferenceEngine(), new DefaultNarrativeCoherenceAnalyzer());
    }

    private IntelligentConflictResolver resolver(UserPreferenceEngine preferences, NarrativeCoherenceAnalyzer analyzer) {
        return resolver(preferences, analyzer, clock);
    }

    private IntelligentConflictResolver resolver(UserPreferenceEngine preferences, NarrativeCoherenceAnalyzer analyzer,
                                                 Clock clock) {
        return new IntelligentConflictResolver(
                new ResolutionStrategyRegistry(),
                preferences,
                analyzer,
                new ResolutionImplementationPlanner(),
                new ResolutionConsistencyValidator(properties),
                properties,
                new QuillmindMetrics(meterRegistry),
                eventBus,
                clock);
    }

    private static InterModuleConflict conflict(String id, ConflictType type, ConflictSeverity severity,
                                                ModuleName... modules) {
        return new InterModuleConflict(id, type, severity, "conflict " + id, List.of(modules),
                null, null, null, null);
    }

    private static InterModuleConflict styleVoice(String id) {
        return conflict(id, ConflictType.STYLE_VOICE_CONFLICT, ConflictSeverity.HIGH,
                ModuleName.STYLE_PROFILE, ModuleName.EMOTION_ARC);
    }

    // ── Candidates ──────────────────────────────────────────────────

    @Nested
    @DisplayName("candidate generation")
    class Candidates {

        @Test
        @DisplayName("merge is offered only for two-module conflicts")
        void mergeOnlyForPairs() {
            var pair = resolver.generateCandidates(styleVoice("c-1"), 0.7);
            var triple = resolver.generateCandidates(conflict("c-2", ConflictType.CHARACTER_ARC_DISCONTINUITY,
                    ConflictSeverity.MEDIUM, ModuleName.EMOTION_ARC, ModuleName.PLOT_STRUCTURE,
                    ModuleName.THEME_ANALYSIS), 0.7);

            assertEquals(List.of(ResolutionType.MERGE, ResolutionType.PRIORITIZE, ResolutionType.RECONCILE),
                    pair.stream().map(ResolutionDecision::type).toList());
            assertEquals(List.of(ResolutionType.PRIORITIZE, ResolutionType.RECONCILE),
                    triple.stream().map(ResolutionDecision::type).toList());
            assertEquals(List.of(ModuleName.PLOT_STRUCTURE, ModuleName.THEME_ANALYSIS),
                    triple.get(0).secondaryModules());
        }

        @Test
        @DisplayName("confidences are boosted by the preference weight and capped")
        void boosted() {
            var candidates = resolver.generateCandidates(styleVoice("c-1"), 1.0);

            assertEquals(0.96, candidates.get(0).confidence(), 1e-9);
            assertEquals(0.84, candidates.get(1).confidence(), 1e-9);
            assertEquals(0.9, candidates.get(2).confidence(), 1e-9);
        }

        @Test
        @DisplayName("a conflict without modules is led by the unknown module")
        void noModules() {
            var candidates = resolver.generateCandidates(
                    conflict("c-1", ConflictType.STYLE_VOICE_CONFLICT, ConflictSeverity.LOW), 0.7);

            assertEquals(2, candidates.size());
            assertEquals(ModuleName.UNKNOWN, candidates.get(0).primaryModule());
            assertTrue(candidates.get(0).secondaryModules().isEmpty());
        }
    }

    // ── Selection ───────────────────────────────────────────────────

    @Nested
    @DisplayName("selection")
    class Selection {

        private ResolutionDecision candidate(ResolutionType type, double confidence) {
            return new ResolutionDecision(type, ModuleName.STYLE_PROFILE, List.of(), "sample", "sample", confidence);
        }

        @Test
        @DisplayName("no candidates is an error")
        void noCandidates() {
            assertThrows(IllegalStateException.class,
                    () -> resolver.selectOptimal(List.of(), styleVoice("c-1"), hybrid));
        }

        @Test
        @DisplayName("a single candidate is returned as-is")
        void singleCandidate() {
            var only = candidate(ResolutionType.ESCALATE, 0.1);

            assertSame(only, resolver.selectOptimal(List.of(only), styleVoice("c-1"), hybrid));
        }

        @Test
        @DisplayName("ties go to the earlier candidate")
        void tieKeepsFirst() {
            NarrativeCoherenceAnalyzer flat = mock(NarrativeCoherenceAnalyzer.class);
            when(flat.analyzeCoherence(any(), any())).thenReturn(0.9);
            var tied = resolver(new DefaultUserPreferenceEngine(), flat);

            var first = candidate(ResolutionType.RECONCILE, 0.8);
            var second = candidate(ResolutionType.PRIORITIZE, 0.8);

            assertSame(first, tied.selectOptimal(List.of(first, second), styleVoice("c-1"), hybrid));
        }
    }

    // ── Resolving batches ───────────────────────────────────────────

    @Nested
    @DisplayName("resolving batches")
    class Batches {

        @Test
        @DisplayName("a fully autonomous style conflict is merged")
        void styleVoiceMerged() {
            ConflictResolution resolution = resolver.resolveConflicts(List.of(styleVoice("c-1")), fullyAuto).get(0);

            assertEquals("c-1", resolution.conflictId());
            assertEquals(ResolutionType.MERGE, resolution.resolution().type());
            assertEquals(0.9344, resolution.confidence(), 1e-9);
            assertEquals(0.98, resolution.narrativeImpact(), 1e-9);
            assertTrue(resolution.userAligned());
            assertEquals("Style-Voice Harmonization", resolution.metadata().strategyUsed());
            assertEquals(3, resolution.metadata().alternativesConsidered());
            assertEquals(0.84, resolution.metadata().userPreferenceWeight(), 1e-9);
            assertTrue(resolution.metadata().narrativeFlowValid());
            assertTrue(resolution.metadata().coherenceSuggestions().isEmpty());
            assertFalse(resolution.metadata().reResolved());
            assertEquals(2, resolution.implementation().steps().size());
        }

        @Test
        @DisplayName("an emotional narrative mismatch reaches full narrative impact")
        void emotionalNarrativeMerged() {
            var emotional = conflict("c-1", ConflictType.EMOTIONAL_NARRATIVE_MISMATCH, ConflictSeverity.HIGH,
                    ModuleName.EMOTION_ARC, ModuleName.NARRATIVE_DASHBOARD);

            ConflictResolution resolution = resolver.resolveConflicts(List.of(emotional), hybrid).get(0);

            assertEquals(ResolutionType.MERGE, resolution.resolution().type());
            assertEquals(1.0, resolution.narrativeImpact());
            assertEquals(0.912, resolution.confidence(), 1e-9);
            // a weight of exactly 0.7 is not above the alignment bar
            assertFalse(resolution.userAligned());
        }

        @Test
        @DisplayName("three-module conflicts are reconciled")
        void tripleReconciled() {
            var plotTheme = conflict("c-1", ConflictType.PLOT_THEME_INCONSISTENCY, ConflictSeverity.MEDIUM,
                    ModuleName.PLOT_STRUCTURE, ModuleName.THEME_ANALYSIS, ModuleName.EMOTION_ARC);

            ConflictResolution resolution = resolver.resolveConflicts(List.of(plotTheme), hybrid).get(0);

            assertEquals(ResolutionType.RECONCILE, resolution.resolution().type());
            assertEquals(0.855, resolution.confidence(), 1e-9);
            assertEquals(2, resolution.metadata().alternativesConsidered());
        }

        @Test
        @DisplayName("resolutions come back in input order")
        void inputOrder() {
            var resolutions = resolver.resolveConflicts(
                    List.of(styleVoice("c-3"), styleVoice("c-1"), styleVoice("c-2")), fullyAuto);

            assertEquals(List.of("c-3", "c-1", "c-2"),
                    resolutions.stream().map(ConflictResolution::conflictId).toList());
        }

        @Test
        @DisplayName("an empty batch resolves to nothing")
        void emptyBatch() {
            assertTrue(resolver.resolveConflicts(List.of(), hybrid).isEmpty());
            assertEquals(0, resolver.getPerformanceStats().totalConflicts());
            assertEquals(0.0, resolver.getPerformanceStats().successRate());
        }
    }

    // ── Fallbacks ───────────────────────────────────────────────────

    @Nested
    @DisplayName("fallbacks")
    class Fallbacks {

        @Test
        @DisplayName("unknown conflict types fall back to prioritising the first module")
        void unknownTypeFallsBack() {
            List<QuillmindEvent> events = new ArrayList<>();
            eventBus.subscribe(QuillmindEvent.RESOLUTION_FALLBACK, events::add);
            var unknown = conflict("c-9", ConflictType.UNRECOGNIZED, ConflictSeverity.MEDIUM,
                    ModuleName.PLOT_STRUCTURE);

            ConflictResolution resolution = resolver.resolveConflicts(List.of(unknown), hybrid).get(0);

            assertTrue(resolution.isFallback());
            assertEquals(0.5, resolution.confidence());
            assertEquals(0.6, resolution.narrativeImpact());
            assertFalse(resolution.userAligned());
            assertEquals(ResolutionType.PRIORITIZE, resolution.resolution().type());
            assertEquals(ModuleName.PLOT_STRUCTURE, resolution.resolution().primaryModule());
            assertEquals("Fallback: Prioritize primary module output", resolution.resolution().decision());
            assertEquals(1, resolution.implementation().steps().size());

            assertTrue(resolver.getResolutionHistory().isEmpty());
            assertEquals(1, events.size());
            assertEquals("c-9", events.get(0).subjectId());
            assertEquals(1.0, meterRegistry.find("quillmind.resolution.fallbacks")
                    .tag("conflictType", "unrecognized").counter().count());
        }

        @Test
        @DisplayName("a failing collaborator affects only its own conflict")
        void collaboratorFailureContained() {
            UserPreferenceEngine flaky = mock(UserPreferenceEngine.class);
            when(flaky.getPreferenceWeight(any(), any()))
                    .thenThrow(new IllegalStateException("preferences unavailable"))
                    .thenReturn(0.7);
            var withFlaky = resolver(flaky, new DefaultNarrativeCoherenceAnalyzer());

            var resolutions = withFlaky.resolveConflicts(List.of(styleVoice("c-1"), styleVoice("c-2")), hybrid);

            assertTrue(resolutions.get(0).isFallback());
            assertFalse(resolutions.get(1).isFallback());
            assertEquals(1, withFlaky.getResolutionHistory().size());
            assertEquals("c-2", withFlaky.getResolutionHistory().get(0).conflictId());
        }
    }

    // ── Batch consistency ───────────────────────────────────────────

    @Nested
    @DisplayName("batch consistency")
    class Consistency {

        // emotionArc leads all three: the pair merges, the two triples reconcile
        private List<InterModuleConflict> mixedBatch() {
            return List.of(
                    conflict("a", ConflictType.EMOTIONAL_NARRATIVE_MISMATCH, ConflictSeverity.HIGH,
                            ModuleName.EMOTION_ARC, ModuleName.NARRATIVE_DASHBOARD),
                    conflict("b", ConflictType.CHARACTER_ARC_DISCONTINUITY, ConflictSeverity.MEDIUM,
                            ModuleName.EMOTION_ARC, ModuleName.PLOT_STRUCTURE, ModuleName.THEME_ANALYSIS),
                    conflict("c", ConflictType.CHARACTER_ARC_DISCONTINUITY, ConflictSeverity.MEDIUM,
                            ModuleName.EMOTION_ARC, ModuleName.STYLE_PROFILE, ModuleName.THEME_ANALYSIS));
        }

        @Test
        @DisplayName("inconsistent batches are returned unchanged by default")
        void softFailure() {
            List<QuillmindEvent> events = new ArrayList<>();
            eventBus.subscribe(QuillmindEvent.RESOLUTION_INCONSISTENT, events::add);

            var resolutions = resolver.resolveConflicts(mixedBatch(), hybrid);

            assertEquals(List.of(ResolutionType.MERGE, ResolutionType.RECONCILE, ResolutionType.RECONCILE),
                    resolutions.stream().map(r -> r.resolution().type()).toList());
            assertTrue(resolutions.stream().noneMatch(r -> r.metadata().reResolved()));
            assertEquals(1, events.size());
            assertEquals(false, events.get(0).payload().get("reResolved"));
            assertEquals(1.0, meterRegistry.find("quillmind.resolution.consistency_violations")
                    .tag("reResolved", "false").counter().count());
        }

        @Test
        @DisplayName("re-resolution aligns outliers with their module's majority type")
        void reResolution() {
            properties.getResolution().setReResolveInconsistent(true);

            var resolutions = resolver.resolveConflicts(mixedBatch(), hybrid);

            ConflictResolution realigned = resolutions.get(0);
            assertEquals(ResolutionType.RECONCILE, realigned.resolution().type());
            assertTrue(realigned.metadata().reResolved());
            assertEquals(0.855, realigned.confidence(), 1e-9);
            assertEquals(0.98, realigned.narrativeImpact(), 1e-9);
            assertEquals("Emotional-Narrative Reconciliation", realigned.metadata().strategyUsed());
            assertFalse(resolutions.get(1).metadata().reResolved());

            // history keeps what was first decided
            assertEquals(3, resolver.getResolutionHistory().size());
            assertEquals(ResolutionType.MERGE, resolver.getResolutionHistory().get(0).resolution().type());
        }

        @Test
        @DisplayName("a low-coherence batch is not re-resolved")
        void coherenceOnlyFailure() {
            properties.getResolution().setReResolveInconsistent(true);
            List<QuillmindEvent> events = new ArrayList<>();
            eventBus.subscribe(QuillmindEvent.RESOLUTION_INCONSISTENT, events::add);

            var resolutions = resolver.resolveConflicts(List.of(
                    conflict("x", ConflictType.UNRECOGNIZED, ConflictSeverity.LOW, ModuleName.THEME_ANALYSIS)), hybrid);

            assertTrue(resolutions.get(0).isFallback());
            assertEquals(1, events.size());
            assertEquals(false, events.get(0).payload().get("reResolved"));
        }
    }

    // ── Bookkeeping ─────────────────────────────────────────────────

    @Nested
    @DisplayName("history and stats")
    class HistoryAndStats {

        @Test
        @DisplayName("history is capped")
        void historyCapped() {
            properties.getResolution().setHistoryCapacity(3);
            var capped = resolver(new DefaultUserPreferenceEngine(), new DefaultNarrativeCoherenceAnalyzer());

            capped.resolveConflicts(List.of(styleVoice("1"), styleVoice("2"), styleVoice("3"),
                    styleVoice("4"), styleVoice("5")), fullyAuto);

            assertEquals(List.of("3", "4", "5"),
                    capped.getResolutionHistory().stream().map(ConflictResolution::conflictId).toList());
            assertEquals(3, capped.getPerformanceStats().recentResolutions());
        }

        @Test
        @DisplayName("success rate is weighted by conflict count")
        void successRate() {
            resolver.resolveConflicts(List.of(styleVoice("a"), styleVoice("b")), fullyAuto);
            assertEquals(2, resolver.getPerformanceStats().totalConflicts());
            assertEquals(1.0, resolver.getPerformanceStats().successRate());

            var expired = BatchDeadline.after(Duration.ZERO, clock);
            assertThrows(BatchAbandonedException.class,
                    () -> resolver.resolveConflicts(List.of(styleVoice("c"), styleVoice("d")), fullyAuto, expired));

            assertEquals(4, resolver.getPerformanceStats().totalConflicts());
            assertEquals(0.5, resolver.getPerformanceStats().successRate(), 1e-9);
            assertEquals(0.0, resolver.getPerformanceStats().userSatisfaction());
        }

        @Test
        @DisplayName("an abandoned batch records no resolutions")
        void abandonedBatch() {
            var expired = BatchDeadline.after(Duration.ZERO, clock);

            assertThrows(BatchAbandonedException.class,
                    () -> resolver.resolveConflicts(List.of(styleVoice("a")), hybrid, expired));
            assertTrue(resolver.getResolutionHistory().isEmpty());
        }

        @Test
        @DisplayName("a batch that passes its deadline midway leaves history untouched")
        void deadlinePassedMidBatch() {
            var now = new AtomicReference<>(Instant.parse("2026-03-01T10:00:00Z"));
            Clock moving = mock(Clock.class);
            when(moving.instant()).thenAnswer(inv -> now.get());
            when(moving.getZone()).thenReturn(ZoneOffset.UTC);

            UserPreferenceEngine slow = mock(UserPreferenceEngine.class);
            when(slow.getPreferenceWeight(any(), any())).thenAnswer(inv -> {
                now.set(now.get().plusSeconds(2));
                return 0.7;
            });
            var withDeadline = resolver(slow, new DefaultNarrativeCoherenceAnalyzer(), moving);
            var deadline = BatchDeadline.after(Duration.ofSeconds(1), moving);

            assertThrows(BatchAbandonedException.class,
                    () -> withDeadline.resolveConflicts(List.of(styleVoice("a"), styleVoice("b")), hybrid, deadline));

            assertTrue(withDeadline.getResolutionHistory().isEmpty());
            assertEquals(0, withDeadline.getPerformanceStats().recentResolutions());
            assertEquals(0.0, withDeadline.getPerformanceStats().successRate());
        }

        @Test
        @DisplayName("records resolutions per strategy and decision")
        void recordsMeters() {
            resolver.resolveConflicts(List.of(styleVoice("a")), fullyAuto);

            assertEquals(1.0, meterRegistry.find("quillmind.resolution.total")
                    .tag("strategy", "Style-Voice Harmonization").tag("decision", "merge").counter().count());
            assertEquals(1, meterRegistry.find("quillmind.resolution.batch.duration").timer().count());
        }
    }

    @Test
    @DisplayName("exposes all registered strategies")
    void availableStrategies() {
        assertEquals(8, resolver.getAvailableStrategies().size());
    }
}
