package com.quillmind.core.resolution;

import com.quillmind.core.config.QuillmindProperties;
import com.quillmind.core.events.EventBus;
import com.quillmind.core.events.QuillmindEvent;
import com.quillmind.core.history.BoundedHistory;
import com.quillmind.core.logging.MdcContext;
import com.quillmind.core.metrics.QuillmindMetrics;
import com.quillmind.core.model.BatchAbandonedException;
import com.quillmind.core.model.BatchDeadline;
import com.quillmind.core.model.ConflictResolution;
import com.quillmind.core.model.InterModuleConflict;
import com.quillmind.core.model.ModuleName;
import com.quillmind.core.model.ResolutionDecision;
import com.quillmind.core.model.ResolutionStrategy;
import com.quillmind.core.model.ResolutionType;
import com.quillmind.core.model.WritingContext;
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
 * Resolves conflicts between module outputs.
 * <p>
 * For every conflict a strategy is matched by type, merge / prioritize / reconcile candidates
 * are generated and weighted by the user's preferences, and the candidate with the best blend
 * of confidence and narrative coherence wins. Any failure while resolving one conflict yields a
 * low-confidence fallback instead of failing the batch.
 * <p>
 * After the whole batch is resolved it is checked for consistency. An inconsistent batch is
 * logged and returned as-is, unless {@code quillmind.resolution.re-resolve-inconsistent} is set,
 * in which case resolutions that disagree with their module's majority decision type are
 * re-derived with that type.
 */
@Service
public class IntelligentConflictResolver {

    private static final Logger log = LoggerFactory.getLogger(IntelligentConflictResolver.class);

    static final double MERGE_CONFIDENCE = 0.8;
    static final double PRIORITIZE_CONFIDENCE = 0.7;
    static final double RECONCILE_CONFIDENCE = 0.75;
    static final double PREFERENCE_BOOST = 0.2;
    static final double USER_ALIGNED_ABOVE = 0.7;

    static final double FALLBACK_CONFIDENCE = 0.5;
    static final double FALLBACK_NARRATIVE_IMPACT = 0.6;
    static final double FALLBACK_PREFERENCE_WEIGHT = 0.5;

    static final int RECENT_WINDOW = 10;

    private final ResolutionStrategyRegistry strategyRegistry;
    private final UserPreferenceEngine preferenceEngine;
    private final NarrativeCoherenceAnalyzer coherenceAnalyzer;
    private final ResolutionImplementationPlanner planner;
    private final ResolutionConsistencyValidator consistencyValidator;
    private final QuillmindProperties properties;
    private final QuillmindMetrics metrics;
    private final EventBus eventBus;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final BoundedHistory<ConflictResolution> history;
    private long totalConflicts;
    private double averageResolutionTimeMs;
    private double successRate;

    public IntelligentConflictResolver(ResolutionStrategyRegistry strategyRegistry,
                                       UserPreferenceEngine preferenceEngine,
                                       NarrativeCoherenceAnalyzer coherenceAnalyzer,
                                       ResolutionImplementationPlanner planner,
                                       ResolutionConsistencyValidator consistencyValidator,
                                       QuillmindProperties properties,
                                       @Autowired(required = false) QuillmindMetrics metrics,
                                       @Autowired(required = false) EventBus eventBus,
                                       Clock clock) {
        this.strategyRegistry = strategyRegistry;
        this.preferenceEngine = preferenceEngine;
        this.coherenceAnalyzer = coherenceAnalyzer;
        this.planner = planner;
        this.consistencyValidator = consistencyValidator;
        this.properties = properties;
        this.metrics = metrics;
        this.eventBus = eventBus;
        this.clock = clock;
        this.history = new BoundedHistory<>(properties.getResolutionHistoryCapacity());
    }

    public List<ConflictResolution> resolveConflicts(List<InterModuleConflict> conflicts, WritingContext context) {
        return resolveConflicts(conflicts, context, BatchDeadline.none());
    }

    /**
     * Resolves a batch in input order. The deadline is checked before each conflict; once it
     * has passed the batch is abandoned with {@link BatchAbandonedException}, counted as a failure.
     */
    public List<ConflictResolution> resolveConflicts(List<InterModuleConflict> conflicts,
                                                     WritingContext context,
                                                     BatchDeadline deadline) {
        Objects.requireNonNull(conflicts, "conflicts");
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(deadline, "deadline");

        String batchId = "CR-" + UUID.randomUUID().toString().substring(0, 8);
        long start = System.nanoTime();
        MdcContext.setBatch(batchId);
        try {
            log.info("Resolving {} conflict(s) in {} mode", conflicts.size(), context.currentMode());

            var outcomes = new ArrayList<Outcome>();
            for (InterModuleConflict conflict : conflicts) {
                if (deadline.isExpired(clock)) {
                    throw new BatchAbandonedException("Resolution batch " + batchId + " passed its deadline after "
                            + outcomes.size() + " of " + conflicts.size() + " conflict(s)");
                }
                MdcContext.setConflict(batchId, conflict.id());
                try {
                    outcomes.add(resolveIndividualConflict(conflict, context, batchId));
                } finally {
                    MdcContext.clearElement();
                }
            }

            List<ConflictResolution> resolutions = outcomes.stream().map(Outcome::resolution).toList();
            ConsistencyReport report = consistencyValidator.check(resolutions);
            if (!report.passed()) {
                resolutions = handleInconsistency(outcomes, report, context, batchId);
            }

            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            recordHistory(outcomes);
            updatePerformanceMetrics(conflicts.size(), elapsedMs, true);
            reportBatch(batchId, context, resolutions, elapsedMs);

            long fallbacks = resolutions.stream().filter(ConflictResolution::isFallback).count();
            log.info("Resolved {} conflict(s) in {}ms ({} fallback)", resolutions.size(), elapsedMs, fallbacks);
            return resolutions;
        } catch (BatchAbandonedException e) {
            log.warn("Resolution batch {} abandoned: {}", batchId, e.getMessage());
            updatePerformanceMetrics(conflicts.size(), (System.nanoTime() - start) / 1_000_000, false);
            throw e;
        } catch (RuntimeException e) {
            log.error("Conflict resolution failed for batch {}", batchId, e);
            updatePerformanceMetrics(conflicts.size(), (System.nanoTime() - start) / 1_000_000, false);
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    public ConflictResolverStats getPerformanceStats() {
        lock.lock();
        try {
            return new ConflictResolverStats(totalConflicts, averageResolutionTimeMs, successRate,
                    0.0, history.recent(RECENT_WINDOW).size());
        } finally {
            lock.unlock();
        }
    }

    /** Oldest first; fallback resolutions are never recorded. */
    public List<ConflictResolution> getResolutionHistory() {
        lock.lock();
        try {
            return history.snapshot();
        } finally {
            lock.unlock();
        }
    }

    public List<ResolutionStrategy> getAvailableStrategies() {
        return strategyRegistry.all();
    }

    // ── Single conflict ─────────────────────────────────────────────

    private Outcome resolveIndividualConflict(InterModuleConflict conflict, WritingContext context, String batchId) {
        try {
            ConflictAnalysis analysis = ConflictAnalysis.of(conflict);
            ResolutionStrategy strategy = strategyRegistry.require(analysis.type());
            double weight = preferenceEngine.getPreferenceWeight(conflict, context);

            List<ResolutionDecision> candidates = generateCandidates(conflict, weight);
            ResolutionDecision best = selectOptimal(candidates, conflict, context);
            ConflictResolution resolution =
                    buildResolution(conflict, context, best, strategy.name(), candidates.size(), weight, analysis, false);

            if (metrics != null) {
                metrics.recordResolution(strategy.name(), best.type().id());
            }
            log.debug("Conflict {} resolved by {} using {} (confidence {})",
                    conflict.id(), best.type().id(), strategy.name(), best.confidence());
            return new Outcome(conflict, resolution, candidates, analysis);
        } catch (RuntimeException e) {
            log.warn("Error resolving conflict {}, using fallback: {}", conflict.id(), e.getMessage());
            ConflictResolution fallback = fallbackResolution(conflict);
            if (metrics != null) {
                metrics.recordFallback(conflict.type().id());
            }
            if (eventBus != null) {
                eventBus.publish(new QuillmindEvent(QuillmindEvent.RESOLUTION_FALLBACK, batchId, conflict.id(),
                        Map.of("conflictType", conflict.type().id(),
                                "reason", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()),
                        clock.instant()));
            }
            return new Outcome(conflict, fallback, List.of(), null);
        }
    }

    /**
     * Merge is offered only for exactly two modules; prioritize and reconcile always. Every
     * confidence is boosted by the preference weight and capped at 1.
     */
    List<ResolutionDecision> generateCandidates(InterModuleConflict conflict, double preferenceWeight) {
        List<ModuleName> modules = conflict.modules();
        ModuleName primary = primaryOf(conflict);
        List<ModuleName> secondary = modules.size() > 1 ? modules.subList(1, modules.size()) : List.of();

        var candidates = new ArrayList<ResolutionDecision>();
        if (modules.size() == 2) {
            candidates.add(new ResolutionDecision(ResolutionType.MERGE, primary, List.of(modules.get(1)),
                    "Merge outputs from " + primary + " and " + modules.get(1),
                    "Combine complementary aspects from both modules for optimal result",
                    MERGE_CONFIDENCE));
        }
        candidates.add(new ResolutionDecision(ResolutionType.PRIORITIZE, primary, secondary,
                "Prioritize " + primary + " output",
                "Primary module provides more critical information for current context",
                PRIORITIZE_CONFIDENCE));
        candidates.add(new ResolutionDecision(ResolutionType.RECONCILE, primary, secondary,
                "Reconcile differences through contextual analysis",
                "Find common ground and resolve apparent contradictions",
                RECONCILE_CONFIDENCE));

        double boost = 1 + preferenceWeight * PREFERENCE_BOOST;
        return candidates.stream()
                .map(c -> c.withConfidence(Math.min(1.0, c.confidence() * boost)))
                .toList();
    }

    /** Highest {@code confidence·0.4 + coherence·0.3 + mode bonus}; the earlier candidate wins ties. */
    ResolutionDecision selectOptimal(List<ResolutionDecision> candidates,
                                     InterModuleConflict conflict,
                                     WritingContext context) {
        if (candidates.isEmpty()) {
            throw new IllegalStateException("No resolution options available");
        }
        if (candidates.size() == 1) {
            return candidates.get(0);
        }
        double modeBonus = context.isFullyAuto() ? 0.3 : 0.2;
        ResolutionDecision best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (ResolutionDecision candidate : candidates) {
            double score = candidate.confidence() * 0.4
                    + coherenceAnalyzer.analyzeCoherence(conflict, candidate) * 0.3
                    + modeBonus;
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        return best;
    }

    private ConflictResolution buildResolution(InterModuleConflict conflict,
                                               WritingContext context,
                                               ResolutionDecision decision,
                                               String strategyName,
                                               int alternativesConsidered,
                                               double weight,
                                               ConflictAnalysis analysis,
                                               boolean reResolved) {
        return new ConflictResolution(
                conflict.id(),
                decision,
                decision.confidence(),
                decision.reasoning(),
                weight > USER_ALIGNED_ABOVE,
                coherenceAnalyzer.analyzeCoherence(conflict, decision),
                planner.plan(decision, conflict),
                new ConflictResolution.Metadata(
                        clock.instant(),
                        strategyName,
                        alternativesConsidered,
                        weight,
                        analysis.complexity(),
                        coherenceAnalyzer.validateNarrativeFlow(decision, context),
                        coherenceAnalyzer.suggestCoherenceImprovements(decision),
                        reResolved));
    }

    ConflictResolution fallbackResolution(InterModuleConflict conflict) {
        List<ModuleName> modules = conflict.modules();
        ModuleName primary = primaryOf(conflict);
        var decision = new ResolutionDecision(
                ResolutionType.PRIORITIZE,
                primary,
                modules.size() > 1 ? modules.subList(1, modules.size()) : List.of(),
                "Fallback: Prioritize primary module output",
                "Primary resolution failed, using fallback strategy",
                FALLBACK_CONFIDENCE);
        return new ConflictResolution(
                conflict.id(),
                decision,
                FALLBACK_CONFIDENCE,
                "Fallback resolution due to error in primary resolution",
                false,
                FALLBACK_NARRATIVE_IMPACT,
                planner.fallbackPlan(primary),
                new ConflictResolution.Metadata(clock.instant(), ConflictResolution.FALLBACK_STRATEGY, 1,
                        FALLBACK_PREFERENCE_WEIGHT, 0.0, false, List.of(), false));
    }

    private static ModuleName primaryOf(InterModuleConflict conflict) {
        return conflict.modules().isEmpty() ? ModuleName.UNKNOWN : conflict.modules().get(0);
    }

    // ── Batch consistency ───────────────────────────────────────────

    private List<ConflictResolution> handleInconsistency(List<Outcome> outcomes,
                                                         ConsistencyReport report,
                                                         WritingContext context,
                                                         String batchId) {
        log.warn("Resolution batch {} is inconsistent: {}", batchId, report.issues());
        boolean reResolve = properties.isReResolveInconsistent() && !report.inconsistentModules().isEmpty();

        if (metrics != null) {
            metrics.recordConsistencyViolation(reResolve);
        }
        if (eventBus != null) {
            eventBus.publish(new QuillmindEvent(QuillmindEvent.RESOLUTION_INCONSISTENT, batchId, context.userId(),
                    Map.of("issues", report.issues(), "reResolved", reResolve), clock.instant()));
        }

        if (!reResolve) {
            for (Outcome outcome : outcomes) {
                log.warn("Resolution {} may have consistency issues", outcome.resolution().conflictId());
            }
            return outcomes.stream().map(Outcome::resolution).toList();
        }

        Map<ModuleName, ResolutionType> pinned = majorityTypes(outcomes, report);
        var result = new ArrayList<ConflictResolution>(outcomes.size());
        for (Outcome outcome : outcomes) {
            result.add(reResolve(outcome, pinned, context).orElse(outcome.resolution()));
        }
        return result;
    }

    private Optional<ConflictResolution> reResolve(Outcome outcome,
                                                   Map<ModuleName, ResolutionType> pinned,
                                                   WritingContext context) {
        ConflictResolution current = outcome.resolution();
        ResolutionType target = pinned.get(current.resolution().primaryModule());
        if (target == null || current.isFallback() || current.resolution().type() == target) {
            return Optional.empty();
        }
        Optional<ResolutionDecision> candidate = outcome.candidates().stream()
                .filter(c -> c.type() == target)
                .findFirst();
        if (candidate.isEmpty()) {
            log.warn("Resolution {} may have consistency issues: no {} candidate to re-derive with",
                    current.conflictId(), target.id());
            return Optional.empty();
        }
        log.info("Re-resolving conflict {} as {} to match module {}",
                current.conflictId(), target.id(), current.resolution().primaryModule());
        return Optional.of(buildResolution(outcome.conflict(), context, candidate.get(),
                current.metadata().strategyUsed(), current.metadata().alternativesConsidered(),
                current.metadata().userPreferenceWeight(), outcome.analysis(), true));
    }

    /** Most frequent decision type per inconsistent module; ties go to the type seen first. */
    static Map<ModuleName, ResolutionType> majorityTypes(List<Outcome> outcomes, ConsistencyReport report) {
        var counts = new LinkedHashMap<ModuleName, LinkedHashMap<ResolutionType, Integer>>();
        for (Outcome outcome : outcomes) {
            ModuleName module = outcome.resolution().resolution().primaryModule();
            if (report.inconsistentModules().contains(module)) {
                counts.computeIfAbsent(module, m -> new LinkedHashMap<>())
                        .merge(outcome.resolution().resolution().type(), 1, Integer::sum);
            }
        }
        var majority = new LinkedHashMap<ModuleName, ResolutionType>();
        counts.forEach((module, byType) -> {
            ResolutionType best = null;
            int bestCount = 0;
            for (var entry : byType.entrySet()) {
                if (entry.getValue() > bestCount) {
                    best = entry.getKey();
                    bestCount = entry.getValue();
                }
            }
            majority.put(module, best);
        });
        return majority;
    }

    // ── Bookkeeping ─────────────────────────────────────────────────

    /** History only sees completed batches, so an abandoned batch leaves no entries behind. */
    private void recordHistory(List<Outcome> outcomes) {
        lock.lock();
        try {
            for (Outcome outcome : outcomes) {
                if (!outcome.resolution().isFallback()) {
                    history.append(outcome.resolution());
                }
            }
        } finally {
            lock.unlock();
        }
    }

    private void updatePerformanceMetrics(int conflictCount, long elapsedMs, boolean success) {
        lock.lock();
        try {
            totalConflicts += conflictCount;
            if (totalConflicts == 0) {
                return;
            }
            long previousTotal = totalConflicts - conflictCount;
            averageResolutionTimeMs = (averageResolutionTimeMs * previousTotal + elapsedMs) / totalConflicts;
            successRate = (successRate * previousTotal + (success ? conflictCount : 0)) / totalConflicts;
        } finally {
            lock.unlock();
        }
    }

    private void reportBatch(String batchId, WritingContext context, List<ConflictResolution> resolutions,
                             long elapsedMs) {
        if (metrics != null) {
            metrics.recordResolutionBatch(resolutions.size(), elapsedMs);
        }
        if (eventBus != null) {
            var payload = new LinkedHashMap<String, Object>();
            payload.put("resolved", resolutions.size());
            payload.put("fallbacks", resolutions.stream().filter(ConflictResolution::isFallback).count());
            payload.put("durationMs", elapsedMs);
            eventBus.publish(new QuillmindEvent(QuillmindEvent.RESOLUTION_COMPLETED, batchId, context.userId(),
                    payload, clock.instant()));
        }
    }

    /** A resolution together with what it was derived from. */
    record Outcome(
        InterModuleConflict conflict,
        ConflictResolution resolution,
        List<ResolutionDecision> candidates,
        ConflictAnalysis analysis
    ) {}
}
