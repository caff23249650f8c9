package com.quillmind.core.resolution;

import com.quillmind.core.model.InterModuleConflict;
import com.quillmind.core.model.ModuleName;
import com.quillmind.core.model.ResolutionDecision;
import com.quillmind.core.model.ResolutionImplementation;
import com.quillmind.core.model.ResolutionStep;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the step plan for applying a resolution decision.
 */
@Component
public class ResolutionImplementationPlanner {

    static final long MS_PER_STEP = 1000;
    static final long FALLBACK_ESTIMATE_MS = 500;

    static final String ROLLBACK_PLAN = "Restore original module outputs and retry with alternative strategy";
    static final List<String> VALIDATION_CHECKS = List.of(
            "Output coherence validation",
            "Quality threshold verification",
            "User preference alignment check");

    public ResolutionImplementation plan(ResolutionDecision decision, InterModuleConflict conflict) {
        var steps = new ArrayList<ResolutionStep>();
        ModuleName primary = decision.primaryModule();

        switch (decision.type()) {
            case MERGE -> {
                steps.add(new ResolutionStep(1, "Extract complementary elements", primary,
                        Map.of("conflictType", conflict.type().id()),
                        "Identified complementary aspects for merging"));
                steps.add(new ResolutionStep(2, "Synthesize combined output", primary,
                        Map.of("mergeStrategy", "complementary"),
                        "Merged output with enhanced coherence"));
            }
            case PRIORITIZE -> {
                // a single-module conflict has no secondary; its adjustment lands on the primary
                ModuleName secondary = decision.secondaryModules().isEmpty()
                        ? primary
                        : decision.secondaryModules().get(0);
                steps.add(new ResolutionStep(1, "Validate primary module output", primary,
                        Map.of("validationLevel", "comprehensive"),
                        "Primary output validated and optimized"));
                steps.add(new ResolutionStep(2, "Adjust secondary outputs", secondary,
                        Map.of("alignmentStrategy", "primary_follow"),
                        "Secondary outputs aligned with primary"));
            }
            case RECONCILE -> {
                steps.add(new ResolutionStep(1, "Analyze contextual factors", primary,
                        Map.of("analysisDepth", "contextual"),
                        "Contextual factors identified and analyzed"));
                steps.add(new ResolutionStep(2, "Apply reconciliation logic", primary,
                        Map.of("reconciliationType", "contextual"),
                        "Conflicts reconciled through context analysis"));
            }
            default -> {
                // recalculate and escalate have no automated plan
            }
        }

        return new ResolutionImplementation(steps, steps.size() * MS_PER_STEP, ROLLBACK_PLAN, VALIDATION_CHECKS);
    }

    /** Single-step plan used when the regular resolution path failed. */
    public ResolutionImplementation fallbackPlan(ModuleName primary) {
        return new ResolutionImplementation(
                List.of(new ResolutionStep(1, "Use primary module output", primary,
                        Map.of("fallback", true), "Basic conflict resolution achieved")),
                FALLBACK_ESTIMATE_MS,
                "Manual intervention required",
                List.of("Basic output validation"));
    }
}
