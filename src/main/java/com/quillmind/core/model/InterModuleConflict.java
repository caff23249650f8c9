package com.quillmind.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A detected disagreement between two or more module outputs.
 * <p>
 * Detection happens upstream; the resolver only consumes these. The first entry of
 * {@code modules} is the module that wins a prioritize decision.
 */
public record InterModuleConflict(
    String id,
    ConflictType type,
    ConflictSeverity severity,
    String description,
    List<ModuleName> modules,
    Map<String, Object> conflictingData,
    Instant detectedAt,
    Impact impact,
    Context context
) implements Serializable {

    public InterModuleConflict {
        type = type != null ? type : ConflictType.UNRECOGNIZED;
        severity = severity != null ? severity : ConflictSeverity.MEDIUM;
        modules = modules != null ? List.copyOf(modules) : List.of();
        conflictingData = conflictingData != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(conflictingData))
                : Map.of();
        detectedAt = detectedAt != null ? detectedAt : Instant.now();
        impact = impact != null ? impact : new Impact(0.0, 0.0, 0.0);
    }

    public record Impact(
        double narrativeCoherence,
        double userExperience,
        double qualityScore
    ) implements Serializable {}

    public record Context(
        String writingPhase,
        String genre,
        String targetAudience,
        SystemMode userMode
    ) implements Serializable {}
}
