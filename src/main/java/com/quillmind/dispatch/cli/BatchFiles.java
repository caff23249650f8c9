package com.quillmind.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quillmind.core.model.ConflictSeverity;
import com.quillmind.core.model.ConflictType;
import com.quillmind.core.model.InterModuleConflict;
import com.quillmind.core.model.ModuleName;
import com.quillmind.core.model.ModuleResult;
import com.quillmind.core.model.SystemMode;
import com.quillmind.core.model.WritingContext;
import com.quillmind.core.model.WritingGoal;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * JSON input files accepted by the {@code validate} and {@code resolve} commands.
 * <p>
 * Both shapes are flatter than the model records they map to.
 */
final class BatchFiles {

    private BatchFiles() {}

    record ValidationBatch(String goalId, Double qualityThreshold, List<ModuleEntry> results) {

        WritingGoal goal() {
            return new WritingGoal(goalId != null ? goalId : "cli", "story", null,
                    new WritingGoal.Constraints(qualityThreshold, null));
        }

        List<ModuleResult> moduleResults() {
            return results == null ? List.of() : results.stream()
                    .map(e -> new ModuleResult(ModuleName.fromId(e.moduleName()), e.qualityMetrics()))
                    .toList();
        }
    }

    record ModuleEntry(String moduleName, Map<String, Double> qualityMetrics) {}

    record ConflictBatch(String userId, String mode, List<ConflictEntry> conflicts) {

        WritingContext context() {
            return WritingContext.forMode(userId != null ? userId : "cli", SystemMode.fromId(mode));
        }

        List<InterModuleConflict> interModuleConflicts() {
            return conflicts == null ? List.of() : conflicts.stream().map(ConflictEntry::toConflict).toList();
        }
    }

    record ConflictEntry(
        String id,
        String type,
        String severity,
        String description,
        List<String> modules,
        Map<String, Object> conflictingData,
        double narrativeCoherence,
        double userExperience,
        double qualityScore
    ) {

        InterModuleConflict toConflict() {
            List<ModuleName> moduleNames = modules == null ? List.of()
                    : modules.stream().map(ModuleName::fromId).toList();
            return new InterModuleConflict(id, ConflictType.fromId(type), ConflictSeverity.fromId(severity),
                    description, moduleNames, conflictingData, null,
                    new InterModuleConflict.Impact(narrativeCoherence, userExperience, qualityScore), null);
        }
    }

    static ValidationBatch readValidationBatch(ObjectMapper mapper, Path file) {
        return read(mapper, file, ValidationBatch.class);
    }

    static ConflictBatch readConflictBatch(ObjectMapper mapper, Path file) {
        return read(mapper, file, ConflictBatch.class);
    }

    private static <T> T read(ObjectMapper mapper, Path file, Class<T> type) {
        try {
            return mapper.readValue(file.toFile(), type);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file + ": " + e.getMessage(), e);
        }
    }
}
