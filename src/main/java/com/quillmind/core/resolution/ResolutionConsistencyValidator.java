package com.quillmind.core.resolution;

import com.quillmind.core.config.QuillmindProperties;
import com.quillmind.core.model.ConflictResolution;
import com.quillmind.core.model.ModuleName;
import com.quillmind.core.model.ResolutionType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Checks a finished batch of resolutions for contradictions.
 * <p>
 * Two rules: all resolutions led by the same module must use one decision type, and the
 * batch's mean narrative impact must reach the configured minimum coherence.
 */
@Component
public class ResolutionConsistencyValidator {

    private final QuillmindProperties properties;

    public ResolutionConsistencyValidator(QuillmindProperties properties) {
        this.properties = properties;
    }

    public ConsistencyReport check(List<ConflictResolution> resolutions) {
        var issues = new ArrayList<String>();
        Set<ModuleName> inconsistent = new LinkedHashSet<>();

        for (var entry : typesByPrimaryModule(resolutions).entrySet()) {
            if (entry.getValue().size() > 1) {
                inconsistent.add(entry.getKey());
                issues.add("Conflicting resolution types for module " + entry.getKey());
            }
        }

        double coherence = overallCoherence(resolutions);
        if (coherence < properties.getMinimumBatchCoherence()) {
            issues.add(String.format(Locale.ROOT, "Overall narrative coherence below threshold: %.2f", coherence));
        }

        return new ConsistencyReport(issues.isEmpty(), issues, inconsistent, coherence);
    }

    static Map<ModuleName, Set<ResolutionType>> typesByPrimaryModule(List<ConflictResolution> resolutions) {
        var types = new LinkedHashMap<ModuleName, Set<ResolutionType>>();
        for (ConflictResolution resolution : resolutions) {
            types.computeIfAbsent(resolution.resolution().primaryModule(), m -> new LinkedHashSet<>())
                    .add(resolution.resolution().type());
        }
        return types;
    }

    static double overallCoherence(List<ConflictResolution> resolutions) {
        if (resolutions.isEmpty()) {
            return 1.0;
        }
        double total = 0.0;
        for (ConflictResolution resolution : resolutions) {
            total += resolution.narrativeImpact();
        }
        return total / resolutions.size();
    }
}
