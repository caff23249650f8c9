package com.quillmind.core.resolution;

import com.quillmind.core.model.ConflictResolution;
import com.quillmind.core.model.ConflictSeverity;
import com.quillmind.core.model.InterModuleConflict;
import com.quillmind.core.model.UserPreferences;
import com.quillmind.core.model.WritingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Heuristic preference engine that keeps explicit preferences in memory.
 * <p>
 * The weight starts at {@value #BASE_WEIGHT} and is boosted for fully autonomous sessions
 * and critical conflicts. Stored preferences are returned as-is; users without any get a
 * balanced profile whose autonomy follows the session mode.
 */
public class DefaultUserPreferenceEngine implements UserPreferenceEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultUserPreferenceEngine.class);

    static final double BASE_WEIGHT = 0.7;
    static final double FULLY_AUTO_MULTIPLIER = 1.2;
    static final double CRITICAL_MULTIPLIER = 1.3;

    private final Map<String, UserPreferences> preferencesByUser = new ConcurrentHashMap<>();

    @Override
    public double getPreferenceWeight(InterModuleConflict conflict, WritingContext context) {
        double modeMultiplier = context.isFullyAuto() ? FULLY_AUTO_MULTIPLIER : 1.0;
        double severityMultiplier = conflict.severity() == ConflictSeverity.CRITICAL ? CRITICAL_MULTIPLIER : 1.0;
        return Math.min(1.0, BASE_WEIGHT * modeMultiplier * severityMultiplier);
    }

    @Override
    public UserPreferences getUserPreferences(WritingContext context) {
        if (context.userId() != null) {
            UserPreferences stored = preferencesByUser.get(context.userId());
            if (stored != null) {
                return stored;
            }
        }
        return new UserPreferences("balanced", 0.8, "balanced", context.isFullyAuto() ? "high" : "moderate");
    }

    @Override
    public void updatePreferences(String userId, UserPreferences preferences) {
        log.info("Updating resolution preferences for user {}", userId);
        preferencesByUser.put(userId, preferences);
    }

    /** No resolution history is persisted by this engine. */
    @Override
    public List<ConflictResolution> getHistoricalResolutions(String userId) {
        return List.of();
    }
}
