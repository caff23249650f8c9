package com.quillmind.core.resolution;

import com.quillmind.core.model.ConflictResolution;
import com.quillmind.core.model.InterModuleConflict;
import com.quillmind.core.model.UserPreferences;
import com.quillmind.core.model.WritingContext;

import java.util.List;

/**
 * Source of per-user resolution preferences.
 */
public interface UserPreferenceEngine {

    /**
     * How strongly the user's preferences should bias resolution of this conflict, in [0,1].
     */
    double getPreferenceWeight(InterModuleConflict conflict, WritingContext context);

    UserPreferences getUserPreferences(WritingContext context);

    void updatePreferences(String userId, UserPreferences preferences);

    List<ConflictResolution> getHistoricalResolutions(String userId);
}
