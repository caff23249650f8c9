package com.quillmind.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of disagreement between module outputs.
 * <p>
 * Every type except {@link #UNRECOGNIZED} has a registered resolution strategy.
 * {@code UNRECOGNIZED} captures ids sent by a newer detector that this engine does not know.
 */
public enum ConflictType {
    EMOTIONAL_NARRATIVE_MISMATCH,
    PLOT_THEME_INCONSISTENCY,
    STYLE_VOICE_CONFLICT,
    CHARACTER_ARC_DISCONTINUITY,
    THEMATIC_COHERENCE_BREAK,
    STRUCTURAL_TIMING_ISSUE,
    GENRE_CONVENTION_VIOLATION,
    AUDIENCE_EXPECTATION_MISMATCH,
    UNRECOGNIZED;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isRecognized() {
        return this != UNRECOGNIZED;
    }

    @JsonCreator
    public static ConflictType fromId(String id) {
        if (id == null) {
            return UNRECOGNIZED;
        }
        for (ConflictType type : values()) {
            if (type.name().equalsIgnoreCase(id.trim())) {
                return type;
            }
        }
        return UNRECOGNIZED;
    }
}
