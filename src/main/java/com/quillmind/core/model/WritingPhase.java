package com.quillmind.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Phase of the writing process the user is in.
 */
public enum WritingPhase {
    PLANNING,
    DRAFTING,
    REVISING,
    POLISHING;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Unknown or missing ids map to {@link #DRAFTING}. */
    @JsonCreator
    public static WritingPhase fromId(String id) {
        if (id == null) {
            return DRAFTING;
        }
        String normalized = id.trim();
        for (WritingPhase value : values()) {
            if (value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        return DRAFTING;
    }
}
