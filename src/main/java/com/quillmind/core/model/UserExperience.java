package com.quillmind.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Self-declared writing experience of the user.
 */
public enum UserExperience {
    BEGINNER,
    INTERMEDIATE,
    ADVANCED,
    EXPERT;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Unknown or missing ids map to {@link #INTERMEDIATE}. */
    @JsonCreator
    public static UserExperience fromId(String id) {
        if (id == null) {
            return INTERMEDIATE;
        }
        String normalized = id.trim();
        for (UserExperience value : values()) {
            if (value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        return INTERMEDIATE;
    }
}
