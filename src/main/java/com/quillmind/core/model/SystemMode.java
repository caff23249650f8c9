package com.quillmind.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How much initiative the writing assistant takes on behalf of the user.
 */
public enum SystemMode {
    MANUAL,
    HYBRID,
    FULLY_AUTO;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Unknown or missing ids map to {@link #HYBRID}. */
    @JsonCreator
    public static SystemMode fromId(String id) {
        if (id == null) {
            return HYBRID;
        }
        String normalized = id.trim().replace('-', '_');
        for (SystemMode value : values()) {
            if (value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        return HYBRID;
    }
}
