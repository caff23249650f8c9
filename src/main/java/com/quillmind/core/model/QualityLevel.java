package com.quillmind.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Requested polish of the generated writing.
 */
public enum QualityLevel {
    DRAFT,
    POLISHED,
    PUBLICATION_READY;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Unknown or missing ids map to {@link #POLISHED}. */
    @JsonCreator
    public static QualityLevel fromId(String id) {
        if (id == null) {
            return POLISHED;
        }
        String normalized = id.trim();
        for (QualityLevel value : values()) {
            if (value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        return POLISHED;
    }
}
