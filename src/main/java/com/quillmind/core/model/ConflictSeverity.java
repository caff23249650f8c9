package com.quillmind.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ConflictSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Unknown or missing ids map to {@link #MEDIUM}. */
    @JsonCreator
    public static ConflictSeverity fromId(String id) {
        if (id == null) {
            return MEDIUM;
        }
        String normalized = id.trim();
        for (ConflictSeverity value : values()) {
            if (value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        return MEDIUM;
    }
}
