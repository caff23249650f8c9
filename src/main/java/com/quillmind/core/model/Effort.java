package com.quillmind.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Estimated effort to apply an improvement suggestion.
 */
public enum Effort {
    MINIMAL,
    MODERATE,
    SIGNIFICANT;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
