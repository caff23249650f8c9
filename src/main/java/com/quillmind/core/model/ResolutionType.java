package com.quillmind.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Shape of a resolution decision.
 */
public enum ResolutionType {
    MERGE,
    PRIORITIZE,
    RECONCILE,
    RECALCULATE,
    ESCALATE;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ResolutionType fromId(String id) {
        return valueOf(id.trim().toUpperCase(Locale.ROOT));
    }
}
