package com.quillmind.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The content-generation modules whose outputs are validated and arbitrated.
 * <p>
 * The five content modules form a closed set. {@link #UNKNOWN} stands for any module id
 * that is not recognised (the coordinator never scores it) and {@link #SYSTEM} is the scope
 * of system-wide checks that do not belong to a single module.
 */
public enum ModuleName {
    EMOTION_ARC("emotionArc"),
    NARRATIVE_DASHBOARD("narrativeDashboard"),
    PLOT_STRUCTURE("plotStructure"),
    STYLE_PROFILE("styleProfile"),
    THEME_ANALYSIS("themeAnalysis"),
    SYSTEM("system"),
    UNKNOWN("unknown");

    private final String id;

    ModuleName(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    /** True for the five content-generation modules. */
    public boolean isContentModule() {
        return this != SYSTEM && this != UNKNOWN;
    }

    @JsonCreator
    public static ModuleName fromId(String id) {
        if (id == null) {
            return UNKNOWN;
        }
        for (ModuleName name : values()) {
            if (name.id.equals(id) || name.name().equalsIgnoreCase(id)) {
                return name;
            }
        }
        return UNKNOWN;
    }

    @Override
    public String toString() {
        return id;
    }
}
