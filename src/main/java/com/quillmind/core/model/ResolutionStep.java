package com.quillmind.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ResolutionStep(
    int step,
    String action,
    ModuleName target,
    Map<String, Object> parameters,
    String expectedOutcome
) implements Serializable {

    public ResolutionStep {
        parameters = parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                : Map.of();
    }
}
