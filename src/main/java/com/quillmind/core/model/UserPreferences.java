package com.quillmind.core.model;

import java.io.Serializable;

/**
 * Resolution preferences of one user.
 */
public record UserPreferences(
    String preferredResolutionStyle,
    double qualityThreshold,
    String speedPreference,
    String autonomyLevel
) implements Serializable {}
