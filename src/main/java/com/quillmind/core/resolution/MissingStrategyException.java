package com.quillmind.core.resolution;

import com.quillmind.core.model.ConflictType;

/**
 * Thrown when no {@link com.quillmind.core.model.ResolutionStrategy} is registered for a conflict type.
 */
public class MissingStrategyException extends RuntimeException {

    private final ConflictType conflictType;

    public MissingStrategyException(ConflictType conflictType) {
        super("No resolution strategy found for conflict type: " + conflictType.id());
        this.conflictType = conflictType;
    }

    public ConflictType getConflictType() {
        return conflictType;
    }
}
