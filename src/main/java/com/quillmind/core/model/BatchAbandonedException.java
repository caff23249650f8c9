package com.quillmind.core.model;

/**
 * Thrown when a batch outlives the {@link BatchDeadline} its caller supplied.
 */
public class BatchAbandonedException extends RuntimeException {

    public BatchAbandonedException(String message) {
        super(message);
    }
}
