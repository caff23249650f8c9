package com.quillmind.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while validating or resolving a batch.
 *
 * @param eventType event type (e.g. "validation.completed", "resolution.fallback")
 * @param batchId   the batch this event belongs to
 * @param subjectId the conflict or module this event relates to (nullable for batch-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record QuillmindEvent(
    String eventType,
    String batchId,
    String subjectId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String VALIDATION_COMPLETED = "validation.completed";
    public static final String RESOLUTION_COMPLETED = "resolution.completed";
    public static final String RESOLUTION_FALLBACK = "resolution.fallback";
    public static final String RESOLUTION_INCONSISTENT = "resolution.inconsistent";
}
