package com.quillmind.core.standards;

/**
 * Describes one tracked quality axis.
 *
 * @param weight      relative weight of the axis; weights in a catalog sum to 1
 * @param measurement unit of the measurement
 * @param min         lower bound of the range
 * @param max         upper bound of the range
 */
public record QualityMetricDefinition(
    String name,
    String description,
    double weight,
    Measurement measurement,
    double min,
    double max
) {

    public enum Measurement { SCORE, PERCENTAGE, COUNT }
}
