package com.quillmind.core.standards;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The quality axes reported alongside validation results.
 */
@Component
public class QualityMetricCatalog {

    private static final List<QualityMetricDefinition> DEFINITIONS = List.of(
            new QualityMetricDefinition("coherence", "Narrative and thematic coherence", 0.25,
                    QualityMetricDefinition.Measurement.SCORE, 0, 1),
            new QualityMetricDefinition("accuracy", "Factual and logical accuracy", 0.2,
                    QualityMetricDefinition.Measurement.SCORE, 0, 1),
            new QualityMetricDefinition("consistency", "Style and voice consistency", 0.2,
                    QualityMetricDefinition.Measurement.SCORE, 0, 1),
            new QualityMetricDefinition("completeness", "Content completeness and coverage", 0.15,
                    QualityMetricDefinition.Measurement.SCORE, 0, 1),
            new QualityMetricDefinition("engagement", "Reader engagement and interest", 0.2,
                    QualityMetricDefinition.Measurement.SCORE, 0, 1)
    );

    public List<QualityMetricDefinition> definitions() {
        return DEFINITIONS;
    }

    public Optional<QualityMetricDefinition> find(String name) {
        return DEFINITIONS.stream().filter(d -> d.name().equals(name)).findFirst();
    }

    /**
     * Weighted score over the catalog axes. Axes missing from {@code scores} count as 0.
     */
    public double weightedScore(Map<String, Double> scores) {
        double total = 0.0;
        for (QualityMetricDefinition definition : DEFINITIONS) {
            Double value = scores.get(definition.name());
            total += (value != null ? value : 0.0) * definition.weight();
        }
        return total;
    }
}
