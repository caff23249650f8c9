package com.quillmind.core.quality;

import com.quillmind.core.model.Effort;
import com.quillmind.core.model.ImprovementSuggestion;
import com.quillmind.core.model.Priority;
import com.quillmind.core.model.QualityCheck;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns quality checks into a ranked list of improvement suggestions.
 * <p>
 * Failed checks and checks scoring below {@value #REMEDIATE_BELOW} contribute each of their
 * remediation lines; passing checks below {@value #OPTIMIZE_BELOW} contribute one generic
 * optimisation hint. The result is ordered by priority, then estimated impact, both descending.
 */
@Component
public class ImprovementSuggestionGenerator {

    static final double REMEDIATE_BELOW = 0.8;
    static final double OPTIMIZE_BELOW = 0.9;

    static final double FAILED_IMPACT = 0.3;
    static final double PASSED_IMPACT = 0.1;

    private static final Comparator<ImprovementSuggestion> RANKING =
            Comparator.comparingInt((ImprovementSuggestion s) -> s.priority().rank()).reversed()
                    .thenComparing(Comparator.comparingDouble(ImprovementSuggestion::estimatedImpact).reversed());

    public List<ImprovementSuggestion> generate(List<QualityCheck> checks, int limit) {
        var suggestions = new ArrayList<ImprovementSuggestion>();

        for (QualityCheck check : checks) {
            if (!check.passed() || check.score() < REMEDIATE_BELOW) {
                for (String line : check.suggestions()) {
                    suggestions.add(new ImprovementSuggestion(
                            check.moduleName(),
                            line,
                            check.passed() ? Priority.MEDIUM : Priority.HIGH,
                            check.passed() ? PASSED_IMPACT : FAILED_IMPACT,
                            "Address " + check.checkType() + " issues in " + check.moduleName(),
                            check.passed() ? Effort.MINIMAL : Effort.MODERATE));
                }
            } else if (check.score() < OPTIMIZE_BELOW) {
                suggestions.add(new ImprovementSuggestion(
                        check.moduleName(),
                        "Optimize " + check.checkType() + " for higher quality",
                        Priority.MEDIUM,
                        PASSED_IMPACT,
                        "Fine-tune " + check.moduleName() + " parameters",
                        Effort.MINIMAL));
            }
        }

        // List.sort is stable, so equal-ranked suggestions keep check order
        suggestions.sort(RANKING);
        return suggestions.size() > limit ? List.copyOf(suggestions.subList(0, limit)) : List.copyOf(suggestions);
    }
}
