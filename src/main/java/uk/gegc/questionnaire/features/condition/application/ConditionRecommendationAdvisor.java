package uk.gegc.questionnaire.features.condition.application;

import org.springframework.stereotype.Component;
import uk.gegc.questionnaire.features.condition.domain.graph.ConditionValidationResult;
import uk.gegc.questionnaire.features.condition.domain.model.ComplexCondition;
import uk.gegc.questionnaire.features.condition.domain.model.DisplayCondition;
import uk.gegc.questionnaire.features.condition.domain.model.LogicalOperator;
import uk.gegc.questionnaire.features.condition.domain.model.SimpleCondition;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain-language hints shown to a questionnaire author next to a condition validation result.
 */
@Component
public class ConditionRecommendationAdvisor {

    private static final int MANY_SUB_CONDITIONS = 5;

    public List<String> recommend(DisplayCondition condition, ConditionValidationResult result) {
        List<String> recommendations = new ArrayList<>();

        if (condition == null) {
            recommendations.add("Question has no display condition and will always be shown");
            return recommendations;
        }

        condition.match(
                simple -> {
                    recommendSimple(simple, recommendations);
                    return null;
                },
                complex -> {
                    recommendComplex(complex, recommendations);
                    return null;
                }
        );

        if (!result.warnings().isEmpty()) {
            recommendations.add("Review the warnings to avoid unexpected display behaviour");
        }
        if (result.errors().isEmpty()) {
            recommendations.add("Condition passed validation and is safe to use");
        }
        return recommendations;
    }

    private void recommendSimple(SimpleCondition condition, List<String> recommendations) {
        recommendations.add("Simple condition, cheap to evaluate");
        if (condition.selectedOption() == null || condition.selectedOption().isBlank()) {
            recommendations.add("Specify the option value explicitly to avoid logic errors");
        }
    }

    private void recommendComplex(ComplexCondition condition, List<String> recommendations) {
        recommendations.add("Complex condition, make sure the logic stays easy to follow");
        condition.logicalOperator().ifPresent(operator -> recommendations.add(operator == LogicalOperator.AND
                ? "AND requires every sub-condition to hold, suited to strict screening"
                : "OR requires any one sub-condition to hold, suited to alternative answers"));
        if (condition.conditions().size() > MANY_SUB_CONDITIONS) {
            recommendations.add("Many sub-conditions, consider simplifying the logic for respondents");
        }
    }
}
