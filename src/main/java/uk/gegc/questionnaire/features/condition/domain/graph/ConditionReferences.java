package uk.gegc.questionnaire.features.condition.domain.graph;

import java.util.List;

public record ConditionReferences(List<String> missingQuestions, List<String> crossPaperReferences) {

    public boolean isClean() {
        return missingQuestions.isEmpty() && crossPaperReferences.isEmpty();
    }
}
