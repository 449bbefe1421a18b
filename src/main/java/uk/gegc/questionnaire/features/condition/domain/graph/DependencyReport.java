package uk.gegc.questionnaire.features.condition.domain.graph;

import java.util.List;

public record DependencyReport(
        Summary summary,
        ComplexityAnalysis complexityAnalysis,
        List<CircularDependency> circularDependencies,
        List<String> recommendations
) {

    public record Summary(
            int totalQuestions,
            int questionsWithConditions,
            int simpleConditions,
            int complexConditions,
            int nestedConditions,
            int circularDependencies,
            int isolatedQuestions
    ) {
    }

    public record ComplexityAnalysis(
            double averageComplexity,
            int maxComplexity,
            int maxNestingLevel,
            List<HighComplexityQuestion> highComplexityQuestions
    ) {
    }

    public record HighComplexityQuestion(String id, String title, int complexity, int nestingLevel) {
    }
}
