package uk.gegc.questionnaire.features.condition.api.dto;

public record PaperDependencyStatisticsDto(
        int questionsWithConditions,
        int totalDependencies,
        int circularDependencies,
        int complexConditions
) {
}
