package uk.gegc.questionnaire.features.condition.api.dto;

import uk.gegc.questionnaire.features.condition.domain.graph.ConditionValidationResult;

import java.util.UUID;

public record BatchValidationEntry(
        UUID questionId,
        String questionTitle,
        ConditionValidationResult validationResult
) {
}
