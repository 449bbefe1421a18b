package uk.gegc.questionnaire.features.condition.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(name = "QuestionInfoDto", description = "Question a condition belongs to")
public record QuestionInfoDto(
        UUID id,
        String title,
        UUID paperId
) {
}
