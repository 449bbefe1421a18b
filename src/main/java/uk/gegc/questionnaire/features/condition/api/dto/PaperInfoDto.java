package uk.gegc.questionnaire.features.condition.api.dto;

import java.util.UUID;

public record PaperInfoDto(
        UUID id,
        String title,
        int totalQuestions
) {
}
