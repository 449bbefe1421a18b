package uk.gegc.questionnaire.features.condition.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "BatchConditionResponse", description = "Outcome of a batch display condition update")
public record BatchConditionResponse(
        @Schema(description = "Number of questions whose condition was saved")
        int updatedCount,

        List<BatchValidationEntry> validationResults
) {
}
