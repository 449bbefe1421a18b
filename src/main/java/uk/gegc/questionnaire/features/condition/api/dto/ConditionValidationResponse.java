package uk.gegc.questionnaire.features.condition.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.questionnaire.features.condition.application.CircularDependencyCheck;
import uk.gegc.questionnaire.features.condition.domain.graph.ConditionValidationResult;

import java.util.List;

@Schema(name = "ConditionValidationResponse", description = "Outcome of validating a display condition")
public record ConditionValidationResponse(
        QuestionInfoDto questionInfo,

        @Schema(description = "Condition as it was validated")
        JsonNode conditionToValidate,

        @Schema(description = "Structural, reference and cycle errors plus warnings")
        ConditionValidationResult validationResult,

        @Schema(description = "Result of the circular dependency pre-check")
        CircularDependencyCheck circularDependencyCheck,

        List<String> recommendations
) {
}
