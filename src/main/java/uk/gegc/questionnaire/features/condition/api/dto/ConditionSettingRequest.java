package uk.gegc.questionnaire.features.condition.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

@Schema(name = "ConditionSettingRequest", description = "One display condition change inside a batch")
public record ConditionSettingRequest(
        @Schema(description = "UUID of the question whose condition is replaced", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Question id must not be null")
        @JsonProperty("question_id")
        UUID questionId,

        @Schema(description = "New display condition, null clears it")
        @JsonProperty("display_condition")
        JsonNode displayCondition
) {
}
