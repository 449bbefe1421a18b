package uk.gegc.questionnaire.features.condition.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

@Schema(name = "BatchConditionRequest", description = "Display condition changes applied together")
public record BatchConditionRequest(
        @Schema(description = "Condition changes, validated as one combined edit")
        @NotEmpty(message = "Condition settings must not be empty")
        @JsonProperty("condition_settings")
        List<@Valid ConditionSettingRequest> conditionSettings
) {
}
