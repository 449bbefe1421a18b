package uk.gegc.questionnaire.features.condition.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "DisplayConditionRequest", description = "Display condition to validate or save, null clears it")
public record DisplayConditionRequest(
        @Schema(description = "Simple {question_id, selected_option} or complex {operator, conditions} condition",
                example = "{\"question_id\":\"b3f1c2d4-0000-0000-0000-000000000001\",\"selected_option\":\"Yes\"}")
        @JsonProperty("display_condition")
        JsonNode displayCondition
) {
}
