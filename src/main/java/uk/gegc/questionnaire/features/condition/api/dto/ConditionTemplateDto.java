package uk.gegc.questionnaire.features.condition.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "ConditionTemplateDto", description = "Reusable display condition pattern")
public record ConditionTemplateDto(
        String name,
        String description,

        @Schema(description = "Condition with ${...} placeholders to fill in, absent for ready-made patterns")
        JsonNode template,

        @Schema(description = "Filled-in condition")
        JsonNode example
) {
}
