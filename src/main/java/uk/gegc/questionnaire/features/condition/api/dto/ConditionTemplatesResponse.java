package uk.gegc.questionnaire.features.condition.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "ConditionTemplatesResponse", description = "Display condition templates grouped by purpose")
public record ConditionTemplatesResponse(
        @Schema(description = "Generic single, AND and OR patterns")
        List<ConditionTemplateDto> commonPatterns,

        @Schema(description = "Screening patterns taken from standard psychological scales")
        List<ConditionTemplateDto> psychologicalPatterns
) {
}
