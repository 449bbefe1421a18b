package uk.gegc.questionnaire.features.condition.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "ConditionLogicImportResponse", description = "Outcome of a condition logic import")
public record ConditionLogicImportResponse(
        String importMode,

        @Schema(description = "Number of imported questions whose condition was written")
        int updatedCount,

        @Schema(description = "Conditions removed because replace mode left their question out")
        int clearedCount,

        @Schema(description = "Imported entries that carry a condition")
        int totalConditions
) {
}
