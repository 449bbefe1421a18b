package uk.gegc.questionnaire.features.condition.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

@Schema(name = "ConditionLogicImportRequest", description = "Display conditions to apply to a paper")
public record ConditionLogicImportRequest(
        @Schema(description = "Imported configuration, usually an earlier export", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Condition config must not be null")
        @Valid
        @JsonProperty("condition_config")
        Config conditionConfig,

        @Schema(description = "merge keeps conditions not in the import, replace clears them", example = "merge")
        @JsonProperty("import_mode")
        String importMode
) {

    public record Config(
            @NotNull(message = "Condition logic must not be null")
            @JsonProperty("condition_logic")
            List<@Valid ConditionSettingRequest> conditionLogic
    ) {
    }
}
