package uk.gegc.questionnaire.features.condition.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Portable copy of a paper's display conditions. Its {@code condition_logic} entries can be
 * sent back unchanged as the {@code condition_config} of an import.
 */
@Schema(name = "ConditionLogicExport", description = "Display conditions of a paper, ready to import elsewhere")
public record ConditionLogicExport(
        @JsonProperty("paper_info")
        PaperInfo paperInfo,

        @Schema(description = "Questions that carry a display condition, in question order")
        @JsonProperty("condition_logic")
        List<Entry> conditionLogic,

        Statistics statistics
) {

    public record PaperInfo(
            UUID id,
            String title,

            @JsonProperty("exported_at")
            Instant exportedAt
    ) {
    }

    public record Entry(
            @JsonProperty("question_id")
            UUID questionId,

            @JsonProperty("question_order")
            int questionOrder,

            @JsonProperty("question_title")
            String questionTitle,

            @JsonProperty("display_condition")
            JsonNode displayCondition
    ) {
    }

    public record Statistics(
            @JsonProperty("total_conditional_questions")
            int totalConditionalQuestions,

            @Schema(description = "Sum of per-question logic effort scores")
            @JsonProperty("logic_complexity")
            int logicComplexity
    ) {
    }
}
