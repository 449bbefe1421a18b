package uk.gegc.questionnaire.features.condition.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.questionnaire.features.condition.domain.graph.DependencyAnalysis;

import java.util.List;
import java.util.UUID;

@Schema(name = "QuestionDependencyDto", description = "Dependency details of one question")
public record QuestionDependencyDto(
        UUID id,
        String title,
        Integer questionOrder,
        String questionType,
        boolean hasCondition,
        JsonNode displayCondition,

        @Schema(description = "Questions this question depends on, directly and transitively")
        DependencyAnalysis dependencies,

        @Schema(description = "Questions whose condition references this question")
        List<String> dependentQuestions
) {
}
