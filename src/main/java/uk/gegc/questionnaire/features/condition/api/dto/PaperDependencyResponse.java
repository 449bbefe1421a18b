package uk.gegc.questionnaire.features.condition.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.questionnaire.features.condition.domain.graph.CircularDependency;
import uk.gegc.questionnaire.features.condition.domain.graph.DependencyGraphData;

import java.util.List;

@Schema(name = "PaperDependencyResponse", description = "Display condition dependencies of a paper")
public record PaperDependencyResponse(
        PaperInfoDto paperInfo,
        DependencyGraphData dependencyGraph,
        List<CircularDependency> circularDependencies,
        List<QuestionDependencyDto> questions,
        PaperDependencyStatisticsDto statistics
) {
}
