package uk.gegc.questionnaire.features.condition.domain.graph;

import uk.gegc.questionnaire.features.condition.domain.model.ConditionKind;

import java.util.List;

/**
 * Presentation model of a paper's dependency graph.
 */
public record DependencyGraphData(
        List<GraphNode> nodes,
        List<GraphEdge> edges,
        List<DependencyCluster> clusters,
        Statistics statistics
) {

    /**
     * @param level position of the question in the snapshot, not a topological layer
     */
    public record GraphNode(
            String id,
            String title,
            List<String> dependencies,
            List<String> incomingDependencies,
            int level,
            int complexityScore,
            int nestingLevel,
            boolean hasCondition,
            ConditionKind conditionType,
            Integer clusterId
    ) {
    }

    public record GraphEdge(String from, String to, ConditionKind type) {
    }

    public record Statistics(
            int totalQuestions,
            int questionsWithConditions,
            int totalDependencies,
            int circularDependencies,
            int maxNestingLevel,
            double avgComplexity
    ) {
    }
}
