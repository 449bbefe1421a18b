package uk.gegc.questionnaire.features.condition.domain.graph;

import java.util.List;

/**
 * Direct and transitive dependencies of a single question.
 *
 * @param directDependencies   ids named by the question's own condition
 * @param indirectDependencies ids reached only through other questions
 * @param totalDependencies    number of distinct existing questions reached
 * @param dependencyChain      traversal order, starting question excluded
 */
public record DependencyAnalysis(
        List<String> directDependencies,
        List<String> indirectDependencies,
        int totalDependencies,
        List<String> dependencyChain
) {
}
