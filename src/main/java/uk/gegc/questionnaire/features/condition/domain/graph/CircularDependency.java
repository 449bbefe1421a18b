package uk.gegc.questionnaire.features.condition.domain.graph;

import java.util.List;

/**
 * A detected cycle as a closed id path (first id repeated at the end) with matching titles.
 */
public record CircularDependency(List<String> cycle, List<String> questionTitles) {
}
