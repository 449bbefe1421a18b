package uk.gegc.questionnaire.features.condition.domain.graph;

import java.util.List;

public record DependencyCluster(int id, List<String> nodes, boolean stronglyConnected) {
}
