package uk.gegc.questionnaire.features.condition.domain.graph;

import uk.gegc.questionnaire.features.condition.domain.model.QuestionSnapshot;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Depth-first cycle detection over a {@link DependencyGraph}.
 *
 * <p>The detector keeps no traversal state between calls and never mutates its graph;
 * speculative checks run against an overlay produced by {@link DependencyGraph#withEdge}.
 */
public class CircularDependencyDetector {

    private final DependencyGraph graph;

    public CircularDependencyDetector(DependencyGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph must not be null");
    }

    /**
     * Finds a cycle reachable from {@code startId}.
     *
     * @return closed id path (first id repeated at the end), or an empty list
     */
    public List<String> detectCircularDependency(String startId) {
        return findCycle(graph, startId);
    }

    /**
     * Scans every question and reports each distinct cycle once.
     */
    public List<CircularDependency> detectAllCircularDependencies() {
        List<CircularDependency> cycles = new ArrayList<>();
        Set<String> processed = new HashSet<>();
        Set<Set<String>> reported = new HashSet<>();

        for (String questionId : graph.questionIds()) {
            if (processed.contains(questionId)) {
                continue;
            }
            List<String> cycle = findCycle(graph, questionId);
            if (cycle.isEmpty()) {
                continue;
            }
            processed.addAll(cycle);
            if (reported.add(new TreeSet<>(cycle))) {
                cycles.add(new CircularDependency(cycle, titlesOf(cycle)));
            }
        }
        return cycles;
    }

    /**
     * True when each question can reach the other through dependency edges.
     */
    public boolean hasMutualDependency(String firstId, String secondId) {
        return reachableFrom(firstId).contains(secondId) && reachableFrom(secondId).contains(firstId);
    }

    /**
     * Tests whether adding {@code fromId -> toId} would leave a cycle reachable from
     * {@code fromId}. The detector's own graph is left untouched.
     */
    public boolean wouldCreateCycle(String fromId, String toId) {
        if (graph.dependenciesOf(fromId).contains(toId)) {
            return false;
        }
        DependencyGraph candidate = graph.withEdge(fromId, toId);
        return !findCycle(candidate, fromId).isEmpty();
    }

    public DependencyGraph getGraph() {
        return graph;
    }

    List<String> titlesOf(List<String> ids) {
        return ids.stream()
                .map(id -> {
                    QuestionSnapshot question = graph.question(id);
                    return question != null ? question.title() : "Unknown question (" + id + ")";
                })
                .toList();
    }

    private static List<String> findCycle(DependencyGraph graph, String startId) {
        return dfs(graph, startId, new ArrayList<>(), new HashSet<>(), new HashSet<>());
    }

    private static List<String> dfs(DependencyGraph graph,
                                    String nodeId,
                                    List<String> path,
                                    Set<String> onPath,
                                    Set<String> visited) {
        if (onPath.contains(nodeId)) {
            List<String> cycle = new ArrayList<>(path.subList(path.indexOf(nodeId), path.size()));
            cycle.add(nodeId);
            return List.copyOf(cycle);
        }
        if (!visited.add(nodeId)) {
            return List.of();
        }

        onPath.add(nodeId);
        path.add(nodeId);
        for (String dependencyId : graph.dependenciesOf(nodeId)) {
            if (graph.containsQuestion(dependencyId)) {
                List<String> cycle = dfs(graph, dependencyId, path, onPath, visited);
                if (!cycle.isEmpty()) {
                    return cycle;
                }
            }
        }
        path.remove(path.size() - 1);
        onPath.remove(nodeId);
        return List.of();
    }

    private Set<String> reachableFrom(String questionId) {
        Set<String> reachable = new LinkedHashSet<>();
        collectReachable(questionId, 0, new HashSet<>(), reachable);
        return reachable;
    }

    private void collectReachable(String currentId, int depth, Set<String> visited, Set<String> reachable) {
        if (!visited.add(currentId) || depth > DependencyLimits.MAX_REACHABILITY_DEPTH) {
            return;
        }
        for (String dependencyId : graph.dependenciesOf(currentId)) {
            if (graph.containsQuestion(dependencyId)) {
                reachable.add(dependencyId);
                collectReachable(dependencyId, depth + 1, visited, reachable);
            }
        }
    }
}
