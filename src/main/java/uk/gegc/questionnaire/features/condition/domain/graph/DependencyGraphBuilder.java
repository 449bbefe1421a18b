package uk.gegc.questionnaire.features.condition.domain.graph;

import uk.gegc.questionnaire.features.condition.domain.model.DisplayCondition;
import uk.gegc.questionnaire.features.condition.domain.model.QuestionSnapshot;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the dependency graph of a question snapshot and answers structural
 * questions about it: transitive dependencies and connected clusters.
 */
public class DependencyGraphBuilder {

    private final Map<String, QuestionSnapshot> questions;
    private DependencyGraph dependencyGraph;

    public DependencyGraphBuilder(List<QuestionSnapshot> snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Map<String, QuestionSnapshot> byId = new LinkedHashMap<>();
        for (QuestionSnapshot question : snapshot) {
            Objects.requireNonNull(question, "snapshot must not contain null questions");
            if (byId.putIfAbsent(question.id(), question) != null) {
                throw new IllegalArgumentException("Duplicate question id in snapshot: " + question.id());
            }
        }
        this.questions = byId;
        buildDependencyGraph();
    }

    /**
     * Extracts the ids a condition depends on, deduplicated, in first-seen order.
     */
    public static List<String> extractDependencies(DisplayCondition condition) {
        if (condition == null) {
            return List.of();
        }
        Set<String> dependencies = new LinkedHashSet<>();
        collectDependencies(condition, dependencies);
        return List.copyOf(dependencies);
    }

    private static void collectDependencies(DisplayCondition condition, Set<String> into) {
        Deque<DisplayCondition> pending = new ArrayDeque<>();
        pending.push(condition);
        while (!pending.isEmpty()) {
            pending.pop().match(
                    simple -> into.add(simple.questionId()),
                    complex -> {
                        List<DisplayCondition> children = complex.conditions();
                        // reversed so children pop left to right
                        for (int i = children.size() - 1; i >= 0; i--) {
                            pending.push(children.get(i));
                        }
                        return true;
                    }
            );
        }
    }

    /**
     * Rebuilds the edge list of every known question from its display condition.
     */
    public DependencyGraph buildDependencyGraph() {
        Map<String, List<String>> edges = new LinkedHashMap<>();
        for (QuestionSnapshot question : questions.values()) {
            edges.put(question.id(), extractDependencies(question.displayCondition()));
        }
        dependencyGraph = new DependencyGraph(questions, edges);
        return dependencyGraph;
    }

    public DependencyGraph getDependencyGraph() {
        return dependencyGraph;
    }

    public Map<String, QuestionSnapshot> getQuestions() {
        return Collections.unmodifiableMap(questions);
    }

    /**
     * Collects the direct and indirect dependencies of a question. Expansion only
     * follows questions present in the snapshot and stops at
     * {@link DependencyLimits#MAX_DEPENDENCY_CHAIN_DEPTH}.
     */
    public DependencyAnalysis getQuestionDependencies(String questionId) {
        List<String> direct = dependencyGraph.dependenciesOf(questionId);
        Set<String> visited = new HashSet<>();
        List<String> chain = new ArrayList<>();

        Set<String> all = collectTransitive(questionId, 0, visited, chain);

        List<String> indirect = all.stream()
                .filter(id -> !direct.contains(id))
                .toList();

        return new DependencyAnalysis(
                direct,
                indirect,
                all.size(),
                chain.isEmpty() ? List.of() : List.copyOf(chain.subList(1, chain.size()))
        );
    }

    private Set<String> collectTransitive(String currentId, int depth, Set<String> visited, List<String> chain) {
        if (visited.contains(currentId) || depth > DependencyLimits.MAX_DEPENDENCY_CHAIN_DEPTH) {
            return Set.of();
        }
        visited.add(currentId);
        chain.add(currentId);

        Set<String> collected = new LinkedHashSet<>();
        for (String dependencyId : dependencyGraph.dependenciesOf(currentId)) {
            if (questions.containsKey(dependencyId)) {
                collected.add(dependencyId);
                collected.addAll(collectTransitive(dependencyId, depth + 1, visited, chain));
            }
        }
        return collected;
    }

    public List<DependencyCluster> detectClusters() {
        return detectClusters(true);
    }

    /**
     * Groups questions into weakly connected components of more than one member and
     * flags the strongly connected ones.
     *
     * @param stronglyConnectedOnly when true only strongly connected clusters are returned
     */
    public List<DependencyCluster> detectClusters(boolean stronglyConnectedOnly) {
        Map<String, List<String>> dependents = reverseEdges();
        Set<String> visited = new HashSet<>();
        List<DependencyCluster> clusters = new ArrayList<>();
        int clusterId = 0;

        for (String questionId : questions.keySet()) {
            if (visited.contains(questionId)) {
                continue;
            }
            List<String> component = findConnectedComponent(questionId, visited, dependents);
            if (component.size() > 1) {
                boolean strong = isStronglyConnected(component);
                if (!stronglyConnectedOnly || strong) {
                    clusters.add(new DependencyCluster(clusterId++, List.copyOf(component), strong));
                }
            }
        }
        return clusters;
    }

    private Map<String, List<String>> reverseEdges() {
        Map<String, List<String>> reverse = new LinkedHashMap<>();
        dependencyGraph.edges().forEach((from, targets) ->
                targets.forEach(to -> reverse.computeIfAbsent(to, k -> new ArrayList<>()).add(from)));
        return reverse;
    }

    private List<String> findConnectedComponent(String start, Set<String> visited, Map<String, List<String>> dependents) {
        List<String> component = new ArrayList<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(start);

        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (!visited.add(current)) {
                continue;
            }
            component.add(current);

            for (String dependency : dependencyGraph.dependenciesOf(current)) {
                if (questions.containsKey(dependency) && !visited.contains(dependency)) {
                    stack.push(dependency);
                }
            }
            for (String dependent : dependents.getOrDefault(current, List.of())) {
                if (!visited.contains(dependent)) {
                    stack.push(dependent);
                }
            }
        }
        return component;
    }

    // O(V * (V + E)); fine for a single paper.
    private boolean isStronglyConnected(List<String> nodes) {
        if (nodes.size() <= 1) {
            return false;
        }
        Set<String> members = new HashSet<>(nodes);
        for (String start : nodes) {
            Set<String> reachable = new HashSet<>();
            Deque<String> queue = new ArrayDeque<>();
            reachable.add(start);
            queue.add(start);

            while (!queue.isEmpty()) {
                String current = queue.poll();
                for (String dependency : dependencyGraph.dependenciesOf(current)) {
                    if (members.contains(dependency) && reachable.add(dependency)) {
                        queue.add(dependency);
                    }
                }
            }
            if (reachable.size() != members.size()) {
                return false;
            }
        }
        return true;
    }
}
