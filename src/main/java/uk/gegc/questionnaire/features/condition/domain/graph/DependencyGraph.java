package uk.gegc.questionnaire.features.condition.domain.graph;

import uk.gegc.questionnaire.features.condition.domain.model.QuestionSnapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Question dependency graph: an edge from {@code q} to {@code d} means q's visibility
 * depends on how d was answered.
 *
 * <p>Instances are immutable. Speculative edits go through {@link #withEdge}, which
 * returns a copy sharing every untouched edge list, so a check can never leave the
 * source graph in a modified state.
 */
public final class DependencyGraph {

    private final Map<String, QuestionSnapshot> questions;
    private final Map<String, List<String>> edges;

    DependencyGraph(Map<String, QuestionSnapshot> questions, Map<String, List<String>> edges) {
        this.questions = Collections.unmodifiableMap(questions);
        this.edges = Collections.unmodifiableMap(edges);
    }

    public List<String> dependenciesOf(String questionId) {
        return edges.getOrDefault(questionId, List.of());
    }

    public boolean containsQuestion(String questionId) {
        return questions.containsKey(questionId);
    }

    public QuestionSnapshot question(String questionId) {
        return questions.get(questionId);
    }

    /**
     * Questions in snapshot order.
     */
    public Map<String, QuestionSnapshot> questions() {
        return questions;
    }

    /**
     * Edge lists keyed by question id, in snapshot order.
     */
    public Map<String, List<String>> edges() {
        return edges;
    }

    public Set<String> questionIds() {
        return questions.keySet();
    }

    public int edgeCount() {
        return edges.values().stream().mapToInt(List::size).sum();
    }

    /**
     * Returns a graph identical to this one plus the edge {@code from -> to}.
     */
    public DependencyGraph withEdge(String from, String to) {
        Map<String, List<String>> overlay = new LinkedHashMap<>(edges);
        List<String> extended = new ArrayList<>(dependenciesOf(from));
        extended.add(to);
        overlay.put(from, Collections.unmodifiableList(extended));
        return new DependencyGraph(questions, overlay);
    }
}
