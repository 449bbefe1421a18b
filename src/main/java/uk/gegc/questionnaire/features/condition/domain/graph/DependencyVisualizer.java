package uk.gegc.questionnaire.features.condition.domain.graph;

import uk.gegc.questionnaire.features.condition.domain.graph.DependencyGraphData.GraphEdge;
import uk.gegc.questionnaire.features.condition.domain.graph.DependencyGraphData.GraphNode;
import uk.gegc.questionnaire.features.condition.domain.graph.DependencyGraphData.Statistics;
import uk.gegc.questionnaire.features.condition.domain.graph.DependencyReport.ComplexityAnalysis;
import uk.gegc.questionnaire.features.condition.domain.graph.DependencyReport.HighComplexityQuestion;
import uk.gegc.questionnaire.features.condition.domain.graph.DependencyReport.Summary;
import uk.gegc.questionnaire.features.condition.domain.model.ConditionKind;
import uk.gegc.questionnaire.features.condition.domain.model.QuestionSnapshot;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns graph and cycle analysis into presentation data, diagrams and a
 * plain-language report.
 */
public class DependencyVisualizer {

    private static final int MERMAID_TITLE_LIMIT = 15;
    private static final int DOT_TITLE_LIMIT = 20;
    private static final int HIGH_COMPLEXITY_THRESHOLD = 10;
    private static final int HIGH_COMPLEXITY_LIMIT = 5;
    private static final int COMPLEXITY_RECOMMENDATION_THRESHOLD = 20;
    private static final int NESTING_RECOMMENDATION_THRESHOLD = 3;
    private static final double ISOLATED_RATIO_THRESHOLD = 0.3;

    private final DependencyGraphBuilder graphBuilder;
    private final CircularDependencyDetector detector;

    public DependencyVisualizer(DependencyGraphBuilder graphBuilder, CircularDependencyDetector detector) {
        this.graphBuilder = graphBuilder;
        this.detector = detector;
    }

    public DependencyGraphData getDependencyGraphData() {
        DependencyGraph graph = graphBuilder.getDependencyGraph();

        Map<String, List<String>> incoming = new HashMap<>();
        graph.edges().forEach((questionId, dependencies) ->
                dependencies.forEach(dep -> incoming.computeIfAbsent(dep, k -> new ArrayList<>()).add(questionId)));

        List<DependencyCluster> clusters = graphBuilder.detectClusters();
        Map<String, Integer> clusterOf = new HashMap<>();
        clusters.forEach(cluster -> cluster.nodes().forEach(id -> clusterOf.put(id, cluster.id())));

        List<GraphNode> nodes = new ArrayList<>();
        int position = 0;
        for (QuestionSnapshot question : graph.questions().values()) {
            nodes.add(new GraphNode(
                    question.id(),
                    question.title(),
                    graph.dependenciesOf(question.id()),
                    List.copyOf(incoming.getOrDefault(question.id(), List.of())),
                    position++,
                    ConditionMetrics.complexity(question.displayCondition()),
                    ConditionMetrics.nestingLevel(question.displayCondition()),
                    question.hasCondition(),
                    ConditionKind.of(question.displayCondition()),
                    clusterOf.get(question.id())
            ));
        }

        List<GraphEdge> edges = new ArrayList<>();
        for (GraphNode node : nodes) {
            ConditionKind edgeType = node.conditionType() == ConditionKind.COMPLEX
                    ? ConditionKind.COMPLEX
                    : ConditionKind.SIMPLE;
            node.dependencies().forEach(dep -> edges.add(new GraphEdge(node.id(), dep, edgeType)));
        }

        List<CircularDependency> cycles = detector.detectAllCircularDependencies();

        Statistics statistics = new Statistics(
                nodes.size(),
                (int) nodes.stream().filter(GraphNode::hasCondition).count(),
                edges.size(),
                cycles.size(),
                nodes.stream().mapToInt(GraphNode::nestingLevel).max().orElse(0),
                nodes.isEmpty() ? 0 : roundTwoDecimals(nodes.stream().mapToInt(GraphNode::complexityScore).average().orElse(0))
        );

        return new DependencyGraphData(List.copyOf(nodes), List.copyOf(edges), clusters, statistics);
    }

    /**
     * Renders the graph as a Mermaid flowchart. Edges point from a question to the
     * questions it depends on.
     */
    public String generateMermaidDiagram() {
        DependencyGraph graph = graphBuilder.getDependencyGraph();
        List<CircularDependency> cycles = detector.detectAllCircularDependencies();
        Set<String> cycleNodes = nodesInCycles(cycles);

        Map<String, String> nodeIds = mermaidIds(graph.questions().keySet());

        StringBuilder mermaid = new StringBuilder("graph TD\n");
        List<String> conditionNodes = new ArrayList<>();

        for (QuestionSnapshot question : graph.questions().values()) {
            String nodeId = nodeIds.get(question.id());
            String label = escapeMermaid(truncate(question.title(), MERMAID_TITLE_LIMIT));
            if (question.hasCondition()) {
                mermaid.append("  ").append(nodeId).append("([\"").append(label).append("\"])\n");
                conditionNodes.add(nodeId);
            } else {
                mermaid.append("  ").append(nodeId).append("[\"").append(label).append("\"]\n");
            }
        }

        graph.edges().forEach((questionId, dependencies) -> {
            for (String dependencyId : dependencies) {
                if (graph.containsQuestion(dependencyId)) {
                    mermaid.append("  ").append(nodeIds.get(questionId))
                            .append(" --> ").append(nodeIds.get(dependencyId)).append('\n');
                }
            }
        });

        if (!cycles.isEmpty()) {
            mermaid.append("\n  %% Circular dependencies\n");
            for (CircularDependency cycle : cycles) {
                mermaid.append("  %% Cycle: ").append(String.join(" -> ", cycle.cycle())).append('\n');
            }
        }

        mermaid.append("\n  classDef conditionNode fill:#e1f5fe,stroke:#0277bd,stroke-width:2px\n");
        mermaid.append("  classDef cycleNode fill:#ffebee,stroke:#c62828,stroke-width:3px\n");
        if (!conditionNodes.isEmpty()) {
            mermaid.append("  class ").append(String.join(",", conditionNodes)).append(" conditionNode\n");
        }
        if (!cycleNodes.isEmpty()) {
            String ids = cycleNodes.stream().map(nodeIds::get).collect(Collectors.joining(","));
            mermaid.append("  class ").append(ids).append(" cycleNode\n");
        }
        return mermaid.toString();
    }

    /**
     * Renders the graph in Graphviz DOT syntax.
     */
    public String generateDotDiagram() {
        DependencyGraph graph = graphBuilder.getDependencyGraph();
        List<CircularDependency> cycles = detector.detectAllCircularDependencies();
        Set<String> cycleNodes = nodesInCycles(cycles);

        StringBuilder dot = new StringBuilder("digraph DependencyGraph {\n");
        dot.append("  rankdir=TB;\n");
        dot.append("  node [shape=box, style=rounded];\n\n");

        for (QuestionSnapshot question : graph.questions().values()) {
            StringBuilder attrs = new StringBuilder("label=\"")
                    .append(escapeDot(truncate(question.title(), DOT_TITLE_LIMIT)))
                    .append('"');
            if (cycleNodes.contains(question.id())) {
                attrs.append(", fillcolor=\"#ffebee\", style=\"filled,rounded\"");
            } else if (question.hasCondition()) {
                attrs.append(", fillcolor=\"#e1f5fe\", style=\"filled,rounded\"");
            }
            dot.append("  \"").append(escapeDot(question.id())).append("\" [").append(attrs).append("];\n");
        }

        dot.append('\n');
        graph.edges().forEach((questionId, dependencies) -> {
            for (String dependencyId : dependencies) {
                if (graph.containsQuestion(dependencyId)) {
                    dot.append("  \"").append(escapeDot(questionId)).append("\" -> \"")
                            .append(escapeDot(dependencyId)).append("\";\n");
                }
            }
        });

        if (!cycles.isEmpty()) {
            dot.append("\n  // Circular dependencies\n");
            for (CircularDependency cycle : cycles) {
                dot.append("  // Cycle: ").append(String.join(" -> ", cycle.cycle())).append('\n');
            }
        }

        dot.append("}\n");
        return dot.toString();
    }

    public DependencyReport getDependencyReport() {
        DependencyGraphData data = getDependencyGraphData();
        List<CircularDependency> cycles = detector.detectAllCircularDependencies();
        List<GraphNode> nodes = data.nodes();

        int simpleConditions = countKind(nodes, ConditionKind.SIMPLE);
        int complexConditions = countKind(nodes, ConditionKind.COMPLEX);
        int nestedConditions = (int) nodes.stream().filter(n -> n.nestingLevel() > 0).count();
        int isolatedQuestions = (int) nodes.stream()
                .filter(n -> n.dependencies().isEmpty() && n.incomingDependencies().isEmpty())
                .count();

        List<Integer> complexities = nodes.stream()
                .map(GraphNode::complexityScore)
                .filter(score -> score > 0)
                .toList();
        int maxComplexity = complexities.stream().mapToInt(Integer::intValue).max().orElse(0);
        double averageComplexity = complexities.isEmpty()
                ? 0
                : roundTwoDecimals(complexities.stream().mapToInt(Integer::intValue).average().orElse(0));

        List<HighComplexityQuestion> highComplexity = nodes.stream()
                .filter(n -> n.complexityScore() > HIGH_COMPLEXITY_THRESHOLD)
                .sorted(Comparator.comparingInt(GraphNode::complexityScore).reversed())
                .limit(HIGH_COMPLEXITY_LIMIT)
                .map(n -> new HighComplexityQuestion(n.id(), n.title(), n.complexityScore(), n.nestingLevel()))
                .toList();

        int maxNesting = data.statistics().maxNestingLevel();
        List<String> recommendations = new ArrayList<>();
        if (!cycles.isEmpty()) {
            recommendations.add("Found " + cycles.size()
                    + " circular dependencies, fix them immediately to avoid undecidable display logic");
        }
        if (maxComplexity > COMPLEXITY_RECOMMENDATION_THRESHOLD) {
            recommendations.add("Some display conditions are highly complex, simplify or split them");
        }
        if (maxNesting > NESTING_RECOMMENDATION_THRESHOLD) {
            recommendations.add("Display conditions are nested too deeply, reduce nesting to keep them readable");
        }
        if (isolatedQuestions > nodes.size() * ISOLATED_RATIO_THRESHOLD) {
            recommendations.add("Many questions are unrelated to the others, consider adding display conditions where appropriate");
        }
        if (recommendations.isEmpty()) {
            recommendations.add("Dependency structure is healthy, no changes needed");
        }

        Summary summary = new Summary(
                data.statistics().totalQuestions(),
                data.statistics().questionsWithConditions(),
                simpleConditions,
                complexConditions,
                nestedConditions,
                data.statistics().circularDependencies(),
                isolatedQuestions
        );
        ComplexityAnalysis complexityAnalysis =
                new ComplexityAnalysis(averageComplexity, maxComplexity, maxNesting, highComplexity);

        return new DependencyReport(summary, complexityAnalysis, cycles, List.copyOf(recommendations));
    }

    private static int countKind(List<GraphNode> nodes, ConditionKind kind) {
        return (int) nodes.stream().filter(n -> n.conditionType() == kind).count();
    }

    private static Set<String> nodesInCycles(List<CircularDependency> cycles) {
        Set<String> nodes = new LinkedHashSet<>();
        cycles.forEach(cycle -> nodes.addAll(cycle.cycle()));
        return nodes;
    }

    private static double roundTwoDecimals(double value) {
        return Math.round(value * 100) / 100.0;
    }

    static String truncate(String title, int limit) {
        return title.length() > limit ? title.substring(0, limit) + "..." : title;
    }

    /**
     * Assigns every question a Mermaid-safe node id, in snapshot order. Sanitising can map two
     * question ids onto the same text, so later collisions get a numeric suffix ({@code q_1_2}).
     */
    static Map<String, String> mermaidIds(Collection<String> questionIds) {
        Map<String, String> ids = new LinkedHashMap<>();
        Set<String> taken = new HashSet<>();
        for (String questionId : questionIds) {
            String base = questionId.replaceAll("[^A-Za-z0-9_]", "_");
            String candidate = base;
            for (int suffix = 2; !taken.add(candidate); suffix++) {
                candidate = base + "_" + suffix;
            }
            ids.put(questionId, candidate);
        }
        return ids;
    }

    private static String escapeMermaid(String text) {
        return text.replace("\"", "#quot;");
    }

    private static String escapeDot(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
