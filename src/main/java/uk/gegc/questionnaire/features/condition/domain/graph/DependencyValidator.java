package uk.gegc.questionnaire.features.condition.domain.graph;

import uk.gegc.questionnaire.features.condition.domain.model.DisplayCondition;
import uk.gegc.questionnaire.features.condition.domain.model.QuestionSnapshot;

import java.util.List;

/**
 * Single entry point to display-condition dependency analysis for one question snapshot.
 *
 * <p>Everything is derived on construction from the snapshot, so an instance is cheap to
 * build per call. Instances are not meant to be shared between threads.
 */
public class DependencyValidator {

    private final DependencyGraphBuilder graphBuilder;
    private final CircularDependencyDetector circularDetector;
    private final ConditionRuleValidator conditionValidator;
    private final DependencyVisualizer visualizer;

    public DependencyValidator(List<QuestionSnapshot> questions) {
        this(questions, DependencyLimits.DEFAULT_MAX_CONDITION_DEPTH);
    }

    public DependencyValidator(List<QuestionSnapshot> questions, int maxConditionDepth) {
        this.graphBuilder = new DependencyGraphBuilder(questions);
        this.circularDetector = new CircularDependencyDetector(graphBuilder.getDependencyGraph());
        this.conditionValidator = new ConditionRuleValidator(graphBuilder.getQuestions(), maxConditionDepth);
        this.visualizer = new DependencyVisualizer(graphBuilder, circularDetector);
    }

    public List<String> detectCircularDependency(String startQuestionId) {
        return circularDetector.detectCircularDependency(startQuestionId);
    }

    public List<CircularDependency> detectAllCircularDependencies() {
        return circularDetector.detectAllCircularDependencies();
    }

    public ConditionValidationResult validateQuestionCondition(String questionId, DisplayCondition condition) {
        return conditionValidator.validateQuestionCondition(questionId, condition);
    }

    public DependencyAnalysis getQuestionDependencies(String questionId) {
        return graphBuilder.getQuestionDependencies(questionId);
    }

    public DependencyGraphData getDependencyGraphData() {
        return visualizer.getDependencyGraphData();
    }

    public String generateMermaidDiagram() {
        return visualizer.generateMermaidDiagram();
    }

    public String generateDotDiagram() {
        return visualizer.generateDotDiagram();
    }

    public DependencyReport getDependencyReport() {
        return visualizer.getDependencyReport();
    }

    public boolean hasMutualDependency(String firstQuestionId, String secondQuestionId) {
        return circularDetector.hasMutualDependency(firstQuestionId, secondQuestionId);
    }

    public boolean wouldCreateCycle(String fromQuestionId, String toQuestionId) {
        return circularDetector.wouldCreateCycle(fromQuestionId, toQuestionId);
    }

    public ConditionReferences validateConditionReferences(DisplayCondition condition) {
        return conditionValidator.validateConditionReferences(condition);
    }

    public ConditionReferences validateConditionReferences(DisplayCondition condition, String paperId) {
        return conditionValidator.validateConditionReferences(condition, paperId);
    }

    public int calculateConditionNestingLevel(DisplayCondition condition) {
        return conditionValidator.calculateConditionNestingLevel(condition);
    }

    public int calculateConditionComplexity(DisplayCondition condition) {
        return conditionValidator.calculateConditionComplexity(condition);
    }

    public DependencyGraph getDependencyGraph() {
        return graphBuilder.getDependencyGraph();
    }
}
