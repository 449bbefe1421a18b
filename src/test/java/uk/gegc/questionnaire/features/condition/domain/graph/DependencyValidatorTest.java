package uk.gegc.questionnaire.features.condition.domain.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.questionnaire.features.condition.domain.model.ComplexCondition;
import uk.gegc.questionnaire.features.condition.domain.model.DisplayCondition;
import uk.gegc.questionnaire.features.condition.domain.model.QuestionSnapshot;
import uk.gegc.questionnaire.features.condition.domain.model.SimpleCondition;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DependencyValidator")
class DependencyValidatorTest {

    private static QuestionSnapshot question(String id, String title, DisplayCondition condition) {
        return new QuestionSnapshot(id, title, "paper-1", condition);
    }

    private static SimpleCondition on(String id) {
        return new SimpleCondition(id, "yes");
    }

    private final DependencyValidator validator = new DependencyValidator(List.of(
            question("q1", "Do you drive?", null),
            question("q2", "What car?", on("q1")),
            question("q3", "How often do you service it?", on("q2"))
    ));

    @Test
    @DisplayName("answers analysis queries for an acyclic paper")
    void acyclicPaper() {
        assertThat(validator.detectCircularDependency("q1")).isEmpty();
        assertThat(validator.detectAllCircularDependencies()).isEmpty();

        DependencyAnalysis analysis = validator.getQuestionDependencies("q3");
        assertThat(analysis.directDependencies()).containsExactly("q2");
        assertThat(analysis.indirectDependencies()).containsExactly("q1");
        assertThat(analysis.totalDependencies()).isEqualTo(2);
    }

    @Test
    @DisplayName("validating a cycle-closing condition leaves the snapshot untouched")
    void validation_doesNotMutate() {
        ConditionValidationResult result = validator.validateQuestionCondition("q1", on("q3"));

        assertThat(result.valid()).isFalse();
        assertThat(validator.detectCircularDependency("q1")).isEmpty();
        assertThat(validator.getDependencyGraph().dependenciesOf("q1")).isEmpty();
        assertThat(validator.getDependencyGraphData().statistics().circularDependencies()).isZero();
    }

    @Test
    @DisplayName("speculative edge checks do not change later answers")
    void edgeCheck_doesNotMutate() {
        assertThat(validator.wouldCreateCycle("q1", "q3")).isTrue();
        assertThat(validator.wouldCreateCycle("q1", "q3")).isTrue();
        assertThat(validator.hasMutualDependency("q1", "q3")).isFalse();
        assertThat(validator.detectAllCircularDependencies()).isEmpty();
    }

    private static DisplayCondition nestedOr(int depth) {
        DisplayCondition condition = on("q1");
        for (int i = 0; i < depth; i++) {
            condition = ComplexCondition.or(condition, on("q1"));
        }
        return condition;
    }

    @Test
    @DisplayName("rejects a very deeply nested condition without overflowing the stack")
    void veryDeepCondition_isRejected() {
        ConditionValidationResult result = validator.validateQuestionCondition("q3", nestedOr(20_000));

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).containsExactly(
                "Condition nesting (19999 levels) exceeds the maximum depth of "
                        + DependencyLimits.DEFAULT_MAX_CONDITION_DEPTH);
    }

    @Test
    @DisplayName("analyses a snapshot that already holds a very deep condition")
    void veryDeepStoredCondition_isAnalysed() {
        DependencyValidator deep = new DependencyValidator(List.of(
                question("q1", "Do you drive?", null),
                question("q2", "What car?", nestedOr(20_000))
        ));

        assertThat(deep.getDependencyGraph().dependenciesOf("q2")).containsExactly("q1");
        assertThat(deep.calculateConditionNestingLevel(nestedOr(20_000))).isEqualTo(19_999);
        assertThat(deep.getDependencyGraphData().nodes()).hasSize(2);
        assertThat(deep.getDependencyReport().complexityAnalysis().highComplexityQuestions()).hasSize(1);
        assertThat(deep.generateMermaidDiagram()).contains("q2 --> q1");
    }

    @Test
    @DisplayName("reports missing references and measures conditions")
    void referencesAndMetrics() {
        DisplayCondition condition = ComplexCondition.and(on("q1"), ComplexCondition.or(on("ghost"), on("q2")));

        assertThat(validator.validateConditionReferences(condition).missingQuestions()).containsExactly("ghost");
        assertThat(validator.validateConditionReferences(condition, "paper-1").crossPaperReferences()).isEmpty();
        assertThat(validator.calculateConditionNestingLevel(condition)).isEqualTo(1);
        assertThat(validator.calculateConditionComplexity(condition)).isEqualTo(10);
    }

    @Test
    @DisplayName("renders diagrams and a report")
    void presentation() {
        assertThat(validator.generateMermaidDiagram()).startsWith("graph TD");
        assertThat(validator.generateDotDiagram()).startsWith("digraph DependencyGraph {");
        assertThat(validator.getDependencyReport().summary().questionsWithConditions()).isEqualTo(2);
    }

    @Test
    @DisplayName("handles an empty paper")
    void emptyPaper() {
        DependencyValidator empty = new DependencyValidator(List.of());

        assertThat(empty.detectAllCircularDependencies()).isEmpty();
        assertThat(empty.getDependencyGraphData().nodes()).isEmpty();
        assertThat(empty.getDependencyGraphData().statistics().avgComplexity()).isZero();
        assertThat(empty.getDependencyReport().recommendations())
                .containsExactly("Dependency structure is healthy, no changes needed");
    }
}
