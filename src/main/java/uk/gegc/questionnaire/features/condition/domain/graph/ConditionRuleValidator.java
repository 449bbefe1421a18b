package uk.gegc.questionnaire.features.condition.domain.graph;

import uk.gegc.questionnaire.features.condition.domain.model.ComplexCondition;
import uk.gegc.questionnaire.features.condition.domain.model.DisplayCondition;
import uk.gegc.questionnaire.features.condition.domain.model.QuestionSnapshot;
import uk.gegc.questionnaire.features.condition.domain.model.SimpleCondition;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Validates the structure of display conditions against a question snapshot and
 * checks that a candidate condition would not introduce a cycle.
 *
 * <p>Rules, per node:
 * <ul>
 *   <li>Simple: referenced question exists, belongs to the same paper, option is not blank (warning)</li>
 *   <li>Complex: operator is AND or OR, at least one sub-condition, ideally 2 to 10 (warnings)</li>
 *   <li>Nested complex: nesting level and complexity thresholds (warnings)</li>
 * </ul>
 * Invalid input is reported in the returned result, never thrown.
 */
public class ConditionRuleValidator {

    public static final String CIRCULAR_DEPENDENCY_ERROR = "Would create a circular dependency: ";

    private final Map<String, QuestionSnapshot> questions;
    private final int maxConditionDepth;

    public ConditionRuleValidator(Map<String, QuestionSnapshot> questions, int maxConditionDepth) {
        this.questions = Objects.requireNonNull(questions, "questions must not be null");
        if (maxConditionDepth < 1) {
            throw new IllegalArgumentException("maxConditionDepth must be positive");
        }
        this.maxConditionDepth = maxConditionDepth;
    }

    /**
     * Validates {@code condition} as the display condition of {@code questionId}.
     * The cycle check installs the candidate on a copy of the snapshot, the snapshot
     * held by this validator is not changed.
     */
    public ConditionValidationResult validateQuestionCondition(String questionId, DisplayCondition condition) {
        if (condition == null) {
            return ConditionValidationResult.success();
        }

        QuestionSnapshot question = questions.get(questionId);
        if (question == null) {
            return ConditionValidationResult.of(List.of("Question does not exist: " + questionId), List.of());
        }
        int nesting = ConditionMetrics.nestingLevel(condition);
        if (nesting > maxConditionDepth) {
            return ConditionValidationResult.of(List.of("Condition nesting (" + nesting
                    + " levels) exceeds the maximum depth of " + maxConditionDepth), List.of());
        }

        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        validateNode(condition, question.paperId(), 0, errors, warnings);

        List<QuestionSnapshot> candidateSnapshot = questions.values().stream()
                .map(q -> q.id().equals(questionId) ? q.withDisplayCondition(condition) : q)
                .toList();
        CircularDependencyDetector candidateDetector =
                new CircularDependencyDetector(new DependencyGraphBuilder(candidateSnapshot).getDependencyGraph());
        List<String> cycle = candidateDetector.detectCircularDependency(questionId);
        if (!cycle.isEmpty()) {
            errors.add(CIRCULAR_DEPENDENCY_ERROR + String.join(" -> ", candidateDetector.titlesOf(cycle)));
        }

        return ConditionValidationResult.of(errors, warnings);
    }

    private void validateNode(DisplayCondition condition, String paperId, int level,
                              List<String> errors, List<String> warnings) {
        condition.match(
                simple -> {
                    validateSimple(simple, paperId, errors, warnings);
                    return null;
                },
                complex -> {
                    validateComplex(complex, paperId, level, errors, warnings);
                    return null;
                }
        );
    }

    private void validateSimple(SimpleCondition condition, String paperId,
                                List<String> errors, List<String> warnings) {
        QuestionSnapshot referenced = questions.get(condition.questionId());
        if (referenced == null) {
            errors.add("Referenced question does not exist: " + condition.questionId());
            return;
        }
        if (!Objects.equals(referenced.paperId(), paperId)) {
            errors.add("Cannot depend on a question from another paper: " + referenced.title());
            return;
        }
        if (condition.selectedOption() == null || condition.selectedOption().isBlank()) {
            warnings.add("Selected option for question \"" + referenced.title() + "\" is empty");
        }
    }

    private void validateComplex(ComplexCondition condition, String paperId, int level,
                                 List<String> errors, List<String> warnings) {
        String prefix = level > 0 ? "Nested condition (level " + level + "): " : "";

        if (condition.logicalOperator().isEmpty()) {
            errors.add(prefix + "Invalid logical operator " + describeOperator(condition.operator())
                    + ", only AND and OR are supported");
            return;
        }
        int size = condition.conditions().size();
        if (size == 0) {
            errors.add(prefix + "Complex condition must contain at least one sub-condition");
            return;
        }
        if (size < DependencyLimits.MIN_SUB_CONDITIONS) {
            warnings.add(prefix + condition.operator() + " logic should combine at least "
                    + DependencyLimits.MIN_SUB_CONDITIONS + " conditions, found " + size);
        }
        if (size > DependencyLimits.MAX_SUB_CONDITIONS) {
            warnings.add(prefix + condition.operator() + " logic combines too many conditions ("
                    + size + "), which hurts maintainability");
        }

        if (level > 0) {
            if (level > DependencyLimits.MAX_RECOMMENDED_NESTING_LEVEL) {
                warnings.add(prefix + "nesting is too deep (" + level + " levels), consider simplifying the logic");
            }
            int complexity = ConditionMetrics.complexity(condition);
            if (complexity > DependencyLimits.MAX_NESTED_COMPLEXITY) {
                warnings.add(prefix + "complexity is too high (" + complexity + "), which hurts maintainability");
            }
        }

        for (DisplayCondition sub : condition.conditions()) {
            validateNode(sub, paperId, level + 1, errors, warnings);
        }
    }

    private static String describeOperator(String operator) {
        return operator == null || operator.isBlank() ? "(missing)" : "'" + operator + "'";
    }

    public ConditionReferences validateConditionReferences(DisplayCondition condition) {
        return validateConditionReferences(condition, null);
    }

    /**
     * Lists references to questions that do not exist and, when {@code paperId} is given,
     * references to questions of another paper.
     */
    public ConditionReferences validateConditionReferences(DisplayCondition condition, String paperId) {
        if (condition == null) {
            return new ConditionReferences(List.of(), List.of());
        }
        Set<String> missing = new LinkedHashSet<>();
        Set<String> crossPaper = new LinkedHashSet<>();
        collectReferences(condition, paperId, 0, missing, crossPaper);
        return new ConditionReferences(List.copyOf(missing), List.copyOf(crossPaper));
    }

    private void collectReferences(DisplayCondition condition, String paperId, int level,
                                   Set<String> missing, Set<String> crossPaper) {
        if (level > maxConditionDepth) {
            return;
        }
        condition.match(
                simple -> {
                    QuestionSnapshot referenced = questions.get(simple.questionId());
                    if (referenced == null) {
                        missing.add(simple.questionId());
                    } else if (paperId != null && !paperId.equals(referenced.paperId())) {
                        crossPaper.add(simple.questionId());
                    }
                    return null;
                },
                complex -> {
                    complex.conditions().forEach(sub -> collectReferences(sub, paperId, level + 1, missing, crossPaper));
                    return null;
                }
        );
    }

    public int calculateConditionComplexity(DisplayCondition condition) {
        return ConditionMetrics.complexity(condition);
    }

    public int calculateConditionNestingLevel(DisplayCondition condition) {
        return ConditionMetrics.nestingLevel(condition);
    }
}
