package uk.gegc.questionnaire.features.condition.domain.model;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * AND/OR combinator over an ordered list of sub-conditions.
 *
 * <p>The operator is kept exactly as supplied so that an unsupported value can be
 * reported by the validator instead of failing while the condition is read.
 */
public record ComplexCondition(String operator, List<DisplayCondition> conditions) implements DisplayCondition {

    public ComplexCondition {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public static ComplexCondition and(DisplayCondition... conditions) {
        return new ComplexCondition(LogicalOperator.AND.name(), List.of(conditions));
    }

    public static ComplexCondition or(DisplayCondition... conditions) {
        return new ComplexCondition(LogicalOperator.OR.name(), List.of(conditions));
    }

    public Optional<LogicalOperator> logicalOperator() {
        return LogicalOperator.parse(operator);
    }

    @Override
    public ConditionKind kind() {
        return ConditionKind.COMPLEX;
    }

    @Override
    public <R> R match(Function<? super SimpleCondition, ? extends R> onSimple,
                       Function<? super ComplexCondition, ? extends R> onComplex) {
        return onComplex.apply(this);
    }
}
