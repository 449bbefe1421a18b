package uk.gegc.questionnaire.features.condition.domain.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * Visible only when question {@code questionId} was answered with {@code selectedOption}.
 */
public record SimpleCondition(String questionId, String selectedOption) implements DisplayCondition {

    public SimpleCondition {
        Objects.requireNonNull(questionId, "questionId must not be null");
    }

    @Override
    public ConditionKind kind() {
        return ConditionKind.SIMPLE;
    }

    @Override
    public <R> R match(Function<? super SimpleCondition, ? extends R> onSimple,
                       Function<? super ComplexCondition, ? extends R> onComplex) {
        return onSimple.apply(this);
    }
}
