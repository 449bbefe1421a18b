package uk.gegc.questionnaire.features.condition.domain.model;

import java.util.function.Function;

/**
 * Rule attached to a question that controls whether it is shown, based on
 * how earlier questions were answered.
 *
 * <p>A condition is either a {@link SimpleCondition} referencing one question's
 * selected option, or a {@link ComplexCondition} combining sub-conditions with
 * AND/OR. Recursive code dispatches through {@link #match} so that every site
 * handles both permitted kinds.
 */
public sealed interface DisplayCondition permits SimpleCondition, ComplexCondition {

    ConditionKind kind();

    <R> R match(Function<? super SimpleCondition, ? extends R> onSimple,
                Function<? super ComplexCondition, ? extends R> onComplex);
}
