package uk.gegc.questionnaire.features.condition.domain.model;

public enum ConditionKind {
    SIMPLE,
    COMPLEX,
    NONE;

    public static ConditionKind of(DisplayCondition condition) {
        return condition == null ? NONE : condition.kind();
    }
}
