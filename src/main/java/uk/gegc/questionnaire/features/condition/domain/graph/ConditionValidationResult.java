package uk.gegc.questionnaire.features.condition.domain.graph;

import java.util.List;

/**
 * Outcome of validating one display condition. Errors always block a save,
 * warnings are left to the caller.
 */
public record ConditionValidationResult(boolean valid, List<String> errors, List<String> warnings) {

    public ConditionValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static ConditionValidationResult success() {
        return new ConditionValidationResult(true, List.of(), List.of());
    }

    public static ConditionValidationResult of(List<String> errors, List<String> warnings) {
        return new ConditionValidationResult(errors.isEmpty(), errors, warnings);
    }
}
