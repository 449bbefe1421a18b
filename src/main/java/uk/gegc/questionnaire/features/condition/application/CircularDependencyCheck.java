package uk.gegc.questionnaire.features.condition.application;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Result of checking one proposed display condition for circular dependencies.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CircularDependencyCheck(boolean hasCircularDependency, List<String> cyclePath, String errorMessage) {

    public static CircularDependencyCheck none() {
        return new CircularDependencyCheck(false, List.of(), null);
    }

    public static CircularDependencyCheck cycle(List<String> cyclePath) {
        return new CircularDependencyCheck(true, List.copyOf(cyclePath),
                "Circular dependency detected: " + String.join(" -> ", cyclePath));
    }
}
