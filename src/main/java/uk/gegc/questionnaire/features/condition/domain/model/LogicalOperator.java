package uk.gegc.questionnaire.features.condition.domain.model;

import java.util.Arrays;
import java.util.Optional;

public enum LogicalOperator {
    AND,
    OR;

    /**
     * Case-sensitive lookup, matching the stored representation.
     */
    public static Optional<LogicalOperator> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(op -> op.name().equals(value))
                .findFirst();
    }
}
