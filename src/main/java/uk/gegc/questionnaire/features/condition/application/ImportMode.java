package uk.gegc.questionnaire.features.condition.application;

import java.util.Locale;

/**
 * How imported condition logic is applied to a paper.
 */
public enum ImportMode {
    /** Only the imported questions change, every other condition is kept. */
    MERGE,
    /** Conditions of questions missing from the import are cleared. */
    REPLACE;

    public static ImportMode parse(String value) {
        if (value == null || value.isBlank()) {
            return MERGE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported import mode '" + value + "', use merge or replace", e);
        }
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
