package uk.gegc.questionnaire.features.condition.application;

import java.util.Locale;

public enum DiagramFormat {
    MERMAID,
    DOT;

    public static DiagramFormat parse(String value) {
        if (value == null || value.isBlank()) {
            return MERMAID;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported diagram format '" + value + "', use mermaid or dot", e);
        }
    }
}
