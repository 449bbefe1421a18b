package uk.gegc.questionnaire.features.condition.domain.exception;

/**
 * Thrown when a display condition payload does not have the shape of a simple or
 * complex condition and cannot be read at all.
 */
public class InvalidConditionException extends RuntimeException {

    public InvalidConditionException(String message) {
        super(message);
    }

    public InvalidConditionException(String message, Throwable cause) {
        super(message, cause);
    }
}
