package com.mediapulse.dispatcher.model;

/**
 * Thrown by the normalizer and option parser; the dispatcher converts it into a
 * failed {@link BatchResult} carrying {@link #getMessage()}.
 */
public class ValidationException extends Exception {

    private final ValidationError error;

    public ValidationException(ValidationError error) {
        super(error.message());
        this.error = error;
    }

    public ValidationException(ValidationError.Kind kind, String message) {
        this(new ValidationError(kind, message));
    }

    public ValidationError getError() {
        return error;
    }
}
