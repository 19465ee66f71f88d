package com.mediapulse.dispatcher.backend;

/**
 * A link did not match any recognized pattern or the extractor could not be
 * reached. Always isolated to the item being processed.
 */
public class ExtractionException extends Exception {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
