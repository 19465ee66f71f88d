package com.mediapulse.dispatcher.backend;

/**
 * The backend failed to fetch content for a set of identifiers.
 */
public class FetchException extends Exception {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
