package com.mediapulse.dispatcher.model;

/**
 * A precondition failure detected before any batch work starts. Always fatal
 * to the call.
 */
public record ValidationError(Kind kind, String message) {

    public enum Kind {
        UNKNOWN_ACTION,
        MISSING_REQUIRED_INPUT,
        PLATFORM_UNSUPPORTED,
        EMPTY_INPUT,
        EMPTY_KEYWORD,
        INVALID_INPUT_TYPE,
        INVALID_OPTION,
        MISSING_CREDENTIAL
    }
}
