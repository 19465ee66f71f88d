package com.mediapulse.dispatcher.action;

/**
 * Which input an action consumes.
 */
public enum InputKind {
    /** The {@code urls} option: a string or a list of strings. */
    URLS,
    /** The {@code search_keyword} option. */
    KEYWORD,
    /** Nothing; the action works on the account behind the credential. */
    NONE
}
