package com.mediapulse.dispatcher.action;

/**
 * How long a recording session stays open for an action.
 */
public enum SessionScope {
    /** One session for the whole call. */
    INVOCATION,
    /** A fresh session around each input item. */
    PER_ITEM,
    /** No session is opened. */
    NONE
}
