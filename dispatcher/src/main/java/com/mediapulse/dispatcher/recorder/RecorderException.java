package com.mediapulse.dispatcher.recorder;

/**
 * A recording session could not be opened or flushed. Fatal to the call when
 * raised on acquisition.
 */
public class RecorderException extends Exception {

    public RecorderException(String message) {
        super(message);
    }

    public RecorderException(String message, Throwable cause) {
        super(message, cause);
    }
}
