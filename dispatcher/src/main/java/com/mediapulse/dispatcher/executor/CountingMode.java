package com.mediapulse.dispatcher.executor;

/**
 * How {@link ResultAggregator} derives {@code downloadedCount}.
 */
public enum CountingMode {
    /** One per successful input item. */
    ITEM,
    /** Sum of identifiers carried by successful items. */
    IDENTIFIER
}
