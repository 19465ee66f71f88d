package com.mediapulse.dispatcher.executor;

import com.mediapulse.dispatcher.recorder.RecordingSession;

import java.util.List;

/**
 * The two per-item steps of a URL-driven action. Any exception thrown by
 * either step is isolated to the item by {@link BatchExecutor}.
 */
public interface ItemPipeline {

    /**
     * @return identifiers found in the input; an empty list fails the item
     */
    List<String> extract(String input) throws Exception;

    /**
     * Fetches content for the identifiers extracted from {@code input}.
     *
     * @return number of records fetched
     */
    int fetch(String input, List<String> ids, RecordingSession session) throws Exception;
}
