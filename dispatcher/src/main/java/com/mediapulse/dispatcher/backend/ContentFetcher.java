package com.mediapulse.dispatcher.backend;

import com.mediapulse.dispatcher.model.FetchedItem;
import com.mediapulse.dispatcher.recorder.RecordingSession;

import java.util.List;

/**
 * Fetches (and, depending on options, downloads) content for identifiers.
 * Retry and backoff are owned by the implementation.
 */
public interface ContentFetcher {

    /**
     * @param session open recording session the implementation may write fetched
     *                records to; never null
     * @return fetched records in backend order, possibly empty
     */
    List<FetchedItem> fetchBatch(FetchOperation operation, FetchQuery query, RecordingSession session)
            throws FetchException;
}
