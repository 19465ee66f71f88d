package com.mediapulse.dispatcher.recorder;

import com.mediapulse.dispatcher.backend.FetchOperation;
import com.mediapulse.dispatcher.model.FetchedItem;
import com.mediapulse.dispatcher.model.ItemOutcome;

import java.util.List;

/**
 * Sink for the bookkeeping of one action invocation (or one item, for
 * per-item scoped actions).
 */
public interface RecordingSession extends AutoCloseable {

    /**
     * Session that discards everything. Used when no storage format is set and
     * for actions that keep no records.
     */
    RecordingSession NONE = new RecordingSession() {
        @Override
        public void record(ItemOutcome outcome) {
        }

        @Override
        public void recordFetched(FetchOperation operation, List<FetchedItem> items) {
        }

        @Override
        public void close() {
        }
    };

    void record(ItemOutcome outcome);

    void recordFetched(FetchOperation operation, List<FetchedItem> items);

    @Override
    void close() throws RecorderException;
}
