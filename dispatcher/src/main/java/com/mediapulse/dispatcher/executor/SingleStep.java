package com.mediapulse.dispatcher.executor;

import com.mediapulse.dispatcher.model.FetchedItem;
import com.mediapulse.dispatcher.recorder.RecordingSession;

import java.util.List;

/**
 * A fetch with no per-URL extraction, used by keyword and hot-list style
 * actions.
 */
@FunctionalInterface
public interface SingleStep {

    List<FetchedItem> run(RecordingSession session) throws Exception;
}
