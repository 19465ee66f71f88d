package com.mediapulse.dispatcher.executor;

import com.mediapulse.dispatcher.model.FetchedItem;
import com.mediapulse.dispatcher.model.ItemOutcome;
import com.mediapulse.dispatcher.recorder.RecorderException;
import com.mediapulse.dispatcher.recorder.RecordingSession;
import com.mediapulse.dispatcher.recorder.ScopedRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs inputs through an {@link ItemPipeline} one at a time, in input order.
 * A failing item becomes a failed {@link ItemOutcome} and the loop moves on;
 * only a recording session that cannot be opened stops the batch.
 */
public class BatchExecutor {

    private static final Logger logger = LoggerFactory.getLogger(BatchExecutor.class);

    static final String NO_IDENTIFIERS = "no identifiers extracted";
    static final String NO_RESULTS = "no results returned";
    static final String NULL_IDENTIFIER = "extractor returned a null identifier";

    /**
     * Processes every item inside one shared session.
     */
    public List<ItemOutcome> runBatch(List<String> items, ItemPipeline pipeline, RecordingSession session) {
        List<ItemOutcome> outcomes = new ArrayList<>(items.size());
        for (String item : items) {
            outcomes.add(runItem(item, pipeline, session));
        }
        logCompletion(outcomes);
        return outcomes;
    }

    /**
     * Processes every item inside its own session, opened and released around
     * that item.
     *
     * @throws RecorderException if a session cannot be opened; outcomes gathered
     *                           so far are discarded with the batch
     */
    public List<ItemOutcome> runBatchWithSessionPerItem(List<String> items, ItemPipeline pipeline,
                                                       ScopedRecorder recorder) throws Exception {
        List<ItemOutcome> outcomes = new ArrayList<>(items.size());
        for (String item : items) {
            outcomes.add(recorder.withSession(session -> runItem(item, pipeline, session)));
        }
        logCompletion(outcomes);
        return outcomes;
    }

    /**
     * Resolves a single input. Never throws.
     */
    public ItemOutcome runItem(String input, ItemPipeline pipeline, RecordingSession session) {
        ItemOutcome outcome = resolve(input, pipeline, session);
        session.record(outcome);
        return outcome;
    }

    /**
     * Runs a step that has no per-URL extraction. The outcome carries the ids of
     * the fetched records; an empty fetch is a failure.
     */
    public ItemOutcome runSingle(String label, SingleStep step, RecordingSession session) {
        ItemOutcome outcome;
        try {
            List<FetchedItem> fetched = step.run(session);
            if (fetched == null || fetched.isEmpty()) {
                outcome = ItemOutcome.failure(label, NO_RESULTS);
            } else {
                List<String> ids = fetched.stream()
                        .filter(Objects::nonNull)
                        .map(FetchedItem::id)
                        .filter(Objects::nonNull)
                        .toList();
                outcome = ItemOutcome.success(label, ids, fetched.size());
            }
        } catch (Exception e) {
            logger.error("Fetch failed for {}", label, e);
            outcome = ItemOutcome.failure(label, errorText(e));
        }
        session.record(outcome);
        return outcome;
    }

    private ItemOutcome resolve(String input, ItemPipeline pipeline, RecordingSession session) {
        List<String> ids;
        try {
            ids = pipeline.extract(input);
        } catch (Exception e) {
            logger.warn("Extraction failed for {}: {}", input, errorText(e));
            return ItemOutcome.failure(input, errorText(e));
        }
        if (ids == null || ids.isEmpty()) {
            logger.warn("No identifiers extracted from {}", input);
            return ItemOutcome.failure(input, NO_IDENTIFIERS);
        }
        if (ids.stream().anyMatch(Objects::isNull)) {
            logger.warn("Null identifier extracted from {}", input);
            return ItemOutcome.failure(input, NULL_IDENTIFIER);
        }

        try {
            int payloadSize = pipeline.fetch(input, ids, session);
            logger.info("Fetched {} records for {} ({} ids)", payloadSize, input, ids.size());
            return ItemOutcome.success(input, ids, payloadSize);
        } catch (Exception e) {
            logger.error("Fetch failed for {}", input, e);
            return ItemOutcome.failure(input, ids, errorText(e));
        }
    }

    private void logCompletion(List<ItemOutcome> outcomes) {
        long failed = outcomes.stream().filter(o -> !o.succeeded()).count();
        logger.info("Batch finished: {} items, {} failed", outcomes.size(), failed);
    }

    public static String errorText(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
