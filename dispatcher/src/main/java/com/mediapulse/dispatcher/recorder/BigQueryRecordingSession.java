package com.mediapulse.dispatcher.recorder;

import com.google.cloud.bigquery.BigQueryException;
import com.mediapulse.dispatcher.backend.FetchOperation;
import com.mediapulse.dispatcher.model.FetchedItem;
import com.mediapulse.dispatcher.model.ItemOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Buffers the rows of one session in memory and streams them to BigQuery when
 * the session is closed. Rows BigQuery rejects make {@link #close()} fail.
 */
public class BigQueryRecordingSession implements RecordingSession {

    private static final Logger logger = LoggerFactory.getLogger(BigQueryRecordingSession.class);

    private final BigQueryRecorderFactory factory;
    private final String runId;
    private final Path root;
    private final List<Map<String, Object>> outcomeRows = new ArrayList<>();
    private final List<Map<String, Object>> fetchedRows = new ArrayList<>();
    private boolean closed;

    BigQueryRecordingSession(BigQueryRecorderFactory factory, String runId, Path root) {
        this.factory = factory;
        this.runId = runId;
        this.root = root;
    }

    public String runId() {
        return runId;
    }

    @Override
    public void record(ItemOutcome outcome) {
        Map<String, Object> row = new HashMap<>();
        row.put("run_id", runId);
        row.put("root", root.toString());
        row.put("url", outcome.input());
        row.put("status", outcome.status().value());
        row.put("extracted_ids", outcome.extractedIds());
        putIfPresent(row, "error", outcome.error());
        row.put("payload_size", outcome.payloadSize());
        outcomeRows.add(row);
    }

    @Override
    public void recordFetched(FetchOperation operation, List<FetchedItem> items) {
        for (FetchedItem item : items) {
            Map<String, Object> row = new HashMap<>();
            row.put("run_id", runId);
            row.put("operation", operation.wireName());
            putIfPresent(row, "item_id", item.id());
            putIfPresent(row, "item_type", item.type());
            putIfPresent(row, "title", item.title());
            putIfPresent(row, "url", item.url());
            fetchedRows.add(row);
        }
    }

    @Override
    public void close() throws RecorderException {
        if (closed) {
            return;
        }
        closed = true;
        InsertResult outcomes;
        InsertResult fetched;
        try {
            outcomes = factory.insertRows(RecorderSchemas.TABLE_DISPATCH_OUTCOMES, outcomeRows);
            fetched = factory.insertRows(RecorderSchemas.TABLE_FETCHED_ITEMS, fetchedRows);
        } catch (BigQueryException e) {
            throw new RecorderException("Failed to flush recording session " + runId + ": " + e.getMessage(), e);
        }

        int rejected = rejectedRows(outcomes) + rejectedRows(fetched);
        if (rejected > 0) {
            throw new RecorderException("Recording session " + runId + " lost " + rejected + " of "
                    + (outcomes.totalRows() + fetched.totalRows()) + " rows");
        }
        logger.debug("Flushed recording session {}: {} outcomes, {} fetched items",
                runId, outcomes.successfulRows(), fetched.successfulRows());
    }

    private static int rejectedRows(InsertResult result) {
        return result.hasErrors() ? result.totalRows() - result.successfulRows() : 0;
    }

    // BigQuery rows omit absent columns instead of carrying nulls.
    private static void putIfPresent(Map<String, Object> row, String column, Object value) {
        if (value != null) {
            row.put(column, value);
        }
    }
}
