package com.mediapulse.dispatcher.recorder;

import java.util.List;

/**
 * Outcome of a BigQuery streaming insert: rows attempted, rows stored and the
 * per-row errors of a partial failure.
 */
public record InsertResult(
        int totalRows,
        int successfulRows,
        List<RowError> errors
) {

    public record RowError(long rowIndex, String message) {}

    public boolean hasErrors() {
        return errors != null && !errors.isEmpty();
    }
}
