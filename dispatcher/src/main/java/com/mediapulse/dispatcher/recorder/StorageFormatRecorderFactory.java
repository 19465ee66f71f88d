package com.mediapulse.dispatcher.recorder;

import com.mediapulse.dispatcher.model.DispatchOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Picks the recorder from the call's {@code storage_format} option: blank keeps
 * no records, {@code bigquery} streams them to BigQuery.
 */
public class StorageFormatRecorderFactory implements RecorderFactory {

    private static final Logger logger = LoggerFactory.getLogger(StorageFormatRecorderFactory.class);

    static final String FORMAT_BIGQUERY = "bigquery";

    private final RecorderFactory noOp;
    private final RecorderFactory bigQuery;

    /**
     * @param bigQuery factory for the {@code bigquery} format, or null when no
     *                 GCP project is configured
     */
    public StorageFormatRecorderFactory(RecorderFactory noOp, RecorderFactory bigQuery) {
        this.noOp = noOp;
        this.bigQuery = bigQuery;
    }

    @Override
    public RecordingSession open(Path root, DispatchOptions options) throws RecorderException {
        String format = options.storageFormat().toLowerCase(Locale.ROOT);
        if (format.isEmpty()) {
            return noOp.open(root, options);
        }
        if (FORMAT_BIGQUERY.equals(format)) {
            if (bigQuery == null) {
                throw new RecorderException("storage_format 'bigquery' requires GCP_PROJECT_ID to be configured");
            }
            logger.debug("Recording to BigQuery for root {}", root);
            return bigQuery.open(root, options);
        }
        throw new RecorderException("Unsupported storage format: " + options.storageFormat());
    }
}
