package com.mediapulse.dispatcher.recorder;

import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryError;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.BigQueryOptions;
import com.google.cloud.bigquery.DatasetId;
import com.google.cloud.bigquery.DatasetInfo;
import com.google.cloud.bigquery.InsertAllRequest;
import com.google.cloud.bigquery.InsertAllResponse;
import com.google.cloud.bigquery.TableDefinition;
import com.google.cloud.bigquery.TableId;
import com.google.cloud.bigquery.TableInfo;
import com.mediapulse.dispatcher.model.DispatchOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Opens {@link BigQueryRecordingSession}s. The dataset and tables are created
 * on the first open and reused afterwards.
 */
public class BigQueryRecorderFactory implements RecorderFactory {

    private static final Logger logger = LoggerFactory.getLogger(BigQueryRecorderFactory.class);

    private final BigQuery bigQuery;
    private final String projectId;
    private boolean prepared;

    /**
     * Production constructor. Credentials come from
     * GOOGLE_APPLICATION_CREDENTIALS.
     */
    public BigQueryRecorderFactory(String projectId) {
        this(BigQueryOptions.newBuilder()
                .setProjectId(projectId)
                .build()
                .getService(), projectId);
        logger.info("BigQuery recorder initialized for project: {}", projectId);
    }

    BigQueryRecorderFactory(BigQuery bigQuery, String projectId) {
        this.bigQuery = bigQuery;
        this.projectId = projectId;
    }

    @Override
    public RecordingSession open(Path root, DispatchOptions options) throws RecorderException {
        try {
            prepare();
        } catch (BigQueryException e) {
            throw new RecorderException("Failed to prepare BigQuery recording tables: " + e.getMessage(), e);
        }
        String runId = UUID.randomUUID().toString();
        logger.info("Opened BigQuery recording session {} for {}", runId, root);
        return new BigQueryRecordingSession(this, runId, root);
    }

    private synchronized void prepare() {
        if (prepared) {
            return;
        }
        DatasetId datasetId = DatasetId.of(projectId, RecorderSchemas.DATASET);
        if (bigQuery.getDataset(datasetId) == null) {
            bigQuery.create(DatasetInfo.newBuilder(datasetId).setLocation("US").build());
            logger.info("Created dataset: {}", RecorderSchemas.DATASET);
        }
        createTableIfNotExists(RecorderSchemas.TABLE_DISPATCH_OUTCOMES,
                RecorderSchemas.dispatchOutcomesDefinition());
        createTableIfNotExists(RecorderSchemas.TABLE_FETCHED_ITEMS,
                RecorderSchemas.fetchedItemsDefinition());
        prepared = true;
    }

    private void createTableIfNotExists(String tableName, TableDefinition definition) {
        TableId tableId = TableId.of(projectId, RecorderSchemas.DATASET, tableName);
        if (bigQuery.getTable(tableId) == null) {
            bigQuery.create(TableInfo.newBuilder(tableId, definition).build());
            logger.info("Created table: {}.{}", RecorderSchemas.DATASET, tableName);
        } else {
            logger.debug("Table already exists: {}.{}", RecorderSchemas.DATASET, tableName);
        }
    }

    /**
     * Streams rows into a recorder table, stamping each with
     * ingestion_timestamp.
     */
    InsertResult insertRows(String tableName, List<Map<String, Object>> rows) {
        if (rows.isEmpty()) {
            return new InsertResult(0, 0, List.of());
        }

        TableId tableId = TableId.of(projectId, RecorderSchemas.DATASET, tableName);
        String now = Instant.now().toString();

        InsertAllRequest.Builder requestBuilder = InsertAllRequest.newBuilder(tableId);
        for (Map<String, Object> row : rows) {
            Map<String, Object> rowWithTimestamp = new HashMap<>(row);
            rowWithTimestamp.put("ingestion_timestamp", now);
            requestBuilder.addRow(rowWithTimestamp);
        }

        InsertAllResponse response = bigQuery.insertAll(requestBuilder.build());

        List<InsertResult.RowError> errors = new ArrayList<>();
        if (response.hasErrors()) {
            for (Map.Entry<Long, List<BigQueryError>> entry : response.getInsertErrors().entrySet()) {
                for (BigQueryError error : entry.getValue()) {
                    errors.add(new InsertResult.RowError(entry.getKey(), error.getMessage()));
                    logger.error("Insert error in {}.{} row {}: {} (reason: {})",
                            RecorderSchemas.DATASET, tableName, entry.getKey(),
                            error.getMessage(), error.getReason());
                }
            }
        }

        int successfulRows = rows.size() - response.getInsertErrors().size();
        logger.info("Recorded {}/{} rows into {}.{}",
                successfulRows, rows.size(), RecorderSchemas.DATASET, tableName);
        return new InsertResult(rows.size(), successfulRows, errors);
    }
}
