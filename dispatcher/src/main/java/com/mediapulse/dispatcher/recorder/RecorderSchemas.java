package com.mediapulse.dispatcher.recorder;

import com.google.cloud.bigquery.Clustering;
import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.Schema;
import com.google.cloud.bigquery.StandardSQLTypeName;
import com.google.cloud.bigquery.StandardTableDefinition;
import com.google.cloud.bigquery.TableDefinition;
import com.google.cloud.bigquery.TimePartitioning;

import java.util.List;

/**
 * Table layouts for recorded dispatch runs. Both tables are partitioned by
 * ingestion_timestamp (DAY).
 */
public final class RecorderSchemas {

    private RecorderSchemas() {}

    public static final String DATASET = "mediapulse_records";
    public static final String TABLE_DISPATCH_OUTCOMES = "dispatch_outcomes";
    public static final String TABLE_FETCHED_ITEMS = "fetched_items";

    public static Schema dispatchOutcomesSchema() {
        return Schema.of(
                Field.newBuilder("run_id", StandardSQLTypeName.STRING)
                        .setMode(Field.Mode.REQUIRED).build(),
                Field.of("root", StandardSQLTypeName.STRING),
                Field.of("url", StandardSQLTypeName.STRING),
                Field.of("status", StandardSQLTypeName.STRING),
                Field.newBuilder("extracted_ids", StandardSQLTypeName.STRING)
                        .setMode(Field.Mode.REPEATED).build(),
                Field.of("error", StandardSQLTypeName.STRING),
                Field.of("payload_size", StandardSQLTypeName.INT64),
                Field.newBuilder("ingestion_timestamp", StandardSQLTypeName.TIMESTAMP)
                        .setMode(Field.Mode.REQUIRED).build()
        );
    }

    public static Schema fetchedItemsSchema() {
        return Schema.of(
                Field.newBuilder("run_id", StandardSQLTypeName.STRING)
                        .setMode(Field.Mode.REQUIRED).build(),
                Field.of("operation", StandardSQLTypeName.STRING),
                Field.of("item_id", StandardSQLTypeName.STRING),
                Field.of("item_type", StandardSQLTypeName.STRING),
                Field.of("title", StandardSQLTypeName.STRING),
                Field.of("url", StandardSQLTypeName.STRING),
                Field.newBuilder("ingestion_timestamp", StandardSQLTypeName.TIMESTAMP)
                        .setMode(Field.Mode.REQUIRED).build()
        );
    }

    public static TableDefinition dispatchOutcomesDefinition() {
        return buildPartitionedTable(dispatchOutcomesSchema(), List.of("status"));
    }

    public static TableDefinition fetchedItemsDefinition() {
        return buildPartitionedTable(fetchedItemsSchema(), List.of("operation"));
    }

    private static TableDefinition buildPartitionedTable(Schema schema, List<String> clusterFields) {
        TimePartitioning partitioning = TimePartitioning.newBuilder(TimePartitioning.Type.DAY)
                .setField("ingestion_timestamp")
                .build();

        Clustering clustering = Clustering.newBuilder()
                .setFields(clusterFields)
                .build();

        return StandardTableDefinition.newBuilder()
                .setSchema(schema)
                .setTimePartitioning(partitioning)
                .setClustering(clustering)
                .build();
    }
}
