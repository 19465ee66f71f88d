package com.mediapulse.dispatcher.recorder;

import com.google.cloud.bigquery.*;
import com.mediapulse.dispatcher.backend.FetchOperation;
import com.mediapulse.dispatcher.model.DispatchOptions;
import com.mediapulse.dispatcher.model.FetchedItem;
import com.mediapulse.dispatcher.model.ItemOutcome;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.*;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link BigQueryRecorderFactory} and {@link BigQueryRecordingSession}
 * using a mocked BigQuery client.
 */
@ExtendWith(MockitoExtension.class)
class BigQueryRecorderFactoryTest {

    private static final String PROJECT_ID = "test-project";
    private static final Path ROOT = Path.of("downloads");

    @Mock
    private BigQuery bigQuery;

    @Mock
    private InsertAllResponse insertResponse;

    private BigQueryRecorderFactory factory;

    @BeforeEach
    void setUp() {
        factory = new BigQueryRecorderFactory(bigQuery, PROJECT_ID);
    }

    // =========================================================================
    // Table preparation
    // =========================================================================

    @Test
    @DisplayName("First open creates the dataset and both tables when missing")
    void open_createsDatasetAndTables() throws Exception {
        when(bigQuery.getDataset(any(DatasetId.class))).thenReturn(null);
        when(bigQuery.getTable(any(TableId.class))).thenReturn(null);

        factory.open(ROOT, DispatchOptions.defaults(ROOT));

        ArgumentCaptor<DatasetInfo> datasetCaptor = ArgumentCaptor.forClass(DatasetInfo.class);
        verify(bigQuery).create(datasetCaptor.capture());
        assertEquals(RecorderSchemas.DATASET, datasetCaptor.getValue().getDatasetId().getDataset());

        ArgumentCaptor<TableInfo> tableCaptor = ArgumentCaptor.forClass(TableInfo.class);
        verify(bigQuery, times(2)).create(tableCaptor.capture());
        List<String> tables = tableCaptor.getAllValues().stream()
                .map(info -> info.getTableId().getTable())
                .toList();
        assertTrue(tables.contains(RecorderSchemas.TABLE_DISPATCH_OUTCOMES));
        assertTrue(tables.contains(RecorderSchemas.TABLE_FETCHED_ITEMS));
    }

    @Test
    @DisplayName("Existing dataset and tables are left alone")
    void open_skipsExisting() throws Exception {
        when(bigQuery.getDataset(any(DatasetId.class))).thenReturn(mock(Dataset.class));
        when(bigQuery.getTable(any(TableId.class))).thenReturn(mock(Table.class));

        factory.open(ROOT, DispatchOptions.defaults(ROOT));

        verify(bigQuery, never()).create(any(DatasetInfo.class));
        verify(bigQuery, never()).create(any(TableInfo.class));
    }

    @Test
    @DisplayName("Preparation happens only on the first open")
    void open_preparesOnce() throws Exception {
        when(bigQuery.getDataset(any(DatasetId.class))).thenReturn(mock(Dataset.class));
        when(bigQuery.getTable(any(TableId.class))).thenReturn(mock(Table.class));

        RecordingSession first = factory.open(ROOT, DispatchOptions.defaults(ROOT));
        RecordingSession second = factory.open(ROOT, DispatchOptions.defaults(ROOT));

        verify(bigQuery, times(1)).getDataset(any(DatasetId.class));
        assertNotEquals(((BigQueryRecordingSession) first).runId(),
                ((BigQueryRecordingSession) second).runId());
    }

    @Test
    @DisplayName("BigQuery failure during preparation becomes RecorderException")
    void open_bigQueryFailure() {
        when(bigQuery.getDataset(any(DatasetId.class)))
                .thenThrow(new BigQueryException(403, "Access denied"));

        RecorderException ex = assertThrows(RecorderException.class,
                () -> factory.open(ROOT, DispatchOptions.defaults(ROOT)));

        assertTrue(ex.getMessage().contains("Access denied"));
    }

    // =========================================================================
    // Session flushing
    // =========================================================================

    @Test
    @DisplayName("Closing a session streams outcomes and fetched items to their tables")
    void close_flushesBothTables() throws Exception {
        BigQueryRecordingSession session = openPreparedSession();
        when(bigQuery.insertAll(any(InsertAllRequest.class))).thenReturn(insertResponse);

        session.record(ItemOutcome.success("https://a", List.of("1"), 1));
        session.record(ItemOutcome.failure("https://b", "unrecognized link"));
        session.recordFetched(FetchOperation.DETAIL,
                List.of(new FetchedItem("1", "video", "First", "https://a")));
        session.close();

        ArgumentCaptor<InsertAllRequest> captor = ArgumentCaptor.forClass(InsertAllRequest.class);
        verify(bigQuery, times(2)).insertAll(captor.capture());

        InsertAllRequest outcomes = captor.getAllValues().get(0);
        assertEquals(RecorderSchemas.TABLE_DISPATCH_OUTCOMES, outcomes.getTable().getTable());
        assertEquals(2, outcomes.getRows().size());
        Map<String, Object> failedRow = outcomes.getRows().get(1).getContent();
        assertEquals("failed", failedRow.get("status"));
        assertEquals("unrecognized link", failedRow.get("error"));
        assertEquals(session.runId(), failedRow.get("run_id"));
        assertNotNull(failedRow.get("ingestion_timestamp"));

        InsertAllRequest fetched = captor.getAllValues().get(1);
        assertEquals(RecorderSchemas.TABLE_FETCHED_ITEMS, fetched.getTable().getTable());
        assertEquals("detail", fetched.getRows().get(0).getContent().get("operation"));
    }

    @Test
    @DisplayName("Empty buffers are not sent and close is idempotent")
    void close_skipsEmptyAndIsIdempotent() throws Exception {
        BigQueryRecordingSession session = openPreparedSession();
        when(bigQuery.insertAll(any(InsertAllRequest.class))).thenReturn(insertResponse);

        session.record(ItemOutcome.success("https://a", List.of("1"), 1));
        session.close();
        session.close();

        verify(bigQuery, times(1)).insertAll(any(InsertAllRequest.class));
    }

    @Test
    @DisplayName("BigQuery failure while flushing becomes RecorderException")
    void close_bigQueryFailure() throws Exception {
        BigQueryRecordingSession session = openPreparedSession();
        when(bigQuery.insertAll(any(InsertAllRequest.class)))
                .thenThrow(new BigQueryException(500, "Backend error"));

        session.record(ItemOutcome.success("https://a", List.of("1"), 1));

        assertThrows(RecorderException.class, session::close);
    }

    @Test
    @DisplayName("insertRows reports per-row errors")
    void insertRows_partialFailure() {
        when(bigQuery.insertAll(any(InsertAllRequest.class))).thenReturn(insertResponse);
        when(insertResponse.hasErrors()).thenReturn(true);
        when(insertResponse.getInsertErrors()).thenReturn(
                Map.of(1L, List.of(new BigQueryError("invalid", "status", "Bad value"))));

        InsertResult result = factory.insertRows(RecorderSchemas.TABLE_DISPATCH_OUTCOMES, List.of(
                Map.of("run_id", "r", "status", "success"),
                Map.of("run_id", "r", "status", "???")));

        assertEquals(2, result.totalRows());
        assertEquals(1, result.successfulRows());
        assertTrue(result.hasErrors());
        assertEquals(1L, result.errors().get(0).rowIndex());
    }

    @Test
    @DisplayName("insertRows with no rows does not call BigQuery")
    void insertRows_empty() {
        InsertResult result = factory.insertRows(RecorderSchemas.TABLE_FETCHED_ITEMS, List.of());

        assertEquals(0, result.totalRows());
        verifyNoInteractions(bigQuery);
    }

    private BigQueryRecordingSession openPreparedSession() throws RecorderException {
        when(bigQuery.getDataset(any(DatasetId.class))).thenReturn(mock(Dataset.class));
        when(bigQuery.getTable(any(TableId.class))).thenReturn(mock(Table.class));
        return (BigQueryRecordingSession) factory.open(ROOT, DispatchOptions.defaults(ROOT));
    }

    @Test
    @DisplayName("Rows rejected by BigQuery make close fail")
    void close_rejectedRowsFail() throws Exception {
        BigQueryRecordingSession session = openPreparedSession();
        when(bigQuery.insertAll(any(InsertAllRequest.class))).thenReturn(insertResponse);
        when(insertResponse.hasErrors()).thenReturn(true);
        when(insertResponse.getInsertErrors()).thenReturn(
                Map.of(0L, List.of(new BigQueryError("invalid", "status", "Bad value"))));

        session.record(ItemOutcome.success("https://a", List.of("1"), 1));
        session.record(ItemOutcome.success("https://b", List.of("2"), 1));

        RecorderException ex = assertThrows(RecorderException.class, session::close);

        assertTrue(ex.getMessage().contains("lost 1 of 2 rows"));
    }
}
