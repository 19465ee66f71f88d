package com.mediapulse.dispatcher.recorder;

import com.mediapulse.dispatcher.model.DispatchOptions;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.*;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link StorageFormatRecorderFactory} routing.
 */
@ExtendWith(MockitoExtension.class)
class StorageFormatRecorderFactoryTest {

    private static final Path ROOT = Path.of("downloads");

    @Mock
    private RecorderFactory bigQuery;

    @Mock
    private RecordingSession bigQuerySession;

    private static DispatchOptions withFormat(String format) throws Exception {
        return DispatchOptions.from(Map.of("storage_format", format), ROOT);
    }

    @Test
    @DisplayName("Blank storage format keeps no records")
    void blankFormat_noOp() throws Exception {
        StorageFormatRecorderFactory factory =
                new StorageFormatRecorderFactory(new NoOpRecorderFactory(), bigQuery);

        RecordingSession session = factory.open(ROOT, DispatchOptions.defaults(ROOT));

        assertSame(RecordingSession.NONE, session);
        verifyNoInteractions(bigQuery);
    }

    @Test
    @DisplayName("bigquery format opens a BigQuery session, case-insensitively")
    void bigQueryFormat_routed() throws Exception {
        DispatchOptions options = withFormat("BigQuery");
        when(bigQuery.open(ROOT, options)).thenReturn(bigQuerySession);
        StorageFormatRecorderFactory factory =
                new StorageFormatRecorderFactory(new NoOpRecorderFactory(), bigQuery);

        assertSame(bigQuerySession, factory.open(ROOT, options));
    }

    @Test
    @DisplayName("bigquery format without a configured project fails")
    void bigQueryFormat_notConfigured() throws Exception {
        StorageFormatRecorderFactory factory =
                new StorageFormatRecorderFactory(new NoOpRecorderFactory(), null);

        RecorderException ex = assertThrows(RecorderException.class,
                () -> factory.open(ROOT, withFormat("bigquery")));

        assertTrue(ex.getMessage().contains("GCP_PROJECT_ID"));
    }

    @Test
    @DisplayName("Unknown storage format is rejected")
    void unknownFormat_rejected() throws Exception {
        StorageFormatRecorderFactory factory =
                new StorageFormatRecorderFactory(new NoOpRecorderFactory(), bigQuery);

        RecorderException ex = assertThrows(RecorderException.class,
                () -> factory.open(ROOT, withFormat("parquet")));

        assertEquals("Unsupported storage format: parquet", ex.getMessage());
    }
}
