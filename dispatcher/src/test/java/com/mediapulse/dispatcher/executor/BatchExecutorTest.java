package com.mediapulse.dispatcher.executor;

import com.mediapulse.dispatcher.backend.ExtractionException;
import com.mediapulse.dispatcher.backend.FetchException;
import com.mediapulse.dispatcher.model.DispatchOptions;
import com.mediapulse.dispatcher.model.FetchedItem;
import com.mediapulse.dispatcher.model.ItemOutcome;
import com.mediapulse.dispatcher.model.ItemStatus;
import com.mediapulse.dispatcher.recorder.RecorderException;
import com.mediapulse.dispatcher.recorder.RecorderFactory;
import com.mediapulse.dispatcher.recorder.RecordingSession;
import com.mediapulse.dispatcher.recorder.ScopedRecorder;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.*;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link BatchExecutor} per-item isolation and session handling.
 */
@ExtendWith(MockitoExtension.class)
class BatchExecutorTest {

    private static final Path ROOT = Path.of("downloads");

    @Mock
    private ItemPipeline pipeline;

    @Mock
    private RecordingSession session;

    private final BatchExecutor executor = new BatchExecutor();

    // =========================================================================
    // runBatch
    // =========================================================================

    @Test
    @DisplayName("Every item gets an outcome in input order")
    void runBatch_outcomePerItemInOrder() throws Exception {
        when(pipeline.extract("a")).thenReturn(List.of("1"));
        when(pipeline.extract("b")).thenReturn(List.of("2", "3"));
        when(pipeline.fetch(eq("a"), any(), eq(session))).thenReturn(1);
        when(pipeline.fetch(eq("b"), any(), eq(session))).thenReturn(2);

        List<ItemOutcome> outcomes = executor.runBatch(List.of("a", "b"), pipeline, session);

        assertEquals(2, outcomes.size());
        assertEquals("a", outcomes.get(0).input());
        assertEquals(List.of("1"), outcomes.get(0).extractedIds());
        assertEquals("b", outcomes.get(1).input());
        assertEquals(List.of("2", "3"), outcomes.get(1).extractedIds());
        assertEquals(2, outcomes.get(1).payloadSize());
        assertTrue(outcomes.stream().allMatch(ItemOutcome::succeeded));
    }

    @Test
    @DisplayName("A failing extraction fails only that item")
    void runBatch_extractionFailureIsolated() throws Exception {
        when(pipeline.extract("a")).thenReturn(List.of("1"));
        when(pipeline.extract("b")).thenThrow(new ExtractionException("unrecognized link"));
        when(pipeline.extract("c")).thenReturn(List.of("3"));
        when(pipeline.fetch(any(), any(), any())).thenReturn(1);

        List<ItemOutcome> outcomes = executor.runBatch(List.of("a", "b", "c"), pipeline, session);

        assertEquals(ItemStatus.SUCCESS, outcomes.get(0).status());
        assertEquals(ItemStatus.FAILED, outcomes.get(1).status());
        assertEquals("unrecognized link", outcomes.get(1).error());
        assertEquals(ItemStatus.SUCCESS, outcomes.get(2).status());
        verify(pipeline, never()).fetch(eq("b"), any(), any());
    }

    @Test
    @DisplayName("No identifiers extracted fails the item without fetching")
    void runBatch_noIdentifiers() throws Exception {
        when(pipeline.extract("a")).thenReturn(List.of());

        List<ItemOutcome> outcomes = executor.runBatch(List.of("a"), pipeline, session);

        assertEquals(BatchExecutor.NO_IDENTIFIERS, outcomes.get(0).error());
        verify(pipeline, never()).fetch(any(), any(), any());
    }

    @Test
    @DisplayName("A failing fetch keeps the extracted ids on the failed outcome")
    void runBatch_fetchFailureKeepsIds() throws Exception {
        when(pipeline.extract("a")).thenReturn(List.of("1", "2"));
        when(pipeline.fetch(eq("a"), any(), eq(session))).thenThrow(new FetchException("backend down"));

        ItemOutcome outcome = executor.runBatch(List.of("a"), pipeline, session).get(0);

        assertFalse(outcome.succeeded());
        assertEquals(List.of("1", "2"), outcome.extractedIds());
        assertEquals("backend down", outcome.error());
    }

    @Test
    @DisplayName("Exceptions without a message are described by their type")
    void runBatch_blankMessageUsesTypeName() throws Exception {
        when(pipeline.extract("a")).thenThrow(new IllegalStateException());

        ItemOutcome outcome = executor.runBatch(List.of("a"), pipeline, session).get(0);

        assertEquals("IllegalStateException", outcome.error());
    }

    @Test
    @DisplayName("Each outcome is handed to the session")
    void runBatch_recordsOutcomes() throws Exception {
        when(pipeline.extract(any())).thenReturn(List.of("1"));
        when(pipeline.fetch(any(), any(), any())).thenReturn(1);

        List<ItemOutcome> outcomes = executor.runBatch(List.of("a", "b"), pipeline, session);

        ArgumentCaptor<ItemOutcome> captor = ArgumentCaptor.forClass(ItemOutcome.class);
        verify(session, times(2)).record(captor.capture());
        assertEquals(outcomes, captor.getAllValues());
    }

    @Test
    @DisplayName("A null identifier fails the item without fetching and the batch continues")
    void runBatch_nullIdentifierIsolated() throws Exception {
        when(pipeline.extract("a")).thenReturn(List.of("1"));
        when(pipeline.extract("b")).thenReturn(Arrays.asList("2", null));
        when(pipeline.extract("c")).thenReturn(List.of("3"));
        when(pipeline.fetch(any(), any(), any())).thenReturn(1);

        List<ItemOutcome> outcomes = executor.runBatch(List.of("a", "b", "c"), pipeline, session);

        assertEquals(3, outcomes.size());
        assertTrue(outcomes.get(0).succeeded());
        assertEquals(BatchExecutor.NULL_IDENTIFIER, outcomes.get(1).error());
        assertTrue(outcomes.get(1).extractedIds().isEmpty());
        assertTrue(outcomes.get(2).succeeded());
        verify(pipeline, never()).fetch(eq("b"), any(), any());
    }

    // =========================================================================
    // runBatchWithSessionPerItem
    // =========================================================================

    @Test
    @DisplayName("A session is opened and released around every item")
    void perItem_sessionPerItem() throws Exception {
        RecordingSession first = mock(RecordingSession.class);
        RecordingSession second = mock(RecordingSession.class);
        RecorderFactory factory = mock(RecorderFactory.class);
        when(factory.open(eq(ROOT), any())).thenReturn(first, second);
        when(pipeline.extract(any())).thenReturn(List.of("1"));
        when(pipeline.fetch(any(), any(), any())).thenReturn(1);

        ScopedRecorder recorder = new ScopedRecorder(factory, ROOT, DispatchOptions.defaults(ROOT));
        List<ItemOutcome> outcomes = executor.runBatchWithSessionPerItem(List.of("a", "b"), pipeline, recorder);

        assertEquals(2, outcomes.size());
        verify(pipeline).fetch(eq("a"), any(), eq(first));
        verify(pipeline).fetch(eq("b"), any(), eq(second));
        verify(first).close();
        verify(second).close();
    }

    @Test
    @DisplayName("A session that cannot be opened aborts the batch")
    void perItem_acquisitionFailureAborts() throws Exception {
        RecorderFactory factory = mock(RecorderFactory.class);
        when(factory.open(any(), any())).thenThrow(new RecorderException("disk full"));

        ScopedRecorder recorder = new ScopedRecorder(factory, ROOT, DispatchOptions.defaults(ROOT));

        RecorderException ex = assertThrows(RecorderException.class,
                () -> executor.runBatchWithSessionPerItem(List.of("a", "b"), pipeline, recorder));

        assertEquals("disk full", ex.getMessage());
        verifyNoInteractions(pipeline);
    }

    // =========================================================================
    // runSingle
    // =========================================================================

    @Test
    @DisplayName("runSingle succeeds with the ids of the fetched records")
    void runSingle_success() {
        List<FetchedItem> fetched = List.of(
                new FetchedItem("v1", "video", "First", null),
                new FetchedItem("v2", "video", "Second", null));

        ItemOutcome outcome = executor.runSingle("cats", s -> fetched, session);

        assertTrue(outcome.succeeded());
        assertEquals("cats", outcome.input());
        assertEquals(List.of("v1", "v2"), outcome.extractedIds());
        verify(session).record(outcome);
    }

    @Test
    @DisplayName("runSingle fails when nothing is returned")
    void runSingle_emptyFails() {
        ItemOutcome outcome = executor.runSingle("hot", s -> List.of(), session);

        assertFalse(outcome.succeeded());
        assertEquals(BatchExecutor.NO_RESULTS, outcome.error());
    }

    @Test
    @DisplayName("runSingle converts a thrown error into a failed outcome")
    void runSingle_errorFails() {
        ItemOutcome outcome = executor.runSingle("hot", s -> {
            throw new FetchException("cookie expired");
        }, session);

        assertFalse(outcome.succeeded());
        assertEquals("cookie expired", outcome.error());
    }

    @Test
    @DisplayName("runSingle ignores fetched records without an id")
    void runSingle_skipsMissingIds() {
        List<FetchedItem> fetched = Arrays.asList(
                new FetchedItem("v1", "video", "First", null),
                new FetchedItem(null, "video", "No id", null),
                null);

        ItemOutcome outcome = executor.runSingle("cats", s -> fetched, session);

        assertTrue(outcome.succeeded());
        assertEquals(List.of("v1"), outcome.extractedIds());
    }
}
