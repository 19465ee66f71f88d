package com.mediapulse.dispatcher.action;

import com.mediapulse.dispatcher.backend.ContentBackend;
import com.mediapulse.dispatcher.executor.BatchExecutor;
import com.mediapulse.dispatcher.executor.ResultAggregator;
import com.mediapulse.dispatcher.input.NormalizedInputs;
import com.mediapulse.dispatcher.model.DispatchOptions;
import com.mediapulse.dispatcher.recorder.ScopedRecorder;

/**
 * Everything a handler needs for one call. Owned by that call only.
 */
public record ActionContext(
        ActionSpec spec,
        NormalizedInputs inputs,
        DispatchOptions options,
        ContentBackend backend,
        ScopedRecorder recorder,
        BatchExecutor executor,
        ResultAggregator aggregator
) {}
