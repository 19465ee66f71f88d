package com.mediapulse.dispatcher.recorder;

import com.mediapulse.dispatcher.model.DispatchOptions;

import java.nio.file.Path;

public class NoOpRecorderFactory implements RecorderFactory {

    @Override
    public RecordingSession open(Path root, DispatchOptions options) {
        return RecordingSession.NONE;
    }
}
