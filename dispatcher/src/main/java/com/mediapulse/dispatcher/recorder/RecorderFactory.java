package com.mediapulse.dispatcher.recorder;

import com.mediapulse.dispatcher.model.DispatchOptions;

import java.nio.file.Path;

/**
 * Opens recording sessions rooted at the call's download path.
 */
@FunctionalInterface
public interface RecorderFactory {

    RecordingSession open(Path root, DispatchOptions options) throws RecorderException;
}
