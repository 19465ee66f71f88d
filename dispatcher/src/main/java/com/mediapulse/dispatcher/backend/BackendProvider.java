package com.mediapulse.dispatcher.backend;

import com.mediapulse.dispatcher.model.DispatchOptions;
import com.mediapulse.dispatcher.model.Platform;

/**
 * Opens a {@link ContentBackend} for one dispatch call.
 */
@FunctionalInterface
public interface BackendProvider {

    ContentBackend open(Platform platform, String credential, DispatchOptions options);
}
