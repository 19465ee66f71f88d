package com.mediapulse.dispatcher.recorder;

import com.mediapulse.dispatcher.model.DispatchOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Runs a body of work inside a recording session and releases the session
 * exactly once, whether the body returns or throws.
 *
 * <p>If the session cannot be opened the body never runs and a
 * {@link RecorderException} is raised. A failure while releasing is logged; by
 * then every outcome has already been handed to the session.</p>
 */
public class ScopedRecorder {

    private static final Logger logger = LoggerFactory.getLogger(ScopedRecorder.class);

    /**
     * Work performed while a session is open.
     */
    @FunctionalInterface
    public interface SessionBody<T> {
        T apply(RecordingSession session) throws Exception;
    }

    private final RecorderFactory factory;
    private final Path root;
    private final DispatchOptions options;

    public ScopedRecorder(RecorderFactory factory, Path root, DispatchOptions options) {
        this.factory = factory;
        this.root = root;
        this.options = options;
    }

    public <T> T withSession(SessionBody<T> body) throws Exception {
        RecordingSession session = acquire();
        try {
            return body.apply(session);
        } finally {
            release(session);
        }
    }

    private RecordingSession acquire() throws RecorderException {
        RecordingSession session;
        try {
            session = factory.open(root, options);
        } catch (RecorderException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RecorderException("Failed to open recording session: " + e.getMessage(), e);
        }
        if (session == null) {
            throw new RecorderException("Recorder factory returned no session");
        }
        logger.debug("Opened recording session under {}", root);
        return session;
    }

    private void release(RecordingSession session) {
        try {
            session.close();
            logger.debug("Released recording session under {}", root);
        } catch (RecorderException | RuntimeException e) {
            logger.error("Failed to release recording session under {}", root, e);
        }
    }
}
