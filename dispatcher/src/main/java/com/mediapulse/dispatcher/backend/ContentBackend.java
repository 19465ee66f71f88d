package com.mediapulse.dispatcher.backend;

/**
 * A per-call connection to the extraction and fetch backend, bound to one
 * platform and credential. Closed by the dispatcher once the call finishes.
 */
public interface ContentBackend extends LinkExtractor, ContentFetcher, AutoCloseable {

    @Override
    void close();
}
