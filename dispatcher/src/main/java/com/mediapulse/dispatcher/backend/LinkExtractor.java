package com.mediapulse.dispatcher.backend;

import java.util.List;

/**
 * Turns provider share links into opaque identifiers.
 */
public interface LinkExtractor {

    /**
     * @return identifiers in link order; empty when the link holds none
     * @throws ExtractionException if the link is not recognized
     */
    List<String> extractIdentifiers(String url, LinkKind kind) throws ExtractionException;

    /**
     * Extracts account identifiers from a profile link.
     */
    List<String> extractAccountTargets(String url) throws ExtractionException;
}
