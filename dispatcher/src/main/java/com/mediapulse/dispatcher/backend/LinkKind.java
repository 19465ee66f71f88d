package com.mediapulse.dispatcher.backend;

/**
 * What kind of identifier the extractor should pull out of a share link.
 */
public enum LinkKind {
    WORK("work"),
    LIVE("live"),
    MIX("mix"),
    COLLECTS("collects");

    private final String wireName;

    LinkKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
