package com.mediapulse.dispatcher.model;

/**
 * Content-provider backend a call is routed to. {@link #TIKTOK} is selected by
 * the {@code tiktok} option and supports a narrower set of actions.
 */
public enum Platform {
    DOUYIN("douyin"),
    TIKTOK("tiktok");

    private final String wireName;

    Platform(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Platform fromFlag(boolean tiktok) {
        return tiktok ? TIKTOK : DOUYIN;
    }
}
