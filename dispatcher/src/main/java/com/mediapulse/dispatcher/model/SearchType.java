package com.mediapulse.dispatcher.model;

import java.util.Arrays;

public enum SearchType {
    GENERAL("general"),
    USER("user"),
    VIDEO("video"),
    LIVE("live");

    private final String value;

    SearchType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Unrecognized values fall back to {@link #GENERAL}.
     */
    public static SearchType fromValue(String value) {
        if (value == null) {
            return GENERAL;
        }
        return Arrays.stream(values())
                .filter(t -> t.value.equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElse(GENERAL);
    }
}
