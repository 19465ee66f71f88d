package com.mediapulse.dispatcher.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ItemStatus {
    SUCCESS("success"),
    FAILED("failed");

    private final String value;

    ItemStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
