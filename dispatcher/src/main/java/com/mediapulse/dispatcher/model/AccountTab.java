package com.mediapulse.dispatcher.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Which list of an account's works to fetch.
 */
public enum AccountTab {
    POST("post"),
    FAVORITE("favorite"),
    COLLECTION("collection");

    private final String value;

    AccountTab(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<AccountTab> fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
