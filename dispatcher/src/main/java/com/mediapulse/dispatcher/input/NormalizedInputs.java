package com.mediapulse.dispatcher.input;

import java.util.List;

/**
 * Canonical inputs for one call: either an ordered list of non-blank, trimmed
 * URLs or a single trimmed keyword. Actions that take no input get
 * {@link #none()}.
 */
public record NormalizedInputs(List<String> items, String keyword) {

    public NormalizedInputs {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static NormalizedInputs ofItems(List<String> items) {
        return new NormalizedInputs(items, null);
    }

    public static NormalizedInputs ofKeyword(String keyword) {
        return new NormalizedInputs(List.of(), keyword);
    }

    public static NormalizedInputs none() {
        return new NormalizedInputs(List.of(), null);
    }

    public boolean isKeyword() {
        return keyword != null;
    }

    public int size() {
        return isKeyword() ? 1 : items.size();
    }
}
