package com.mediapulse.dispatcher.backend;

import java.util.List;
import java.util.Map;

/**
 * Arguments of one fetch call: the identifiers to fetch (empty for hot-list and
 * collection style operations), an optional keyword, and pass-through
 * parameters such as {@code max_pages} or {@code account_tab}.
 */
public record FetchQuery(List<String> ids, String keyword, Map<String, Object> parameters) {

    public FetchQuery {
        ids = ids == null ? List.of() : List.copyOf(ids);
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    public static FetchQuery ofIds(List<String> ids, Map<String, Object> parameters) {
        return new FetchQuery(ids, null, parameters);
    }

    public static FetchQuery ofKeyword(String keyword, Map<String, Object> parameters) {
        return new FetchQuery(List.of(), keyword, parameters);
    }
}
