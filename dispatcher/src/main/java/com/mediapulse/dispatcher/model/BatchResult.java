package com.mediapulse.dispatcher.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Report returned by every dispatch call. {@code success} may be true while
 * {@code failedCount > 0}; it is false when nothing usable was produced or a
 * fatal error stopped the call.
 */
@JsonPropertyOrder({"success", "message", "downloadedCount", "failedCount", "details"})
public record BatchResult(
        @JsonProperty("success") boolean success,
        @JsonProperty("message") String message,
        @JsonProperty("downloadedCount") int downloadedCount,
        @JsonProperty("failedCount") int failedCount,
        @JsonProperty("details") List<ItemOutcome> details
) {

    public BatchResult {
        details = details == null ? List.of() : List.copyOf(details);
    }

    /**
     * A fatal result: no batch work happened, so no counts and no details.
     */
    public static BatchResult failure(String message) {
        return new BatchResult(false, message, 0, 0, List.of());
    }
}
