package com.mediapulse.dispatcher.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Result of processing a single normalized input within a batch.
 * Serialized as one entry of the {@code details} list.
 */
@JsonPropertyOrder({"url", "status", "extractedIds", "error"})
public record ItemOutcome(
        @JsonProperty("url") String input,
        @JsonProperty("status") ItemStatus status,
        @JsonProperty("extractedIds") @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> extractedIds,
        @JsonProperty("error") @JsonInclude(JsonInclude.Include.NON_NULL) String error,
        @JsonIgnore int payloadSize
) {

    public ItemOutcome {
        extractedIds = extractedIds == null ? List.of() : List.copyOf(extractedIds);
    }

    public static ItemOutcome success(String input, List<String> extractedIds, int payloadSize) {
        return new ItemOutcome(input, ItemStatus.SUCCESS, extractedIds, null, payloadSize);
    }

    public static ItemOutcome failure(String input, List<String> extractedIds, String error) {
        return new ItemOutcome(input, ItemStatus.FAILED, extractedIds, error, 0);
    }

    public static ItemOutcome failure(String input, String error) {
        return failure(input, List.of(), error);
    }

    @JsonIgnore
    public boolean succeeded() {
        return status == ItemStatus.SUCCESS;
    }
}
