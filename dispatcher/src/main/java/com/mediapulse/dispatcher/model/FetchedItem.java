package com.mediapulse.dispatcher.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One record returned by the fetch backend: a work, a comment, a live stream,
 * an account or a search hit, depending on the operation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FetchedItem(
        @JsonProperty("id") String id,
        @JsonProperty("type") String type,
        @JsonProperty("title") String title,
        @JsonProperty("url") String url
) {}
