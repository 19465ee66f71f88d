package com.mediapulse.dispatcher.backend;

/**
 * Fetch families offered by the content backend. The wire name is the path
 * segment used by {@link HttpContentBackend}.
 */
public enum FetchOperation {
    DETAIL("detail"),
    DETAIL_UNOFFICIAL("detail-unofficial"),
    ACCOUNT_WORKS("account-works"),
    LIVE("live"),
    COMMENTS("comments"),
    MIX("mix"),
    ACCOUNT_DETAIL("account-detail"),
    SEARCH("search"),
    HOT("hot"),
    COLLECTION("collection"),
    COLLECTION_MUSIC("collection-music"),
    COLLECTS("collects");

    private final String wireName;

    FetchOperation(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
