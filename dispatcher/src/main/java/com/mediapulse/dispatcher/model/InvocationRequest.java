package com.mediapulse.dispatcher.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One dispatch call. {@code inputs} is the raw {@code urls} value exactly as the
 * caller supplied it (absent, a string, or a list); {@code options} is the
 * remaining named option bag.
 */
public record InvocationRequest(
        String action,
        String primaryCredential,
        String altCredential,
        Object inputs,
        Map<String, Object> options
) {

    public static final String URLS_OPTION = "urls";
    public static final String ALT_CREDENTIAL_OPTION = "cookie_tiktok";

    public InvocationRequest {
        options = options == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    /**
     * Builds a request from the flat option map accepted by the CLI and HTTP
     * shims, where {@code urls} and {@code cookie_tiktok} travel alongside the
     * other options.
     */
    public static InvocationRequest of(String action, String credential, Map<String, Object> options) {
        Map<String, Object> safe = options == null ? Map.of() : options;
        Object alt = safe.get(ALT_CREDENTIAL_OPTION);
        return new InvocationRequest(action, credential,
                alt instanceof String s ? s : null,
                safe.get(URLS_OPTION), safe);
    }
}
