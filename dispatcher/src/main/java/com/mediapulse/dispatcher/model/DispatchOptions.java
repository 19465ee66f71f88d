package com.mediapulse.dispatcher.model;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Typed view over the option bag of one dispatch call. Unknown keys are
 * ignored; known keys with a wrong type or an out-of-range value are rejected
 * with {@link ValidationError.Kind#INVALID_OPTION}.
 */
public record DispatchOptions(
        Platform platform,
        Path downloadPath,
        String altCredential,
        String proxy,
        String proxyTiktok,
        int maxRetry,
        int chunk,
        int timeoutSeconds,
        String storageFormat,
        boolean download,
        boolean dynamicCover,
        boolean staticCover,
        boolean music,
        boolean folderMode,
        AccountTab accountTab,
        String searchKeyword,
        SearchType searchType,
        int maxPages
) {

    static final int DEFAULT_MAX_RETRY = 5;
    static final int DEFAULT_CHUNK = 131_072;
    static final int DEFAULT_TIMEOUT_SECONDS = 10;
    static final int DEFAULT_MAX_PAGES = 1;

    public static DispatchOptions defaults(Path downloadRoot) {
        return new DispatchOptions(Platform.DOUYIN, downloadRoot, "", null, null,
                DEFAULT_MAX_RETRY, DEFAULT_CHUNK, DEFAULT_TIMEOUT_SECONDS, "",
                true, false, false, false, false,
                AccountTab.POST, "", SearchType.GENERAL, DEFAULT_MAX_PAGES);
    }

    /**
     * Parses the raw option map.
     *
     * @param options     raw options, may be null
     * @param downloadRoot root used when {@code download_path} is absent
     */
    public static DispatchOptions from(Map<String, Object> options, Path downloadRoot)
            throws ValidationException {
        Map<String, Object> raw = options == null ? Map.of() : options;

        boolean tiktok = bool(raw, "tiktok", false);
        String path = string(raw, "download_path", null);
        String accountTabValue = string(raw, "account_tab", AccountTab.POST.value());
        AccountTab accountTab = AccountTab.fromValue(accountTabValue)
                .orElseThrow(() -> invalid("account_tab must be one of post, favorite, collection (got '"
                        + accountTabValue + "')"));

        return new DispatchOptions(
                Platform.fromFlag(tiktok),
                path == null || path.isBlank() ? downloadRoot : downloadPath(path),
                string(raw, "cookie_tiktok", ""),
                proxy(raw, "proxy"),
                proxy(raw, "proxy_tiktok"),
                integer(raw, "max_retry", DEFAULT_MAX_RETRY, 0),
                integer(raw, "chunk", DEFAULT_CHUNK, 1),
                integer(raw, "timeout", DEFAULT_TIMEOUT_SECONDS, 1),
                string(raw, "storage_format", "").trim(),
                bool(raw, "download", true),
                bool(raw, "dynamic_cover", false),
                bool(raw, "static_cover", false),
                bool(raw, "music", false),
                bool(raw, "folder_mode", false),
                accountTab,
                string(raw, "search_keyword", ""),
                SearchType.fromValue(string(raw, "search_type", SearchType.GENERAL.value())),
                integer(raw, "max_pages", DEFAULT_MAX_PAGES, 1)
        );
    }

    /**
     * Proxy for the selected platform.
     */
    public String effectiveProxy() {
        return platform == Platform.TIKTOK ? proxyTiktok : proxy;
    }

    /**
     * Options forwarded verbatim to the fetch backend.
     */
    public Map<String, Object> backendParameters() {
        return Map.ofEntries(
                Map.entry("download", download),
                Map.entry("dynamic_cover", dynamicCover),
                Map.entry("static_cover", staticCover),
                Map.entry("music", music),
                Map.entry("folder_mode", folderMode),
                Map.entry("chunk", chunk),
                Map.entry("max_pages", maxPages),
                Map.entry("account_tab", accountTab.value()),
                Map.entry("search_type", searchType.value()),
                Map.entry("download_path", downloadPath.toString())
        );
    }

    // -------------------------------------------------------------------------
    // Coercion helpers
    // -------------------------------------------------------------------------

    private static boolean bool(Map<String, Object> raw, String key, boolean fallback)
            throws ValidationException {
        Object value = raw.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            if ("true".equalsIgnoreCase(s.trim())) {
                return true;
            }
            if ("false".equalsIgnoreCase(s.trim())) {
                return false;
            }
        }
        throw invalid(key + " must be a boolean (got '" + value + "')");
    }

    private static int integer(Map<String, Object> raw, String key, int fallback, int min)
            throws ValidationException {
        Object value = raw.get(key);
        if (value == null) {
            return fallback;
        }
        long parsed;
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            parsed = ((Number) value).longValue();
        } else if (value instanceof String s) {
            try {
                parsed = Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                throw invalid(key + " must be an integer (got '" + value + "')");
            }
        } else {
            throw invalid(key + " must be an integer (got '" + value + "')");
        }
        if (parsed > Integer.MAX_VALUE) {
            throw invalid(key + " must be at most " + Integer.MAX_VALUE + " (got " + parsed + ")");
        }
        if (parsed < min) {
            throw invalid(key + " must be at least " + min + " (got " + parsed + ")");
        }
        return (int) parsed;
    }

    private static String string(Map<String, Object> raw, String key, String fallback)
            throws ValidationException {
        Object value = raw.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof String s) {
            return s;
        }
        throw invalid(key + " must be a string (got '" + value + "')");
    }

    private static Path downloadPath(String value) throws ValidationException {
        try {
            return Path.of(value.trim());
        } catch (InvalidPathException e) {
            throw invalid("download_path is not a valid path (" + e.getReason() + ")");
        }
    }

    /**
     * Accepts {@code host:port} or {@code scheme://host:port}.
     */
    private static String proxy(Map<String, Object> raw, String key) throws ValidationException {
        String value = blankToNull(string(raw, key, null));
        if (value == null) {
            return null;
        }
        URI uri;
        try {
            uri = new URI(value.contains("://") ? value : "http://" + value);
        } catch (URISyntaxException e) {
            throw invalid(key + " is not a valid proxy URL (got '" + value + "')");
        }
        if (uri.getHost() == null || uri.getPort() < 0) {
            throw invalid(key + " must include host and port (got '" + value + "')");
        }
        return value;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static ValidationException invalid(String message) {
        return new ValidationException(ValidationError.Kind.INVALID_OPTION, "Invalid option: " + message);
    }
}
