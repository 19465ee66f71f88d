package com.mediapulse.dispatcher.backend;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mediapulse.dispatcher.model.FetchedItem;
import com.mediapulse.dispatcher.model.Platform;
import com.mediapulse.dispatcher.recorder.RecordingSession;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ContentBackend} talking JSON over HTTP to the extraction and fetch
 * service.
 *
 * <p>Endpoints:
 * <pre>
 *   POST /api/v1/links/extract        {"platform", "url", "kind"}          -> {"ids": [...]}
 *   POST /api/v1/fetch/{operation}    {"platform", "ids", "keyword", ...} -> {"items": [...]}
 * </pre>
 * The platform credential travels as the {@code Cookie} header. Responses with
 * status 429 or 503 are retried with exponential backoff, honoring
 * {@code Retry-After}. Other non-2xx responses fail the call with the
 * {@code message} field of the error body when there is one.</p>
 *
 * <p>One instance serves one dispatch call and owns its {@link OkHttpClient};
 * {@link #close()} releases the client's threads and pooled connections.</p>
 */
public class HttpContentBackend implements ContentBackend {

    private static final Logger logger = LoggerFactory.getLogger(HttpContentBackend.class);

    static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    static final String EXTRACT_PATH = "api/v1/links/extract";
    static final String FETCH_PATH = "api/v1/fetch";
    static final String ACCOUNT_KIND = "account";

    private static final long DEFAULT_INITIAL_BACKOFF_MS = 1_000;
    private static final long MAX_BACKOFF_MS = 60_000;

    private final HttpUrl baseUrl;
    private final Platform platform;
    private final String credential;
    private final int maxRetries;
    private final long initialBackoffMs;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpContentBackend(HttpUrl baseUrl, Platform platform, String credential, int maxRetries,
                              OkHttpClient httpClient) {
        this(baseUrl, platform, credential, maxRetries, httpClient, DEFAULT_INITIAL_BACKOFF_MS);
    }

    // Visible for testing
    HttpContentBackend(HttpUrl baseUrl, Platform platform, String credential, int maxRetries,
                       OkHttpClient httpClient, long initialBackoffMs) {
        this.baseUrl = baseUrl;
        this.platform = platform;
        this.credential = credential;
        this.maxRetries = maxRetries;
        this.httpClient = httpClient;
        this.initialBackoffMs = initialBackoffMs;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    // -------------------------------------------------------------------------
    // LinkExtractor
    // -------------------------------------------------------------------------

    @Override
    public List<String> extractIdentifiers(String url, LinkKind kind) throws ExtractionException {
        return extract(url, kind.wireName());
    }

    @Override
    public List<String> extractAccountTargets(String url) throws ExtractionException {
        return extract(url, ACCOUNT_KIND);
    }

    private List<String> extract(String url, String kind) throws ExtractionException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("platform", platform.wireName());
        payload.put("url", url);
        payload.put("kind", kind);

        try {
            String body = post(baseUrl.newBuilder().addPathSegments(EXTRACT_PATH).build(), payload);
            ExtractResponse response = objectMapper.readValue(body, ExtractResponse.class);
            List<String> ids = response.ids() == null ? List.of() : response.ids();
            logger.debug("Extracted {} {} id(s) from {}", ids.size(), kind, url);
            return ids;
        } catch (BackendResponseException e) {
            throw new ExtractionException(e.getMessage(), e);
        } catch (IOException e) {
            throw new ExtractionException("Link extraction failed for " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionException("Interrupted while extracting " + url, e);
        }
    }

    // -------------------------------------------------------------------------
    // ContentFetcher
    // -------------------------------------------------------------------------

    @Override
    public List<FetchedItem> fetchBatch(FetchOperation operation, FetchQuery query, RecordingSession session)
            throws FetchException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("platform", platform.wireName());
        payload.put("ids", query.ids());
        if (query.keyword() != null) {
            payload.put("keyword", query.keyword());
        }
        payload.put("parameters", query.parameters());

        HttpUrl url = baseUrl.newBuilder()
                .addPathSegments(FETCH_PATH)
                .addPathSegment(operation.wireName())
                .build();
        try {
            String body = post(url, payload);
            FetchResponse response = objectMapper.readValue(body, FetchResponse.class);
            List<FetchedItem> items = response.items() == null ? List.of() : response.items();
            session.recordFetched(operation, items);
            return items;
        } catch (BackendResponseException e) {
            throw new FetchException(e.getMessage(), e);
        } catch (IOException e) {
            throw new FetchException(operation.wireName() + " fetch failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException("Interrupted during " + operation.wireName() + " fetch", e);
        }
    }

    @Override
    public void close() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }

    // -------------------------------------------------------------------------
    // HTTP execution with retries
    // -------------------------------------------------------------------------

    private String post(HttpUrl url, Map<String, Object> payload) throws IOException, InterruptedException {
        Request request = new Request.Builder()
                .url(url)
                .header("Cookie", credential)
                .header("Accept", "application/json")
                .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON))
                .build();
        return executeWithRetry(request);
    }

    /**
     * Executes a request, retrying 429/503 responses up to {@code maxRetries}
     * times.
     */
    String executeWithRetry(Request request) throws IOException, InterruptedException {
        long backoffMs = initialBackoffMs;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try (Response response = httpClient.newCall(request).execute()) {
                int statusCode = response.code();
                logger.info("Backend {} {}", statusCode, request.url().encodedPath());

                if (statusCode == 429 || statusCode == 503) {
                    if (attempt == maxRetries) {
                        throw new BackendResponseException("Max retries exceeded for "
                                + request.url().encodedPath() + " (last status: " + statusCode + ")");
                    }
                    long waitMs = getRetryWaitMs(response, backoffMs);
                    logger.warn("Received {} from {}. Retrying in {}ms (attempt {}/{})",
                            statusCode, request.url().encodedPath(), waitMs, attempt + 1, maxRetries);
                    Thread.sleep(waitMs);
                    backoffMs = Math.min(backoffMs * 2, MAX_BACKOFF_MS);
                    continue;
                }

                ResponseBody body = response.body();
                String bodyString = body != null ? body.string() : "";

                if (statusCode < 200 || statusCode >= 300) {
                    throw new BackendResponseException(errorMessage(statusCode, bodyString));
                }
                return bodyString.isEmpty() ? "{}" : bodyString;
            }
        }

        throw new IOException("Exhausted retries for " + request.url().encodedPath());
    }

    /**
     * Retry-After in seconds when present, clamped to the maximum backoff;
     * otherwise the current backoff.
     */
    long getRetryWaitMs(Response response, long backoffMs) {
        String retryAfter = response.header("Retry-After");
        if (retryAfter != null) {
            try {
                long seconds = Long.parseLong(retryAfter.trim());
                return Math.max(0, Math.min(seconds, MAX_BACKOFF_MS / 1_000)) * 1_000;
            } catch (NumberFormatException e) {
                logger.debug("Ignoring non-numeric Retry-After '{}'", retryAfter);
            }
        }
        return backoffMs;
    }

    String errorMessage(int statusCode, String body) {
        if (!body.isBlank()) {
            try {
                JsonNode message = objectMapper.readTree(body).path("message");
                if (message.isTextual() && !message.asText().isBlank()) {
                    return message.asText();
                }
            } catch (IOException e) {
                logger.debug("Error body for status {} is not JSON", statusCode);
            }
        }
        return "Backend error: " + statusCode;
    }

    // -------------------------------------------------------------------------
    // Wire types
    // -------------------------------------------------------------------------

    record ExtractResponse(List<String> ids) {}

    record FetchResponse(List<FetchedItem> items) {}

    /**
     * A response the backend answered deliberately with an error; its message is
     * already fit for the caller.
     */
    static class BackendResponseException extends IOException {
        BackendResponseException(String message) {
            super(message);
        }
    }
}
