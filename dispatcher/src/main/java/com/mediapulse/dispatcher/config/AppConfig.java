package com.mediapulse.dispatcher.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Reads dispatcher settings from environment variables, falling back to a
 * {@code .env} file through dotenv-java. Missing required variables are all
 * reported at once on startup.
 */
public class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);

    static final String DEFAULT_DOWNLOAD_ROOT = "downloads";

    private final String backendUrl;
    private final String cookie;
    private final String cookieTiktok;
    private final Path downloadRoot;
    private final String gcpProjectId;

    public AppConfig() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();

        this.backendUrl = resolve(dotenv, "MEDIAPULSE_BACKEND_URL");
        this.cookie = resolve(dotenv, "MEDIAPULSE_COOKIE");
        this.cookieTiktok = resolveOptional(dotenv, "MEDIAPULSE_COOKIE_TIKTOK");
        String root = resolveOptional(dotenv, "MEDIAPULSE_DOWNLOAD_ROOT");
        this.downloadRoot = Path.of(isBlank(root) ? DEFAULT_DOWNLOAD_ROOT : root.trim());
        this.gcpProjectId = resolveOptional(dotenv, "GCP_PROJECT_ID");

        validate();

        logger.info("Configuration loaded: backendUrl={}, downloadRoot={}, gcpProjectId={}",
                backendUrl, downloadRoot, gcpProjectId != null ? gcpProjectId : "none");
    }

    /**
     * Constructor for testing; accepts values directly.
     */
    public AppConfig(String backendUrl, String cookie, String cookieTiktok,
                     Path downloadRoot, String gcpProjectId) {
        this.backendUrl = backendUrl;
        this.cookie = cookie;
        this.cookieTiktok = cookieTiktok;
        this.downloadRoot = downloadRoot != null ? downloadRoot : Path.of(DEFAULT_DOWNLOAD_ROOT);
        this.gcpProjectId = gcpProjectId;

        validate();
    }

    private void validate() {
        StringBuilder missing = new StringBuilder();
        if (isBlank(backendUrl)) missing.append("MEDIAPULSE_BACKEND_URL ");
        if (isBlank(cookie)) missing.append("MEDIAPULSE_COOKIE ");

        if (!missing.isEmpty()) {
            throw new IllegalStateException(
                    "Missing required environment variables: " + missing.toString().trim());
        }
    }

    private static String resolve(Dotenv dotenv, String key) {
        String value = resolveOptional(dotenv, key);
        return value != null ? value : "";
    }

    private static String resolveOptional(Dotenv dotenv, String key) {
        String envValue = System.getenv(key);
        if (envValue != null && !envValue.isBlank()) {
            return envValue;
        }
        return dotenv.get(key);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public String getBackendUrl() {
        return backendUrl;
    }

    public String getCookie() {
        return cookie;
    }

    public String getCookieTiktok() {
        return cookieTiktok;
    }

    public Path getDownloadRoot() {
        return downloadRoot;
    }

    public String getGcpProjectId() {
        return gcpProjectId;
    }

    public boolean hasGcpProject() {
        return !isBlank(gcpProjectId);
    }
}
