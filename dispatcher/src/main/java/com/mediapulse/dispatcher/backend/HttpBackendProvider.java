package com.mediapulse.dispatcher.backend;

import com.mediapulse.dispatcher.model.DispatchOptions;
import com.mediapulse.dispatcher.model.Platform;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.URI;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Opens an {@link HttpContentBackend} per call, configured from the call's
 * timeout, retry count and platform proxy.
 */
public class HttpBackendProvider implements BackendProvider {

    private static final Logger logger = LoggerFactory.getLogger(HttpBackendProvider.class);

    private final HttpUrl baseUrl;

    public HttpBackendProvider(String baseUrl) {
        HttpUrl parsed = HttpUrl.parse(baseUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid backend URL: " + baseUrl);
        }
        this.baseUrl = parsed;
    }

    @Override
    public ContentBackend open(Platform platform, String credential, DispatchOptions options) {
        OkHttpClient.Builder builder = new OkHttpClient.Builder()
                .connectTimeout(options.timeoutSeconds(), TimeUnit.SECONDS)
                .readTimeout(options.timeoutSeconds(), TimeUnit.SECONDS)
                .writeTimeout(options.timeoutSeconds(), TimeUnit.SECONDS);

        String proxy = options.effectiveProxy();
        if (proxy != null) {
            builder.proxy(toProxy(proxy));
            logger.debug("Routing {} traffic through proxy {}", platform.wireName(), proxy);
        }

        return new HttpContentBackend(baseUrl, platform, credential, options.maxRetry(), builder.build());
    }

    /**
     * Accepts {@code host:port}, {@code http://host:port} or {@code socks5://host:port}.
     */
    static Proxy toProxy(String value) {
        URI uri = URI.create(value.contains("://") ? value : "http://" + value);
        if (uri.getHost() == null || uri.getPort() < 0) {
            throw new IllegalArgumentException("Proxy must include host and port: " + value);
        }
        String scheme = uri.getScheme() == null ? "http" : uri.getScheme().toLowerCase(Locale.ROOT);
        Proxy.Type type = scheme.startsWith("socks") ? Proxy.Type.SOCKS : Proxy.Type.HTTP;
        return new Proxy(type, InetSocketAddress.createUnresolved(uri.getHost(), uri.getPort()));
    }
}
