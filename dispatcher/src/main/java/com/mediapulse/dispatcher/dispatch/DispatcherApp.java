package com.mediapulse.dispatcher.dispatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mediapulse.dispatcher.action.ActionRegistry;
import com.mediapulse.dispatcher.backend.HttpBackendProvider;
import com.mediapulse.dispatcher.config.AppConfig;
import com.mediapulse.dispatcher.model.BatchResult;
import com.mediapulse.dispatcher.model.InvocationRequest;
import com.mediapulse.dispatcher.recorder.BigQueryRecorderFactory;
import com.mediapulse.dispatcher.recorder.NoOpRecorderFactory;
import com.mediapulse.dispatcher.recorder.StorageFormatRecorderFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command-line entry point. Runs one action and prints its result as JSON.
 *
 * <p>Usage:
 * <pre>
 *   java -jar dispatcher.jar detail --url https://v.douyin.com/abc/ --url https://v.douyin.com/def/
 *   java -jar dispatcher.jar search --keyword cats --option max_pages=3
 *   java -jar dispatcher.jar account --tiktok --url https://www.tiktok.com/@someone
 * </pre>
 * Exits 0 when the result is successful, 1 otherwise.</p>
 */
public class DispatcherApp {

    private static final Logger logger = LoggerFactory.getLogger(DispatcherApp.class);

    static final String USAGE =
            "Usage: dispatcher <action> [--url U]... [--keyword K] [--tiktok] [--option key=value]...";

    public static void main(String[] args) {
        try {
            CliArguments cli = parseArgs(args);
            AppConfig config = new AppConfig();

            ActionDispatcher dispatcher = new ActionDispatcher(
                    ActionRegistry.defaultRegistry(),
                    new HttpBackendProvider(config.getBackendUrl()),
                    new StorageFormatRecorderFactory(new NoOpRecorderFactory(),
                            config.hasGcpProject() ? new BigQueryRecorderFactory(config.getGcpProjectId()) : null),
                    config.getDownloadRoot());

            Map<String, Object> options = withConfiguredAltCookie(cli.options(), config.getCookieTiktok());
            BatchResult result = dispatcher.dispatch(cli.action(), config.getCookie(), options);

            System.out.println(new ObjectMapper()
                    .writerWithDefaultPrettyPrinter()
                    .writeValueAsString(result));
            System.exit(result.success() ? 0 : 1);

        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            System.exit(1);
        } catch (Exception e) {
            logger.error("Fatal error during dispatch", e);
            System.exit(1);
        }
    }

    static CliArguments parseArgs(String[] args) {
        if (args.length == 0 || args[0].startsWith("--")) {
            throw new IllegalArgumentException("An action name is required");
        }

        String action = args[0];
        List<String> urls = new ArrayList<>();
        Map<String, Object> options = new LinkedHashMap<>();

        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--url" -> urls.add(valueAfter(args, ++i, arg));
                case "--keyword" -> options.put("search_keyword", valueAfter(args, ++i, arg));
                case "--tiktok" -> options.put("tiktok", true);
                case "--option" -> {
                    String pair = valueAfter(args, ++i, arg);
                    int eq = pair.indexOf('=');
                    if (eq <= 0) {
                        throw new IllegalArgumentException("--option expects key=value, got '" + pair + "'");
                    }
                    options.put(pair.substring(0, eq).trim(), pair.substring(eq + 1));
                }
                default -> throw new IllegalArgumentException("Unknown argument: " + arg);
            }
        }

        if (!urls.isEmpty()) {
            options.put(InvocationRequest.URLS_OPTION, List.copyOf(urls));
        }
        return new CliArguments(action, options);
    }

    static Map<String, Object> withConfiguredAltCookie(Map<String, Object> options, String cookieTiktok) {
        if (cookieTiktok == null || cookieTiktok.isBlank()
                || options.containsKey(InvocationRequest.ALT_CREDENTIAL_OPTION)) {
            return options;
        }
        Map<String, Object> merged = new LinkedHashMap<>(options);
        merged.put(InvocationRequest.ALT_CREDENTIAL_OPTION, cookieTiktok);
        return merged;
    }

    private static String valueAfter(String[] args, int index, String flag) {
        if (index >= args.length) {
            throw new IllegalArgumentException(flag + " requires a value");
        }
        return args[index];
    }
}
