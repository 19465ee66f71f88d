package com.mediapulse.dispatcher.action;

import com.mediapulse.dispatcher.backend.FetchOperation;
import com.mediapulse.dispatcher.backend.LinkKind;
import com.mediapulse.dispatcher.executor.CountingMode;
import com.mediapulse.dispatcher.model.InvocationRequest;
import com.mediapulse.dispatcher.model.Platform;
import com.mediapulse.dispatcher.model.ValidationError;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed table of supported actions, keyed by action name in registration
 * order. Read-only once built.
 */
public class ActionRegistry {

    public static final String DETAIL = "detail";
    public static final String DETAIL_UNOFFICIAL = "detail_unofficial";
    public static final String ACCOUNT = "account";
    public static final String LIVE = "live";
    public static final String COMMENT = "comment";
    public static final String MIX = "mix";
    public static final String USER = "user";
    public static final String SEARCH = "search";
    public static final String HOT = "hot";
    public static final String COLLECTION = "collection";
    public static final String COLLECTION_MUSIC = "collection_music";
    public static final String COLLECTS = "collects";

    static final String KEYWORD_OPTION = "search_keyword";
    static final String PLATFORM_OPTION = "tiktok";

    private static final Set<Platform> ALL_PLATFORMS = Set.of();
    private static final Set<Platform> NOT_ON_TIKTOK = Set.of(Platform.TIKTOK);

    private final Map<String, ActionSpec> specs;

    public ActionRegistry(List<ActionSpec> specs) {
        Map<String, ActionSpec> byName = new LinkedHashMap<>();
        for (ActionSpec spec : specs) {
            if (byName.putIfAbsent(spec.name(), spec) != null) {
                throw new IllegalArgumentException("Duplicate action: " + spec.name());
            }
        }
        this.specs = Collections.unmodifiableMap(byName);
    }

    /**
     * The registry with every built-in action.
     */
    public static ActionRegistry defaultRegistry() {
        return new ActionRegistry(List.of(
                new ActionSpec(DETAIL, InputKind.URLS, ALL_PLATFORMS, CountingMode.ITEM,
                        SessionScope.INVOCATION, "works",
                        new UrlBatchHandler(UrlBatchHandler.identifiers(LinkKind.WORK),
                                FetchOperation.DETAIL, true)),
                new ActionSpec(DETAIL_UNOFFICIAL, InputKind.URLS, ALL_PLATFORMS, CountingMode.ITEM,
                        SessionScope.INVOCATION, "works",
                        new UrlBatchHandler(UrlBatchHandler.identifiers(LinkKind.WORK),
                                FetchOperation.DETAIL_UNOFFICIAL, true)),
                new ActionSpec(ACCOUNT, InputKind.URLS, ALL_PLATFORMS, CountingMode.ITEM,
                        SessionScope.PER_ITEM, "accounts",
                        new UrlBatchHandler(UrlBatchHandler.firstAccountTarget(),
                                FetchOperation.ACCOUNT_WORKS, true)),
                new ActionSpec(LIVE, InputKind.URLS, ALL_PLATFORMS, CountingMode.ITEM,
                        SessionScope.NONE, "live streams",
                        new UrlBatchHandler(UrlBatchHandler.identifiers(LinkKind.LIVE),
                                FetchOperation.LIVE, true)),
                new ActionSpec(COMMENT, InputKind.URLS, NOT_ON_TIKTOK, CountingMode.IDENTIFIER,
                        SessionScope.INVOCATION, "works' comments",
                        new UrlBatchHandler(UrlBatchHandler.identifiers(LinkKind.WORK),
                                FetchOperation.COMMENTS, false)),
                new ActionSpec(MIX, InputKind.URLS, ALL_PLATFORMS, CountingMode.ITEM,
                        SessionScope.PER_ITEM, "mixes",
                        new UrlBatchHandler(UrlBatchHandler.identifiers(LinkKind.MIX),
                                FetchOperation.MIX, true)),
                new ActionSpec(USER, InputKind.URLS, NOT_ON_TIKTOK, CountingMode.IDENTIFIER,
                        SessionScope.INVOCATION, "user profiles",
                        new UrlBatchHandler(UrlBatchHandler.accountTargets(),
                                FetchOperation.ACCOUNT_DETAIL, false)),
                new ActionSpec(SEARCH, InputKind.KEYWORD, NOT_ON_TIKTOK, CountingMode.IDENTIFIER,
                        SessionScope.INVOCATION, "search results",
                        new SingleFetchHandler(FetchOperation.SEARCH)),
                new ActionSpec(HOT, InputKind.NONE, NOT_ON_TIKTOK, CountingMode.IDENTIFIER,
                        SessionScope.INVOCATION, "hot list entries",
                        new SingleFetchHandler(FetchOperation.HOT)),
                new ActionSpec(COLLECTION, InputKind.NONE, NOT_ON_TIKTOK, CountingMode.IDENTIFIER,
                        SessionScope.INVOCATION, "collected works",
                        new SingleFetchHandler(FetchOperation.COLLECTION)),
                new ActionSpec(COLLECTION_MUSIC, InputKind.NONE, NOT_ON_TIKTOK, CountingMode.IDENTIFIER,
                        SessionScope.INVOCATION, "collected tracks",
                        new SingleFetchHandler(FetchOperation.COLLECTION_MUSIC)),
                new ActionSpec(COLLECTS, InputKind.URLS, NOT_ON_TIKTOK, CountingMode.IDENTIFIER,
                        SessionScope.INVOCATION, "collection folders",
                        new UrlBatchHandler(UrlBatchHandler.identifiers(LinkKind.COLLECTS),
                                FetchOperation.COLLECTS, false))
        ));
    }

    public Optional<ActionSpec> lookup(String name) {
        return Optional.ofNullable(name == null ? null : specs.get(name));
    }

    public Collection<String> supportedActions() {
        return specs.keySet();
    }

    /**
     * Checks that the action exists, that its required input is present and that
     * it is allowed on the requested platform. Has no side effects.
     *
     * @return the first failed check, or empty when the request may proceed
     */
    public Optional<ValidationError> validate(InvocationRequest request) {
        ActionSpec spec = specs.get(request.action());
        if (spec == null) {
            return Optional.of(new ValidationError(ValidationError.Kind.UNKNOWN_ACTION,
                    "Unknown action '" + request.action() + "'. Supported actions: "
                            + String.join(", ", supportedActions())));
        }

        if (spec.inputKind() == InputKind.URLS && isEmptyInput(request.inputs())) {
            return Optional.of(new ValidationError(ValidationError.Kind.MISSING_REQUIRED_INPUT,
                    "Action '" + spec.name() + "' requires the " + InvocationRequest.URLS_OPTION + " option"));
        }
        if (spec.inputKind() == InputKind.KEYWORD && isEmptyInput(request.options().get(KEYWORD_OPTION))) {
            return Optional.of(new ValidationError(ValidationError.Kind.MISSING_REQUIRED_INPUT,
                    "Action '" + spec.name() + "' requires the " + KEYWORD_OPTION + " option"));
        }

        Platform platform = requestedPlatform(request);
        if (!spec.supports(platform)) {
            return Optional.of(new ValidationError(ValidationError.Kind.PLATFORM_UNSUPPORTED,
                    "Action '" + spec.name() + "' is not supported on the " + platform.wireName() + " platform"));
        }
        return Optional.empty();
    }

    /**
     * Reads the platform flag leniently; strict type checking of options happens
     * later, when the option bag is parsed.
     */
    static Platform requestedPlatform(InvocationRequest request) {
        Object flag = request.options().get(PLATFORM_OPTION);
        boolean tiktok = Boolean.TRUE.equals(flag)
                || (flag instanceof String s && "true".equalsIgnoreCase(s.trim()));
        return Platform.fromFlag(tiktok);
    }

    private static boolean isEmptyInput(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String s) {
            return s.isBlank();
        }
        if (value instanceof Collection<?> c) {
            return c.isEmpty();
        }
        return false;
    }
}
