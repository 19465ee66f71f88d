package com.mediapulse.dispatcher.dispatch;

import com.mediapulse.dispatcher.action.ActionContext;
import com.mediapulse.dispatcher.action.ActionRegistry;
import com.mediapulse.dispatcher.action.ActionSpec;
import com.mediapulse.dispatcher.backend.BackendProvider;
import com.mediapulse.dispatcher.backend.ContentBackend;
import com.mediapulse.dispatcher.executor.BatchExecutor;
import com.mediapulse.dispatcher.executor.ResultAggregator;
import com.mediapulse.dispatcher.input.InputNormalizer;
import com.mediapulse.dispatcher.input.NormalizedInputs;
import com.mediapulse.dispatcher.model.BatchResult;
import com.mediapulse.dispatcher.model.DispatchOptions;
import com.mediapulse.dispatcher.model.InvocationRequest;
import com.mediapulse.dispatcher.model.Platform;
import com.mediapulse.dispatcher.model.ValidationError;
import com.mediapulse.dispatcher.model.ValidationException;
import com.mediapulse.dispatcher.recorder.RecorderFactory;
import com.mediapulse.dispatcher.recorder.ScopedRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Single entry point for running an action: validates the request, opens a
 * backend for the selected platform, runs the action's handler and returns a
 * {@link BatchResult}.
 *
 * <p>{@link #dispatch(InvocationRequest)} never throws. Validation problems and
 * fatal errors both come back as a failed result whose message describes the
 * problem. Holds no per-call state, so one instance may serve many calls.</p>
 */
public class ActionDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(ActionDispatcher.class);

    private final ActionRegistry registry;
    private final BackendProvider backendProvider;
    private final RecorderFactory recorderFactory;
    private final Path downloadRoot;
    private final InputNormalizer normalizer;
    private final BatchExecutor executor;
    private final ResultAggregator aggregator;

    public ActionDispatcher(ActionRegistry registry, BackendProvider backendProvider,
                            RecorderFactory recorderFactory, Path downloadRoot) {
        this(registry, backendProvider, recorderFactory, downloadRoot,
                new InputNormalizer(), new BatchExecutor(), new ResultAggregator());
    }

    // Visible for testing
    ActionDispatcher(ActionRegistry registry, BackendProvider backendProvider,
                     RecorderFactory recorderFactory, Path downloadRoot,
                     InputNormalizer normalizer, BatchExecutor executor, ResultAggregator aggregator) {
        this.registry = registry;
        this.backendProvider = backendProvider;
        this.recorderFactory = recorderFactory;
        this.downloadRoot = downloadRoot;
        this.normalizer = normalizer;
        this.executor = executor;
        this.aggregator = aggregator;
    }

    /**
     * Convenience overload taking the flat option map, where {@code urls} and
     * {@code cookie_tiktok} travel with the other options.
     */
    public BatchResult dispatch(String action, String credential, Map<String, Object> options) {
        return dispatch(InvocationRequest.of(action, credential, options));
    }

    public BatchResult dispatch(InvocationRequest request) {
        Optional<ValidationError> rejected = registry.validate(request);
        if (rejected.isPresent()) {
            return rejectedResult(request, rejected.get());
        }
        ActionSpec spec = registry.lookup(request.action()).orElseThrow();

        DispatchOptions options;
        NormalizedInputs inputs;
        String credential;
        try {
            options = DispatchOptions.from(request.options(), downloadRoot);
            inputs = normalize(spec, request, options);
            credential = credentialFor(request, options);
        } catch (ValidationException e) {
            return rejectedResult(request, e.getError());
        }

        logger.info("Dispatching '{}' on {} with {} input(s)",
                spec.name(), options.platform().wireName(), inputs.size());
        long start = System.currentTimeMillis();

        ContentBackend backend = null;
        try {
            backend = backendProvider.open(options.platform(), credential, options);
            ScopedRecorder recorder = new ScopedRecorder(recorderFactory, options.downloadPath(), options);
            ActionContext context = new ActionContext(spec, inputs, options, backend, recorder,
                    executor, aggregator);

            BatchResult result = spec.handler().handle(context);
            logger.info("Action '{}' finished in {}ms: {} (downloaded={}, failed={})",
                    spec.name(), System.currentTimeMillis() - start, result.message(),
                    result.downloadedCount(), result.failedCount());
            return result;
        } catch (Exception e) {
            logger.error("Action '{}' failed", spec.name(), e);
            return BatchResult.failure(BatchExecutor.errorText(e));
        } finally {
            closeQuietly(spec, backend);
        }
    }

    private NormalizedInputs normalize(ActionSpec spec, InvocationRequest request, DispatchOptions options)
            throws ValidationException {
        return switch (spec.inputKind()) {
            case URLS -> normalizer.normalize(request.inputs());
            case KEYWORD -> normalizer.normalizeKeyword(options.searchKeyword());
            case NONE -> NormalizedInputs.none();
        };
    }

    /**
     * The alternate credential is used on TikTok when one was given; otherwise
     * the primary credential applies.
     */
    static String credentialFor(InvocationRequest request, DispatchOptions options)
            throws ValidationException {
        String credential = request.primaryCredential();
        if (options.platform() == Platform.TIKTOK) {
            String alt = isBlank(request.altCredential()) ? options.altCredential() : request.altCredential();
            if (!isBlank(alt)) {
                credential = alt;
            }
        }
        if (isBlank(credential)) {
            throw new ValidationException(ValidationError.Kind.MISSING_CREDENTIAL,
                    "A cookie is required for the " + options.platform().wireName() + " platform");
        }
        return credential.trim();
    }

    private static BatchResult rejectedResult(InvocationRequest request, ValidationError error) {
        logger.warn("Rejected '{}': {} ({})", request.action(), error.message(), error.kind());
        return BatchResult.failure(error.message());
    }

    private static void closeQuietly(ActionSpec spec, ContentBackend backend) {
        if (backend == null) {
            return;
        }
        try {
            backend.close();
        } catch (RuntimeException e) {
            logger.error("Failed to close backend after '{}'", spec.name(), e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
