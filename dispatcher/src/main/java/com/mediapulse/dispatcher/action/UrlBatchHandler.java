package com.mediapulse.dispatcher.action;

import com.mediapulse.dispatcher.backend.ContentBackend;
import com.mediapulse.dispatcher.backend.ExtractionException;
import com.mediapulse.dispatcher.backend.FetchException;
import com.mediapulse.dispatcher.backend.FetchOperation;
import com.mediapulse.dispatcher.backend.FetchQuery;
import com.mediapulse.dispatcher.backend.LinkExtractor;
import com.mediapulse.dispatcher.backend.LinkKind;
import com.mediapulse.dispatcher.executor.ItemPipeline;
import com.mediapulse.dispatcher.model.BatchResult;
import com.mediapulse.dispatcher.model.FetchedItem;
import com.mediapulse.dispatcher.model.ItemOutcome;
import com.mediapulse.dispatcher.recorder.RecordingSession;

import java.util.List;
import java.util.Map;

/**
 * Handler for URL-driven actions: each URL is extracted to identifiers and
 * those identifiers are fetched with one {@link FetchOperation}.
 */
public class UrlBatchHandler implements ActionHandler {

    static final String NO_CONTENT = "no content fetched";

    /**
     * How identifiers are pulled out of one URL.
     */
    @FunctionalInterface
    public interface Extraction {
        List<String> apply(LinkExtractor extractor, String url) throws ExtractionException;
    }

    public static Extraction identifiers(LinkKind kind) {
        return (extractor, url) -> extractor.extractIdentifiers(url, kind);
    }

    public static Extraction accountTargets() {
        return LinkExtractor::extractAccountTargets;
    }

    /**
     * Only the first account found in a link is processed.
     */
    public static Extraction firstAccountTarget() {
        return (extractor, url) -> {
            List<String> targets = extractor.extractAccountTargets(url);
            return targets == null || targets.isEmpty() ? List.of() : List.of(targets.get(0));
        };
    }

    private final Extraction extraction;
    private final FetchOperation operation;
    private final boolean requireContent;

    /**
     * @param requireContent when true an empty fetch fails the item
     */
    public UrlBatchHandler(Extraction extraction, FetchOperation operation, boolean requireContent) {
        this.extraction = extraction;
        this.operation = operation;
        this.requireContent = requireContent;
    }

    @Override
    public BatchResult handle(ActionContext context) throws Exception {
        List<String> items = context.inputs().items();
        ItemPipeline pipeline = pipeline(context.backend(), context.options().backendParameters());

        List<ItemOutcome> outcomes = switch (context.spec().sessionScope()) {
            case INVOCATION -> context.recorder().withSession(
                    session -> context.executor().runBatch(items, pipeline, session));
            case PER_ITEM -> context.executor().runBatchWithSessionPerItem(items, pipeline, context.recorder());
            case NONE -> context.executor().runBatch(items, pipeline, RecordingSession.NONE);
        };

        ActionSpec spec = context.spec();
        return context.aggregator().aggregate(outcomes, spec.countingMode(), spec.noun());
    }

    private ItemPipeline pipeline(ContentBackend backend, Map<String, Object> parameters) {
        return new ItemPipeline() {
            @Override
            public List<String> extract(String input) throws ExtractionException {
                return extraction.apply(backend, input);
            }

            @Override
            public int fetch(String input, List<String> ids, RecordingSession session) throws FetchException {
                List<FetchedItem> fetched = backend.fetchBatch(operation,
                        FetchQuery.ofIds(ids, parameters), session);
                if (requireContent && (fetched == null || fetched.isEmpty())) {
                    throw new FetchException(NO_CONTENT);
                }
                return fetched == null ? 0 : fetched.size();
            }
        };
    }
}
