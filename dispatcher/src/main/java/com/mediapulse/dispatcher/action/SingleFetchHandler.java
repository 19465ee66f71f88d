package com.mediapulse.dispatcher.action;

import com.mediapulse.dispatcher.backend.FetchOperation;
import com.mediapulse.dispatcher.backend.FetchQuery;
import com.mediapulse.dispatcher.model.BatchResult;
import com.mediapulse.dispatcher.model.ItemOutcome;

import java.util.List;
import java.util.Map;

/**
 * Handler for actions that issue one fetch: a keyword search, or a list tied
 * to the logged-in account (hot list, favorites). The single outcome is keyed
 * by the keyword, or by the action name when there is none.
 */
public class SingleFetchHandler implements ActionHandler {

    private final FetchOperation operation;

    public SingleFetchHandler(FetchOperation operation) {
        this.operation = operation;
    }

    @Override
    public BatchResult handle(ActionContext context) throws Exception {
        ActionSpec spec = context.spec();
        Map<String, Object> parameters = context.options().backendParameters();

        String keyword = context.inputs().keyword();
        String label = keyword != null ? keyword : spec.name();
        FetchQuery query = keyword != null
                ? FetchQuery.ofKeyword(keyword, parameters)
                : FetchQuery.ofIds(List.of(), parameters);

        ItemOutcome outcome = context.recorder().withSession(session -> context.executor().runSingle(label,
                s -> context.backend().fetchBatch(operation, query, s), session));

        return context.aggregator().aggregate(List.of(outcome), spec.countingMode(), spec.noun());
    }
}
