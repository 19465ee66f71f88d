package com.mediapulse.dispatcher.executor;

import com.mediapulse.dispatcher.model.BatchResult;
import com.mediapulse.dispatcher.model.ItemOutcome;

import java.util.List;

/**
 * Folds per-item outcomes into a {@link BatchResult}. The result is successful
 * when at least one item produced something usable, even if others failed.
 */
public class ResultAggregator {

    public BatchResult aggregate(List<ItemOutcome> outcomes, CountingMode mode, String noun) {
        int failed = (int) outcomes.stream().filter(o -> !o.succeeded()).count();
        int downloaded = switch (mode) {
            case ITEM -> (int) outcomes.stream().filter(ItemOutcome::succeeded).count();
            case IDENTIFIER -> outcomes.stream()
                    .filter(ItemOutcome::succeeded)
                    .mapToInt(o -> o.extractedIds().size())
                    .sum();
        };
        boolean anyUsable = outcomes.stream().anyMatch(ItemOutcome::succeeded) && downloaded > 0;

        return new BatchResult(anyUsable, message(anyUsable, downloaded, failed, outcomes.size(), noun),
                downloaded, failed, outcomes);
    }

    private static String message(boolean success, int downloaded, int failed, int total, String noun) {
        if (!success) {
            return total == 0
                    ? "No " + noun + " to process"
                    : "No " + noun + " could be processed (" + failed + " of " + total + " inputs failed)";
        }
        String summary = "Processed " + downloaded + " " + noun;
        return failed > 0 ? summary + ", " + failed + " of " + total + " inputs failed" : summary;
    }
}
