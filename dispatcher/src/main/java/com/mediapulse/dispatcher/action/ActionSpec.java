package com.mediapulse.dispatcher.action;

import com.mediapulse.dispatcher.executor.CountingMode;
import com.mediapulse.dispatcher.model.Platform;

import java.util.Set;

/**
 * Static description of an action: what input it needs, where it is allowed,
 * how its results are counted and which handler runs it.
 *
 * @param noun plural noun used in result messages, e.g. "works"
 */
public record ActionSpec(
        String name,
        InputKind inputKind,
        Set<Platform> restrictedPlatforms,
        CountingMode countingMode,
        SessionScope sessionScope,
        String noun,
        ActionHandler handler
) {

    public ActionSpec {
        restrictedPlatforms = Set.copyOf(restrictedPlatforms);
    }

    public boolean requiresInput() {
        return inputKind != InputKind.NONE;
    }

    public boolean supports(Platform platform) {
        return !restrictedPlatforms.contains(platform);
    }
}
