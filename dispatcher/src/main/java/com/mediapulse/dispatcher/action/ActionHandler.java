package com.mediapulse.dispatcher.action;

import com.mediapulse.dispatcher.model.BatchResult;

/**
 * Implements one action. Per-item failures are expected to be isolated inside
 * the returned result; anything thrown is treated as fatal to the call.
 */
@FunctionalInterface
public interface ActionHandler {

    BatchResult handle(ActionContext context) throws Exception;
}
