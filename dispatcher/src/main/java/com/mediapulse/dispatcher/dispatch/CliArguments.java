package com.mediapulse.dispatcher.dispatch;

import java.util.Map;

/**
 * Parsed command line: the action name and the flat option map handed to
 * {@link ActionDispatcher#dispatch(String, String, Map)}.
 */
public record CliArguments(String action, Map<String, Object> options) {}
