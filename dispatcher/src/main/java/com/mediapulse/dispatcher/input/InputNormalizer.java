package com.mediapulse.dispatcher.input;

import com.mediapulse.dispatcher.model.ValidationError;
import com.mediapulse.dispatcher.model.ValidationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Coerces the raw {@code urls} argument into {@link NormalizedInputs}.
 *
 * <p>A single string becomes a one-element list; a collection keeps its order
 * with blank entries dropped. Blank entries are not reported individually, only
 * the fully-empty case is an error.</p>
 */
public class InputNormalizer {

    static final String EMPTY_INPUT_MESSAGE = "No valid URL was provided";
    static final String EMPTY_KEYWORD_MESSAGE = "No search keyword was provided";

    public NormalizedInputs normalize(Object raw) throws ValidationException {
        if (raw == null) {
            throw new ValidationException(ValidationError.Kind.EMPTY_INPUT, EMPTY_INPUT_MESSAGE);
        }

        if (raw instanceof String single) {
            String trimmed = single.trim();
            if (trimmed.isEmpty()) {
                throw new ValidationException(ValidationError.Kind.EMPTY_INPUT, EMPTY_INPUT_MESSAGE);
            }
            return NormalizedInputs.ofItems(List.of(trimmed));
        }

        if (raw instanceof Collection<?> collection) {
            List<String> items = new ArrayList<>();
            for (Object element : collection) {
                if (element == null) {
                    continue;
                }
                if (!(element instanceof String s)) {
                    throw invalidType();
                }
                String trimmed = s.trim();
                if (!trimmed.isEmpty()) {
                    items.add(trimmed);
                }
            }
            if (items.isEmpty()) {
                throw new ValidationException(ValidationError.Kind.EMPTY_INPUT, EMPTY_INPUT_MESSAGE);
            }
            return NormalizedInputs.ofItems(items);
        }

        throw invalidType();
    }

    /**
     * Normalizes the keyword of a search-style action.
     */
    public NormalizedInputs normalizeKeyword(String keyword) throws ValidationException {
        String trimmed = keyword == null ? "" : keyword.trim();
        if (trimmed.isEmpty()) {
            throw new ValidationException(ValidationError.Kind.EMPTY_KEYWORD, EMPTY_KEYWORD_MESSAGE);
        }
        return NormalizedInputs.ofKeyword(trimmed);
    }

    private static ValidationException invalidType() {
        return new ValidationException(ValidationError.Kind.INVALID_INPUT_TYPE,
                "urls must be a string or a list of strings");
    }
}
