package dev.pekelund.genai.response;

import dev.pekelund.genai.GenerativeAiException;

/**
 * Raised by the single-value convenience accessors when the response does not have the one
 * candidate / one text part shape they assume.
 */
public class AmbiguousResponseException extends GenerativeAiException {

    public AmbiguousResponseException(String message) {
        super(message);
    }
}
