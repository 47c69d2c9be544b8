package dev.pekelund.genai.response;

import dev.pekelund.genai.GenerativeAiException;

/**
 * Raised when accumulated attributes are read before a streamed response has finished.
 */
public class IncompleteIterationException extends GenerativeAiException {

    public IncompleteIterationException(String message) {
        super(message);
    }
}
