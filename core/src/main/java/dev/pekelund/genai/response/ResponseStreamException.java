package dev.pekelund.genai.response;

import dev.pekelund.genai.GenerativeAiException;

/**
 * Signals that the upstream chunk sequence could not be read, or produced nothing at all.
 */
public class ResponseStreamException extends GenerativeAiException {

    public ResponseStreamException(String message) {
        super(message);
    }

    public ResponseStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
