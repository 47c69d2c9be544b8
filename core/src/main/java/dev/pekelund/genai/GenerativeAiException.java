package dev.pekelund.genai;

/**
 * Base type for failures raised by the generative AI client.
 */
public class GenerativeAiException extends RuntimeException {

    public GenerativeAiException(String message) {
        super(message);
    }

    public GenerativeAiException(String message, Throwable cause) {
        super(message, cause);
    }
}
