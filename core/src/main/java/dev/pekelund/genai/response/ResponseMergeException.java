package dev.pekelund.genai.response;

/**
 * Thrown when chunks of one stream break the protocol's own guarantees, for example by changing
 * the role of a candidate's content mid-stream. Not recoverable.
 */
public class ResponseMergeException extends IllegalStateException {

    public ResponseMergeException(String message) {
        super(message);
    }
}
