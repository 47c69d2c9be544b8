package dev.pekelund.genai.response;

public enum StreamState {
    /** More chunks may still arrive. */
    PENDING,
    /** The upstream sequence ended normally; the accumulated result is final. */
    DONE,
    /** An upstream error or a blocked prompt ended the stream early. */
    FAILED
}
