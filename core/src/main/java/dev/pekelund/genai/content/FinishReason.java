package dev.pekelund.genai.content;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

public enum FinishReason {
    @JsonEnumDefaultValue
    FINISH_REASON_UNSPECIFIED,
    STOP,
    MAX_TOKENS,
    SAFETY,
    RECITATION,
    LANGUAGE,
    OTHER,
    BLOCKLIST,
    PROHIBITED_CONTENT,
    SPII,
    MALFORMED_FUNCTION_CALL
}
