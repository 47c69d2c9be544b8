package dev.pekelund.genai.content;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

/**
 * Reason a prompt was refused. Anything other than {@link #BLOCK_REASON_UNSPECIFIED} means no
 * candidates will be produced.
 */
public enum BlockReason {
    @JsonEnumDefaultValue
    BLOCK_REASON_UNSPECIFIED,
    SAFETY,
    OTHER,
    BLOCKLIST,
    PROHIBITED_CONTENT
}
