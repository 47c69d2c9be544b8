package dev.pekelund.genai.generation;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

public enum HarmBlockThreshold {
    @JsonEnumDefaultValue
    HARM_BLOCK_THRESHOLD_UNSPECIFIED,
    BLOCK_LOW_AND_ABOVE,
    BLOCK_MEDIUM_AND_ABOVE,
    BLOCK_ONLY_HIGH,
    BLOCK_NONE,
    OFF
}
