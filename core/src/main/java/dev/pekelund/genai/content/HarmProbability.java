package dev.pekelund.genai.content;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

public enum HarmProbability {
    @JsonEnumDefaultValue
    HARM_PROBABILITY_UNSPECIFIED,
    NEGLIGIBLE,
    LOW,
    MEDIUM,
    HIGH
}
