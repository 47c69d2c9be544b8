package dev.pekelund.genai.content;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

public enum HarmCategory {
    @JsonEnumDefaultValue
    HARM_CATEGORY_UNSPECIFIED,
    HARM_CATEGORY_HARASSMENT,
    HARM_CATEGORY_HATE_SPEECH,
    HARM_CATEGORY_SEXUALLY_EXPLICIT,
    HARM_CATEGORY_DANGEROUS_CONTENT,
    HARM_CATEGORY_CIVIC_INTEGRITY
}
