package dev.pekelund.genai.content;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FunctionResponse(String name, Map<String, Object> response) {

    public FunctionResponse {
        response = response != null ? Collections.unmodifiableMap(new LinkedHashMap<>(response)) : Map.of();
    }
}
