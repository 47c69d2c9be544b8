package dev.pekelund.genai.content;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FunctionCall(String name, Map<String, Object> args) {

    public FunctionCall {
        args = args != null ? Collections.unmodifiableMap(new LinkedHashMap<>(args)) : Map.of();
    }
}
