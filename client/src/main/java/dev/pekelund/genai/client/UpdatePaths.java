package dev.pekelund.genai.client;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.util.Assert;

/**
 * Helpers for partial updates: nested update maps are flattened to dotted field paths, which
 * become the {@code updateMask} and are expanded back into a request body.
 */
public final class UpdatePaths {

    private UpdatePaths() {
        // Utility class
    }

    /**
     * Flattens {@code {"data": {"string_value": "x"}}} to {@code {"data.string_value": "x"}}.
     */
    public static Map<String, Object> flatten(Map<String, ?> updates) {
        Map<String, Object> flat = new LinkedHashMap<>();
        if (updates != null) {
            flattenInto("", updates, flat);
        }
        return flat;
    }

    public static String toFieldMask(Collection<String> paths) {
        return paths.stream()
            .map(UpdatePaths::toCamelCasePath)
            .collect(Collectors.joining(","));
    }

    /**
     * Turns flattened paths back into a nested body with camelCase keys.
     */
    public static Map<String, Object> expand(Map<String, ?> flatUpdates) {
        Map<String, Object> body = new LinkedHashMap<>();
        flatUpdates.forEach((path, value) -> {
            String[] segments = toCamelCasePath(path).split("\\.");
            Map<String, Object> node = body;
            for (int i = 0; i < segments.length - 1; i++) {
                node = child(node, segments[i], path);
            }
            node.put(segments[segments.length - 1], value);
        });
        return body;
    }

    static String toCamelCasePath(String path) {
        Assert.hasText(path, "Update path must not be empty");
        StringBuilder camel = new StringBuilder(path.length());
        boolean upperNext = false;
        for (char ch : path.toCharArray()) {
            if (ch == '_') {
                upperNext = true;
            } else if (upperNext && ch != '.') {
                camel.append(Character.toUpperCase(ch));
                upperNext = false;
            } else {
                camel.append(ch);
                upperNext = false;
            }
        }
        return camel.toString();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> child(Map<String, Object> node, String key, String path) {
        Object existing = node.computeIfAbsent(key, ignored -> new LinkedHashMap<String, Object>());
        if (!(existing instanceof Map)) {
            throw new IllegalArgumentException("Update path '" + path + "' conflicts with a value set at '" + key + "'");
        }
        return (Map<String, Object>) existing;
    }

    private static void flattenInto(String prefix, Map<String, ?> updates, Map<String, Object> flat) {
        updates.forEach((key, value) -> {
            String path = prefix.isEmpty() ? key : prefix + "." + key;
            if (value instanceof Map<?, ?> nested) {
                @SuppressWarnings("unchecked")
                Map<String, ?> typed = (Map<String, ?>) nested;
                flattenInto(path, typed, flat);
            } else {
                flat.put(path, value);
            }
        });
    }
}
