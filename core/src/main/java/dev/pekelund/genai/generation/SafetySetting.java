package dev.pekelund.genai.generation;

import dev.pekelund.genai.content.HarmCategory;
import java.util.Objects;

/**
 * Per-category blocking threshold applied to a request.
 */
public record SafetySetting(HarmCategory category, HarmBlockThreshold threshold) {

    public SafetySetting {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(threshold, "threshold");
    }
}
