package dev.pekelund.genai.generation;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.pekelund.genai.content.Content;
import java.util.List;

/**
 * Body of the generate-content, stream-generate-content and count-tokens calls.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record GenerateContentRequest(
    List<Content> contents,
    Content systemInstruction,
    GenerationConfig generationConfig,
    List<SafetySetting> safetySettings,
    String cachedContent
) {

    public GenerateContentRequest {
        contents = contents != null ? List.copyOf(contents) : List.of();
        safetySettings = safetySettings != null ? List.copyOf(safetySettings) : List.of();
    }

    public static GenerateContentRequest of(List<Content> contents) {
        return new GenerateContentRequest(contents, null, null, null, null);
    }
}
