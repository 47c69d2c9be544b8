package dev.pekelund.genai.content;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * A single {@code GenerateContentResponse} message as returned by the service. A non-streaming
 * call returns exactly one; a streaming call returns a sequence of partial ones.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record GenerateContentChunk(
    List<Candidate> candidates,
    PromptFeedback promptFeedback,
    UsageMetadata usageMetadata
) {

    public GenerateContentChunk {
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
    }

    public static GenerateContentChunk of(Candidate... candidates) {
        return new GenerateContentChunk(List.of(candidates), null, null);
    }

    public boolean promptBlocked() {
        return promptFeedback != null && promptFeedback.blocked();
    }
}
