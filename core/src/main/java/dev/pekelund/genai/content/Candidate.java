package dev.pekelund.genai.content;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * One alternative output. The {@code index} identifies the candidate across every chunk of a
 * stream; the wire format omits it for index 0.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Candidate(
    int index,
    Content content,
    FinishReason finishReason,
    List<SafetyRating> safetyRatings,
    CitationMetadata citationMetadata
) {

    public Candidate {
        safetyRatings = safetyRatings != null ? List.copyOf(safetyRatings) : List.of();
    }

    public List<Part> parts() {
        return content != null ? content.parts() : List.of();
    }
}
