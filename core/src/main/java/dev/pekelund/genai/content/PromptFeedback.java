package dev.pekelund.genai.content;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record PromptFeedback(BlockReason blockReason, List<SafetyRating> safetyRatings) {

    public PromptFeedback {
        safetyRatings = safetyRatings != null ? List.copyOf(safetyRatings) : List.of();
    }

    public boolean blocked() {
        return blockReason != null && blockReason != BlockReason.BLOCK_REASON_UNSPECIFIED;
    }
}
