package dev.pekelund.genai.response;

import dev.pekelund.genai.GenerativeAiException;
import dev.pekelund.genai.content.PromptFeedback;

/**
 * Raised while iterating a streamed response whose prompt was refused by the service.
 */
public class BlockedPromptException extends GenerativeAiException {

    private final transient PromptFeedback promptFeedback;

    public BlockedPromptException(PromptFeedback promptFeedback) {
        super("The prompt was blocked (block reason: "
            + (promptFeedback != null ? promptFeedback.blockReason() : null) + ")");
        this.promptFeedback = promptFeedback;
    }

    public PromptFeedback getPromptFeedback() {
        return promptFeedback;
    }
}
