package dev.pekelund.genai.chat;

import dev.pekelund.genai.generation.GenerationConfig;
import java.util.List;
import java.util.Objects;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.util.StringUtils;

/**
 * Chat options understood by {@link GeminiChatModel}: a model name plus the {@link GenerationConfig}
 * sent with every request. The sampling getters of {@link ChatOptions} read through to that config,
 * with {@code maxTokens} standing for {@code maxOutputTokens}.
 */
public class GeminiChatOptions implements ChatOptions {

    private final String model;
    private final GenerationConfig generationConfig;

    private GeminiChatOptions(String model, GenerationConfig generationConfig) {
        this.model = model;
        this.generationConfig = generationConfig;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Carries the portable options of any Spring AI {@link ChatOptions} over to Gemini options.
     */
    public static GeminiChatOptions from(ChatOptions options) {
        if (options instanceof GeminiChatOptions geminiOptions) {
            return geminiOptions;
        }
        Builder builder = builder();
        if (options == null) {
            return builder.build();
        }
        return builder
            .model(options.getModel())
            .frequencyPenalty(options.getFrequencyPenalty())
            .maxTokens(options.getMaxTokens())
            .presencePenalty(options.getPresencePenalty())
            .stopSequences(options.getStopSequences())
            .temperature(options.getTemperature())
            .topK(options.getTopK())
            .topP(options.getTopP())
            .build();
    }

    public Builder toBuilder() {
        return builder().model(model).generationConfig(generationConfig);
    }

    /**
     * Returns options where the model and every generation setting present on {@code overrides}
     * replace those of these options.
     */
    public GeminiChatOptions merge(GeminiChatOptions overrides) {
        if (overrides == null) {
            return this;
        }
        String mergedModel = StringUtils.hasText(overrides.model) ? overrides.model : model;
        return new GeminiChatOptions(mergedModel, generationConfig.merge(overrides.generationConfig));
    }

    public GenerationConfig getGenerationConfig() {
        return generationConfig;
    }

    @Override
    public String getModel() {
        return model;
    }

    @Override
    public Double getFrequencyPenalty() {
        return generationConfig.getFrequencyPenalty();
    }

    @Override
    public Integer getMaxTokens() {
        return generationConfig.getMaxOutputTokens();
    }

    @Override
    public Double getPresencePenalty() {
        return generationConfig.getPresencePenalty();
    }

    @Override
    public List<String> getStopSequences() {
        return generationConfig.getStopSequences();
    }

    @Override
    public Double getTemperature() {
        return generationConfig.getTemperature();
    }

    @Override
    public Integer getTopK() {
        return generationConfig.getTopK();
    }

    @Override
    public Double getTopP() {
        return generationConfig.getTopP();
    }

    public Integer getCandidateCount() {
        return generationConfig.getCandidateCount();
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T extends ChatOptions> T copy() {
        return (T) new GeminiChatOptions(model, generationConfig);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GeminiChatOptions that)) {
            return false;
        }
        return Objects.equals(model, that.model) && generationConfig.equals(that.generationConfig);
    }

    @Override
    public int hashCode() {
        return Objects.hash(model, generationConfig);
    }

    @Override
    public String toString() {
        return "GeminiChatOptions{model='" + model + "', " + generationConfig + '}';
    }

    /**
     * Builder for {@link GeminiChatOptions}. Generation settings accumulate on a
     * {@link GenerationConfig.Builder}.
     */
    public static class Builder implements ChatOptions.Builder {

        private String model;
        private GenerationConfig.Builder config = GenerationConfig.builder();

        @Override
        public Builder model(String model) {
            this.model = model;
            return this;
        }

        /**
         * Replaces every generation setting collected so far.
         */
        public Builder generationConfig(GenerationConfig generationConfig) {
            this.config = generationConfig != null ? generationConfig.toBuilder() : GenerationConfig.builder();
            return this;
        }

        @Override
        public Builder frequencyPenalty(Double frequencyPenalty) {
            config.frequencyPenalty(frequencyPenalty);
            return this;
        }

        @Override
        public Builder maxTokens(Integer maxTokens) {
            config.maxOutputTokens(maxTokens);
            return this;
        }

        @Override
        public Builder presencePenalty(Double presencePenalty) {
            config.presencePenalty(presencePenalty);
            return this;
        }

        @Override
        public Builder stopSequences(List<String> stopSequences) {
            config.stopSequences(stopSequences);
            return this;
        }

        @Override
        public Builder temperature(Double temperature) {
            config.temperature(temperature);
            return this;
        }

        @Override
        public Builder topK(Integer topK) {
            config.topK(topK);
            return this;
        }

        @Override
        public Builder topP(Double topP) {
            config.topP(topP);
            return this;
        }

        public Builder candidateCount(Integer candidateCount) {
            config.candidateCount(candidateCount);
            return this;
        }

        public Builder responseMimeType(String responseMimeType) {
            config.responseMimeType(responseMimeType);
            return this;
        }

        @Override
        public GeminiChatOptions build() {
            return new GeminiChatOptions(model, config.build());
        }
    }
}
