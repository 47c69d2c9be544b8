package dev.pekelund.genai.generation;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

/**
 * Sampling and output settings sent with a generate-content request.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class GenerationConfig {

    private final Integer candidateCount;
    private final List<String> stopSequences;
    private final Integer maxOutputTokens;
    private final Double temperature;
    private final Double topP;
    private final Integer topK;
    private final String responseMimeType;
    private final Double presencePenalty;
    private final Double frequencyPenalty;

    private GenerationConfig(Builder builder) {
        this.candidateCount = builder.candidateCount;
        this.stopSequences = builder.stopSequences != null
            ? Collections.unmodifiableList(new ArrayList<>(builder.stopSequences))
            : Collections.emptyList();
        this.maxOutputTokens = builder.maxOutputTokens;
        this.temperature = builder.temperature;
        this.topP = builder.topP;
        this.topK = builder.topK;
        this.responseMimeType = builder.responseMimeType;
        this.presencePenalty = builder.presencePenalty;
        this.frequencyPenalty = builder.frequencyPenalty;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the loosely typed map form, for example {@code {"temperature": 0.2, "max_output_tokens": 64}}.
     * Keys may be snake_case or camelCase.
     *
     * @throws IllegalArgumentException for unknown keys or values of the wrong type
     */
    public static GenerationConfig fromMap(Map<String, ?> values) {
        Builder builder = builder();
        if (values == null) {
            return builder.build();
        }
        values.forEach((key, value) -> {
            switch (normalizeKey(key)) {
                case "candidatecount" -> builder.candidateCount(asInteger(key, value));
                case "stopsequences" -> builder.stopSequences(asStrings(key, value));
                case "maxoutputtokens" -> builder.maxOutputTokens(asInteger(key, value));
                case "temperature" -> builder.temperature(asDouble(key, value));
                case "topp" -> builder.topP(asDouble(key, value));
                case "topk" -> builder.topK(asInteger(key, value));
                case "responsemimetype" -> builder.responseMimeType(value != null ? value.toString() : null);
                case "presencepenalty" -> builder.presencePenalty(asDouble(key, value));
                case "frequencypenalty" -> builder.frequencyPenalty(asDouble(key, value));
                default -> throw new IllegalArgumentException("Unknown generation config field: " + key);
            }
        });
        return builder.build();
    }

    public Builder toBuilder() {
        return builder()
            .candidateCount(this.candidateCount)
            .stopSequences(this.stopSequences)
            .maxOutputTokens(this.maxOutputTokens)
            .temperature(this.temperature)
            .topP(this.topP)
            .topK(this.topK)
            .responseMimeType(this.responseMimeType)
            .presencePenalty(this.presencePenalty)
            .frequencyPenalty(this.frequencyPenalty);
    }

    /**
     * Returns a copy where every value set on {@code overrides} replaces the value of this config.
     */
    public GenerationConfig merge(GenerationConfig overrides) {
        if (overrides == null) {
            return this;
        }
        Builder builder = this.toBuilder();
        if (overrides.getCandidateCount() != null) {
            builder.candidateCount(overrides.getCandidateCount());
        }
        if (!CollectionUtils.isEmpty(overrides.getStopSequences())) {
            builder.stopSequences(overrides.getStopSequences());
        }
        if (overrides.getMaxOutputTokens() != null) {
            builder.maxOutputTokens(overrides.getMaxOutputTokens());
        }
        if (overrides.getTemperature() != null) {
            builder.temperature(overrides.getTemperature());
        }
        if (overrides.getTopP() != null) {
            builder.topP(overrides.getTopP());
        }
        if (overrides.getTopK() != null) {
            builder.topK(overrides.getTopK());
        }
        if (StringUtils.hasText(overrides.getResponseMimeType())) {
            builder.responseMimeType(overrides.getResponseMimeType());
        }
        if (overrides.getPresencePenalty() != null) {
            builder.presencePenalty(overrides.getPresencePenalty());
        }
        if (overrides.getFrequencyPenalty() != null) {
            builder.frequencyPenalty(overrides.getFrequencyPenalty());
        }
        return builder.build();
    }

    public Integer getCandidateCount() {
        return candidateCount;
    }

    public List<String> getStopSequences() {
        return stopSequences;
    }

    public Integer getMaxOutputTokens() {
        return maxOutputTokens;
    }

    public Double getTemperature() {
        return temperature;
    }

    public Double getTopP() {
        return topP;
    }

    public Integer getTopK() {
        return topK;
    }

    public String getResponseMimeType() {
        return responseMimeType;
    }

    public Double getPresencePenalty() {
        return presencePenalty;
    }

    public Double getFrequencyPenalty() {
        return frequencyPenalty;
    }

    private static String normalizeKey(String key) {
        return key == null ? "" : key.replace("_", "").toLowerCase(Locale.ROOT);
    }

    private static Integer asInteger(String key, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        throw new IllegalArgumentException("Expected a number for '" + key + "' but got: " + value);
    }

    private static Double asDouble(String key, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new IllegalArgumentException("Expected a number for '" + key + "' but got: " + value);
    }

    private static List<String> asStrings(String key, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String text) {
            return List.of(text);
        }
        if (value instanceof Collection<?> items) {
            List<String> strings = new ArrayList<>(items.size());
            for (Object item : items) {
                strings.add(String.valueOf(item));
            }
            return strings;
        }
        throw new IllegalArgumentException("Expected a string or a list of strings for '" + key + "' but got: " + value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GenerationConfig that)) {
            return false;
        }
        return Objects.equals(candidateCount, that.candidateCount)
            && Objects.equals(stopSequences, that.stopSequences)
            && Objects.equals(maxOutputTokens, that.maxOutputTokens)
            && Objects.equals(temperature, that.temperature)
            && Objects.equals(topP, that.topP)
            && Objects.equals(topK, that.topK)
            && Objects.equals(responseMimeType, that.responseMimeType)
            && Objects.equals(presencePenalty, that.presencePenalty)
            && Objects.equals(frequencyPenalty, that.frequencyPenalty);
    }

    @Override
    public int hashCode() {
        return Objects.hash(candidateCount, stopSequences, maxOutputTokens, temperature, topP, topK, responseMimeType,
            presencePenalty, frequencyPenalty);
    }

    @Override
    public String toString() {
        return "GenerationConfig{"
            + "candidateCount=" + candidateCount
            + ", temperature=" + temperature
            + ", topP=" + topP
            + ", topK=" + topK
            + ", maxOutputTokens=" + maxOutputTokens
            + ", stopSequences=" + stopSequences
            + ", responseMimeType='" + responseMimeType + '\''
            + '}';
    }

    /**
     * Builder for {@link GenerationConfig}.
     */
    public static class Builder {

        private Integer candidateCount;
        private List<String> stopSequences;
        private Integer maxOutputTokens;
        private Double temperature;
        private Double topP;
        private Integer topK;
        private String responseMimeType;
        private Double presencePenalty;
        private Double frequencyPenalty;

        public Builder candidateCount(Integer candidateCount) {
            this.candidateCount = candidateCount;
            return this;
        }

        public Builder stopSequences(List<String> stopSequences) {
            this.stopSequences = stopSequences;
            return this;
        }

        public Builder maxOutputTokens(Integer maxOutputTokens) {
            this.maxOutputTokens = maxOutputTokens;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder topP(Double topP) {
            this.topP = topP;
            return this;
        }

        public Builder topK(Integer topK) {
            this.topK = topK;
            return this;
        }

        public Builder responseMimeType(String responseMimeType) {
            this.responseMimeType = responseMimeType;
            return this;
        }

        public Builder presencePenalty(Double presencePenalty) {
            this.presencePenalty = presencePenalty;
            return this;
        }

        public Builder frequencyPenalty(Double frequencyPenalty) {
            this.frequencyPenalty = frequencyPenalty;
            return this;
        }

        public GenerationConfig build() {
            return new GenerationConfig(this);
        }
    }
}
