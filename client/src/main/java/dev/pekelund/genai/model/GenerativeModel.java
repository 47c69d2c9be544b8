package dev.pekelund.genai.model;

import dev.pekelund.genai.caching.CachedContent;
import dev.pekelund.genai.client.CountTokensResponse;
import dev.pekelund.genai.client.GenerativeServiceClient;
import dev.pekelund.genai.content.Content;
import dev.pekelund.genai.content.Part;
import dev.pekelund.genai.generation.GenerateContentRequest;
import dev.pekelund.genai.generation.GenerationConfig;
import dev.pekelund.genai.generation.SafetySetting;
import dev.pekelund.genai.response.AsyncChunkSource;
import dev.pekelund.genai.response.AsyncGenerateContentResponse;
import dev.pekelund.genai.response.GenerateContentResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * A model bound to its default generation settings.
 *
 * <pre>{@code
 * GenerativeModel model = GenerativeModel.builder(client)
 *     .modelName("gemini-1.5-flash")
 *     .generationConfig(GenerationConfig.builder().temperature(0.2).build())
 *     .build();
 * String answer = model.generateContent("What is the capital of Norway?").text();
 * }</pre>
 */
public class GenerativeModel {

    private final GenerativeServiceClient client;
    private final String modelName;
    private final GenerationConfig generationConfig;
    private final List<SafetySetting> safetySettings;
    private final Content systemInstruction;
    private final String cachedContent;
    private final Scheduler scheduler;

    private GenerativeModel(Builder builder) {
        this.client = builder.client;
        this.modelName = GenerativeServiceClient.modelName(StringUtils.hasText(builder.modelName)
            ? builder.modelName
            : builder.client.getSettings().defaultModel());
        this.generationConfig = builder.generationConfig;
        this.safetySettings = List.copyOf(builder.safetySettings);
        this.systemInstruction = builder.systemInstruction;
        this.cachedContent = builder.cachedContent;
        this.scheduler = builder.scheduler != null ? builder.scheduler : Schedulers.boundedElastic();
    }

    public static Builder builder(GenerativeServiceClient client) {
        return new Builder(client);
    }

    public Builder toBuilder() {
        return new Builder(client)
            .modelName(modelName)
            .generationConfig(generationConfig)
            .safetySettings(safetySettings)
            .systemInstruction(systemInstruction)
            .cachedContent(cachedContent)
            .scheduler(scheduler);
    }

    /**
     * Returns a model that answers from the given cache. The cache fixes the model, so the
     * returned instance uses the cache's model and drops any system instruction.
     */
    public GenerativeModel withCachedContent(CachedContent cached) {
        Assert.notNull(cached, "Cached content must not be null");
        Assert.hasText(cached.name(), "Cached content must have a name");
        return toBuilder()
            .modelName(StringUtils.hasText(cached.model()) ? cached.model() : modelName)
            .systemInstruction((Content) null)
            .cachedContent(cached.name())
            .build();
    }

    public String getModelName() {
        return modelName;
    }

    public String getCachedContent() {
        return cachedContent;
    }

    public GenerateContentResponse generateContent(String prompt) {
        return generateContent(prompt(prompt), null);
    }

    public GenerateContentResponse generateContent(List<Content> contents) {
        return generateContent(contents, null);
    }

    public GenerateContentResponse generateContent(List<Content> contents, GenerationConfig overrides) {
        return GenerateContentResponse.fromResponse(client.generateContent(modelName, request(contents, overrides)));
    }

    public GenerateContentResponse streamGenerateContent(String prompt) {
        return streamGenerateContent(prompt(prompt), null);
    }

    public GenerateContentResponse streamGenerateContent(List<Content> contents) {
        return streamGenerateContent(contents, null);
    }

    /**
     * Starts a streamed generation; the response is pending until iterated or drained. Close it
     * when stopping before the end so the connection is released.
     */
    public GenerateContentResponse streamGenerateContent(List<Content> contents, GenerationConfig overrides) {
        return GenerateContentResponse.fromSource(client.streamGenerateContent(modelName, request(contents, overrides)));
    }

    public Mono<AsyncGenerateContentResponse> generateContentAsync(List<Content> contents) {
        return generateContentAsync(contents, null);
    }

    public Mono<AsyncGenerateContentResponse> generateContentAsync(List<Content> contents, GenerationConfig overrides) {
        return Mono.fromCallable(() -> request(contents, overrides))
            .map(request -> client.generateContent(modelName, request))
            .map(AsyncGenerateContentResponse::fromResponse)
            .subscribeOn(scheduler);
    }

    public Mono<AsyncGenerateContentResponse> streamGenerateContentAsync(List<Content> contents) {
        return streamGenerateContentAsync(contents, null);
    }

    /**
     * Streams without blocking the subscriber: opening the connection and every pull of the event
     * stream run on this model's scheduler.
     */
    public Mono<AsyncGenerateContentResponse> streamGenerateContentAsync(List<Content> contents,
        GenerationConfig overrides) {
        return Mono.fromCallable(() -> client.streamGenerateContent(modelName, request(contents, overrides)))
            .subscribeOn(scheduler)
            .flatMap(source -> AsyncGenerateContentResponse.fromSource(AsyncChunkSource.offload(source, scheduler)));
    }

    public CountTokensResponse countTokens(String prompt) {
        return countTokens(prompt(prompt));
    }

    public CountTokensResponse countTokens(List<Content> contents) {
        return client.countTokens(modelName, request(contents, null));
    }

    private GenerateContentRequest request(List<Content> contents, GenerationConfig overrides) {
        if (contents == null || contents.isEmpty()) {
            throw new IllegalArgumentException("At least one content item is required");
        }
        GenerationConfig config = generationConfig != null ? generationConfig.merge(overrides) : overrides;
        return new GenerateContentRequest(contents, systemInstruction, config, safetySettings, cachedContent);
    }

    private static List<Content> prompt(String prompt) {
        Assert.hasText(prompt, "Prompt must not be empty");
        return List.of(Content.user(prompt));
    }

    /**
     * Builder for {@link GenerativeModel}.
     */
    public static final class Builder {

        private final GenerativeServiceClient client;
        private String modelName;
        private GenerationConfig generationConfig;
        private final List<SafetySetting> safetySettings = new ArrayList<>();
        private Content systemInstruction;
        private String cachedContent;
        private Scheduler scheduler;

        private Builder(GenerativeServiceClient client) {
            this.client = Objects.requireNonNull(client, "client");
        }

        public Builder modelName(String modelName) {
            this.modelName = modelName;
            return this;
        }

        public Builder generationConfig(GenerationConfig generationConfig) {
            this.generationConfig = generationConfig;
            return this;
        }

        public Builder safetySettings(List<SafetySetting> safetySettings) {
            this.safetySettings.clear();
            if (safetySettings != null) {
                this.safetySettings.addAll(safetySettings);
            }
            return this;
        }

        public Builder systemInstruction(Content systemInstruction) {
            this.systemInstruction = systemInstruction;
            return this;
        }

        public Builder systemInstruction(String systemInstruction) {
            this.systemInstruction = StringUtils.hasText(systemInstruction)
                ? new Content(null, List.of(Part.fromText(systemInstruction)))
                : null;
            return this;
        }

        public Builder cachedContent(String cachedContent) {
            this.cachedContent = cachedContent;
            return this;
        }

        public Builder scheduler(Scheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public GenerativeModel build() {
            return new GenerativeModel(this);
        }
    }
}
