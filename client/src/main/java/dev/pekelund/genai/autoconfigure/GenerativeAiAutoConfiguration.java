package dev.pekelund.genai.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.genai.GenerativeAiJson;
import dev.pekelund.genai.caching.CachedContentService;
import dev.pekelund.genai.chat.GeminiChatModel;
import dev.pekelund.genai.chat.GeminiChatOptions;
import dev.pekelund.genai.client.ClientOptions;
import dev.pekelund.genai.client.GenerativeAiRestClients;
import dev.pekelund.genai.client.GenerativeAiSettings;
import dev.pekelund.genai.client.GenerativeServiceClient;
import dev.pekelund.genai.model.GenerativeModel;
import dev.pekelund.genai.retriever.RetrieverService;
import io.micrometer.observation.ObservationRegistry;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

/**
 * Wires the generative language clients from {@code google.ai.generative.*} properties.
 *
 * <p>A missing API key does not fail startup; requests are rejected by the service instead.
 */
@AutoConfiguration
public class GenerativeAiAutoConfiguration {

    public static final String PROPERTY_PREFIX = "google.ai.generative";

    private static final Logger LOGGER = LoggerFactory.getLogger(GenerativeAiAutoConfiguration.class);

    private final ObjectMapper objectMapper = GenerativeAiJson.newObjectMapper();

    @Bean
    @ConditionalOnMissingBean
    public GenerativeAiSettings generativeAiSettings(Environment environment) {
        String apiKey = environment.getProperty(PROPERTY_PREFIX + ".api-key");
        ClientOptions options = new ClientOptions(null,
            environment.getProperty(PROPERTY_PREFIX + ".api-endpoint"),
            environment.getProperty(PROPERTY_PREFIX + ".model"));
        Map<String, String> metadata = Binder.get(environment)
            .bind(PROPERTY_PREFIX + ".default-metadata", Bindable.mapOf(String.class, String.class))
            .orElse(Map.of());
        GenerativeAiSettings settings = GenerativeAiSettings.configure(StringUtils.hasText(apiKey) ? apiKey : null,
            options, metadata, environment.getProperty(PROPERTY_PREFIX + ".user-agent"));
        if (!StringUtils.hasText(settings.apiKey())) {
            LOGGER.warn("No Google AI API key configured; set {} or {}.api-key", GenerativeAiSettings.API_KEY_ENV,
                PROPERTY_PREFIX);
        }
        LOGGER.info("Configured generative language client: {}", settings);
        return settings;
    }

    @Bean
    @ConditionalOnMissingBean(name = "generativeAiRestClient")
    public RestClient generativeAiRestClient(GenerativeAiSettings settings) {
        return GenerativeAiRestClients.builder(settings, objectMapper).build();
    }

    @Bean
    @ConditionalOnMissingBean
    public GenerativeServiceClient generativeServiceClient(@Qualifier("generativeAiRestClient") RestClient restClient,
        GenerativeAiSettings settings, ObjectProvider<ObservationRegistry> observationRegistry) {
        return new GenerativeServiceClient(restClient, settings, objectMapper,
            resolve(observationRegistry));
    }

    @Bean
    @ConditionalOnMissingBean
    public CachedContentService cachedContentService(@Qualifier("generativeAiRestClient") RestClient restClient,
        GenerativeAiSettings settings, ObjectProvider<ObservationRegistry> observationRegistry) {
        return new CachedContentService(restClient, settings, objectMapper,
            resolve(observationRegistry));
    }

    @Bean
    @ConditionalOnMissingBean
    public RetrieverService retrieverService(@Qualifier("generativeAiRestClient") RestClient restClient,
        GenerativeAiSettings settings, ObjectProvider<ObservationRegistry> observationRegistry) {
        return new RetrieverService(restClient, settings, objectMapper,
            resolve(observationRegistry));
    }

    @Bean
    @ConditionalOnMissingBean
    public GenerativeModel generativeModel(GenerativeServiceClient generativeServiceClient) {
        return GenerativeModel.builder(generativeServiceClient).build();
    }

    @Bean
    @ConditionalOnMissingBean
    public GeminiChatOptions geminiChatOptions(Environment environment, GenerativeAiSettings settings) {
        String chatPrefix = PROPERTY_PREFIX + ".chat.";
        GeminiChatOptions options = GeminiChatOptions.builder()
            .model(environment.getProperty(chatPrefix + "model", settings.defaultModel()))
            .temperature(environment.getProperty(chatPrefix + "temperature", Double.class))
            .topP(environment.getProperty(chatPrefix + "top-p", Double.class))
            .topK(environment.getProperty(chatPrefix + "top-k", Integer.class))
            .maxTokens(environment.getProperty(chatPrefix + "max-output-tokens", Integer.class))
            .candidateCount(environment.getProperty(chatPrefix + "candidate-count", Integer.class))
            .build();
        LOGGER.info("Gemini chat default options: {}", options);
        return options;
    }

    @Bean
    @ConditionalOnMissingBean
    public GeminiChatModel geminiChatModel(GenerativeServiceClient generativeServiceClient,
        GeminiChatOptions geminiChatOptions, ObjectProvider<ObservationRegistry> observationRegistry) {
        return new GeminiChatModel(generativeServiceClient, geminiChatOptions, resolve(observationRegistry));
    }

    private static ObservationRegistry resolve(ObjectProvider<ObservationRegistry> observationRegistry) {
        return observationRegistry.getIfAvailable(() -> ObservationRegistry.NOOP);
    }
}
