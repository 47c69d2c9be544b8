package dev.pekelund.genai.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.genai.GenerativeAiException;
import dev.pekelund.genai.content.Content;
import dev.pekelund.genai.content.GenerateContentChunk;
import dev.pekelund.genai.generation.GenerateContentRequest;
import dev.pekelund.genai.generation.GenerationConfig;
import dev.pekelund.genai.generation.SafetySetting;
import dev.pekelund.genai.response.ChunkSource;
import io.micrometer.observation.ObservationRegistry;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.util.Assert;
import org.springframework.util.StreamUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * Client for the generate-content endpoints of the generative language REST API.
 */
public class GenerativeServiceClient extends AbstractServiceClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(GenerativeServiceClient.class);

    private static final String MODELS_PREFIX = "models/";

    public GenerativeServiceClient(RestClient restClient, GenerativeAiSettings settings, ObjectMapper objectMapper,
        ObservationRegistry observationRegistry) {
        super(restClient, settings, objectMapper, observationRegistry);
    }

    public GenerativeAiSettings getSettings() {
        return settings;
    }

    public GenerateContentChunk generateContent(String model, GenerateContentRequest request) {
        String name = modelName(model);
        validate(request);
        return execute("generateContent", name, () -> {
            LOGGER.info("Calling Google AI model '{}' with {} content item(s)", name, request.contents().size());
            GenerateContentChunk chunk = restClient.post()
                .uri(uriBuilder -> resourcePath(uriBuilder, name + ":generateContent").build())
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(GenerateContentChunk.class);
            if (chunk == null) {
                throw new GenerativeAiException("Google AI model '" + name + "' returned an empty response");
            }
            return chunk;
        });
    }

    /**
     * Starts a streamed generation. The returned source reads server-sent events lazily and must be
     * pulled until it signals the end, or closed, to release the connection.
     */
    public ChunkSource streamGenerateContent(String model, GenerateContentRequest request) {
        String name = modelName(model);
        validate(request);
        return execute("streamGenerateContent", name, () -> {
            LOGGER.info("Streaming from Google AI model '{}' with {} content item(s)", name, request.contents().size());
            return restClient.post()
                .uri(uriBuilder -> resourcePath(uriBuilder, name + ":streamGenerateContent")
                    .queryParam("alt", "sse")
                    .build())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .body(request)
                .exchange((clientRequest, response) -> {
                    if (response.getStatusCode().isError()) {
                        byte[] body = StreamUtils.copyToByteArray(response.getBody());
                        response.close();
                        throw new RestClientResponseException("Streaming request failed", response.getStatusCode(),
                            response.getStatusText(), response.getHeaders(), body, StandardCharsets.UTF_8);
                    }
                    BufferedReader reader = new BufferedReader(
                        new InputStreamReader(response.getBody(), StandardCharsets.UTF_8));
                    return new SseChunkSource(reader, response, objectMapper);
                }, false);
        });
    }

    public CountTokensResponse countTokens(String model, GenerateContentRequest request) {
        String name = modelName(model);
        validate(request);
        CountTokensRequest body = onlyContents(request)
            ? new CountTokensRequest(request.contents(), null)
            : new CountTokensRequest(null, ModelRequest.of(name, request));
        return execute("countTokens", name, () -> restClient.post()
            .uri(uriBuilder -> resourcePath(uriBuilder, name + ":countTokens").build())
            .contentType(MediaType.APPLICATION_JSON)
            .body(body)
            .retrieve()
            .body(CountTokensResponse.class));
    }

    /**
     * Qualifies a bare model id with {@code models/}. Names that already carry a collection, such
     * as {@code tunedModels/my-model}, are kept.
     */
    public static String modelName(String model) {
        Assert.hasText(model, "Model name must not be empty");
        return model.contains("/") ? model : MODELS_PREFIX + model;
    }

    private static void validate(GenerateContentRequest request) {
        Assert.notNull(request, "Request must not be null");
        if (request.contents().isEmpty()) {
            throw new IllegalArgumentException("Request must contain at least one content item");
        }
    }

    private static boolean onlyContents(GenerateContentRequest request) {
        return request.systemInstruction() == null
            && request.generationConfig() == null
            && request.safetySettings().isEmpty()
            && !StringUtils.hasText(request.cachedContent());
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private record CountTokensRequest(List<Content> contents, ModelRequest generateContentRequest) {
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private record ModelRequest(
        String model,
        List<Content> contents,
        Content systemInstruction,
        GenerationConfig generationConfig,
        List<SafetySetting> safetySettings,
        String cachedContent
    ) {

        static ModelRequest of(String model, GenerateContentRequest request) {
            return new ModelRequest(model, request.contents(), request.systemInstruction(), request.generationConfig(),
                request.safetySettings(), request.cachedContent());
        }
    }
}
