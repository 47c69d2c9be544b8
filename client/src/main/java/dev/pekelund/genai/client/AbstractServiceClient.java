package dev.pekelund.genai.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.genai.GenerativeAiException;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriBuilder;

/**
 * Shared plumbing of the REST service clients: observation, MDC, API key and error translation.
 */
public abstract class AbstractServiceClient {

    public static final String OBSERVATION_NAME = "google.ai.generative.call";

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractServiceClient.class);

    protected final RestClient restClient;
    protected final GenerativeAiSettings settings;
    protected final ObjectMapper objectMapper;
    private final ObservationRegistry observationRegistry;

    protected AbstractServiceClient(RestClient restClient, GenerativeAiSettings settings, ObjectMapper objectMapper,
        ObservationRegistry observationRegistry) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.observationRegistry = observationRegistry != null ? observationRegistry : ObservationRegistry.NOOP;
    }

    /**
     * Runs one remote call inside an observation and an MDC scope, translating transport failures
     * into {@link GenerativeAiException}.
     */
    protected <T> T execute(String operation, String resource, Supplier<T> call) {
        Observation observation = Observation.start(OBSERVATION_NAME, observationRegistry)
            .highCardinalityKeyValue("operation", operation)
            .highCardinalityKeyValue("resource", Optional.ofNullable(resource).orElse("(unset)"));
        try (Observation.Scope scope = observation.openScope();
             GenerativeAiMdc.Context mdc = GenerativeAiMdc.open(operation, resource)) {
            return call.get();
        } catch (RestClientResponseException ex) {
            LOGGER.warn("Google AI call '{}' failed with status {}: {}", operation, ex.getStatusCode().value(),
                ex.getResponseBodyAsString());
            GenerativeAiException failure = new GenerativeAiException("Google AI request '" + operation
                + "' failed with status " + ex.getStatusCode().value() + ": " + ex.getResponseBodyAsString(), ex);
            observation.error(failure);
            throw failure;
        } catch (RestClientException ex) {
            GenerativeAiException failure = new GenerativeAiException("Google AI request '" + operation + "' failed", ex);
            observation.error(failure);
            throw failure;
        } catch (RuntimeException ex) {
            observation.error(ex);
            throw ex;
        } finally {
            observation.stop();
        }
    }

    /**
     * Appends a resource path such as {@code models/gemini-1.5-flash:generateContent} and the API
     * key to the base URL.
     */
    protected UriBuilder resourcePath(UriBuilder uriBuilder, String path) {
        UriBuilder builder = uriBuilder.path(path.startsWith("/") ? path : "/" + path);
        if (StringUtils.hasText(settings.apiKey())) {
            builder.queryParam("key", settings.apiKey());
        }
        return builder;
    }
}
