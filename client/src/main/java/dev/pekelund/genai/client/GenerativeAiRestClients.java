package dev.pekelund.genai.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpHeaders;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestClient;

/**
 * Builds the {@link RestClient} shared by the service clients.
 */
public final class GenerativeAiRestClients {

    public static final String API_CLIENT_HEADER = "x-goog-api-client";

    private GenerativeAiRestClients() {
        // Utility class
    }

    /**
     * Returns a builder with the base URL, the user agent and the default metadata headers applied,
     * reading and writing JSON through {@code objectMapper}.
     */
    public static RestClient.Builder builder(GenerativeAiSettings settings, ObjectMapper objectMapper) {
        return RestClient.builder()
            .baseUrl(settings.baseUrl())
            .defaultHeaders(headers -> {
                headers.set(HttpHeaders.USER_AGENT, settings.userAgent());
                headers.set(API_CLIENT_HEADER, settings.userAgent());
                settings.defaultMetadata().forEach(headers::add);
            })
            .messageConverters(converters -> {
                converters.removeIf(MappingJackson2HttpMessageConverter.class::isInstance);
                converters.add(new MappingJackson2HttpMessageConverter(objectMapper));
            });
    }
}
