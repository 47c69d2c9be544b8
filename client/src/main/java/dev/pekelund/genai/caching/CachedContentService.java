package dev.pekelund.genai.caching;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.genai.client.AbstractServiceClient;
import dev.pekelund.genai.client.GenerativeAiSettings;
import dev.pekelund.genai.client.Page;
import dev.pekelund.genai.client.PagedIterable;
import dev.pekelund.genai.client.UpdatePaths;
import io.micrometer.observation.ObservationRegistry;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.util.Assert;
import org.springframework.web.client.RestClient;

/**
 * Create, read, update and delete operations for cached content.
 */
public class CachedContentService extends AbstractServiceClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(CachedContentService.class);

    private static final String PREFIX = "cachedContents/";
    private static final Set<String> TTL_PATHS = Set.of("ttl");
    private static final Set<String> EXPIRE_TIME_PATHS = Set.of("expire_time", "expireTime");

    public CachedContentService(RestClient restClient, GenerativeAiSettings settings, ObjectMapper objectMapper,
        ObservationRegistry observationRegistry) {
        super(restClient, settings, objectMapper, observationRegistry);
    }

    public CachedContent create(CreateCachedContentRequest request) {
        Assert.notNull(request, "Request must not be null");
        return execute("createCachedContent", request.getModel(), () -> {
            CachedContent created = restClient.post()
                .uri(uriBuilder -> resourcePath(uriBuilder, "cachedContents").build())
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(CachedContent.class);
            LOGGER.info("Created cached content '{}' for model '{}' (expires {})",
                created != null ? created.name() : null, request.getModel(),
                created != null ? created.expireTime() : null);
            return created;
        });
    }

    public CachedContent get(String name) {
        String resource = qualify(name);
        return execute("getCachedContent", resource, () -> restClient.get()
            .uri(uriBuilder -> resourcePath(uriBuilder, resource).build())
            .retrieve()
            .body(CachedContent.class));
    }

    public PagedIterable<CachedContent> list(Integer pageSize) {
        return new PagedIterable<>(pageToken -> execute("listCachedContents", PREFIX, () -> {
            ListResponse response = restClient.get()
                .uri(uriBuilder -> {
                    resourcePath(uriBuilder, "cachedContents");
                    if (pageSize != null) {
                        uriBuilder.queryParam("pageSize", pageSize);
                    }
                    if (pageToken != null) {
                        uriBuilder.queryParam("pageToken", pageToken);
                    }
                    return uriBuilder.build();
                })
                .retrieve()
                .body(ListResponse.class);
            return response != null ? new Page<>(response.cachedContents(), response.nextPageToken())
                : new Page<CachedContent>(List.of(), null);
        }));
    }

    /**
     * Updates the expiry of a cached content. Only {@code ttl} (a {@link Duration}, a number of
     * seconds or a {@code "<n>s"} string) or {@code expire_time} (an {@link Instant} or an RFC 3339
     * string) may be given, and not both.
     *
     * @throws IllegalArgumentException for any other field
     */
    public CachedContent update(String name, Map<String, ?> updates) {
        String resource = qualify(name);
        Map<String, Object> flat = UpdatePaths.flatten(updates);
        if (flat.isEmpty()) {
            throw new IllegalArgumentException("At least one update is required");
        }

        Map<String, Object> body = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : flat.entrySet()) {
            String path = entry.getKey();
            if (TTL_PATHS.contains(path)) {
                body.put("ttl", ttlValue(entry.getValue()));
            } else if (EXPIRE_TIME_PATHS.contains(path)) {
                body.put("expireTime", expireTimeValue(entry.getValue()));
            } else {
                throw new IllegalArgumentException("As of now, only `ttl` or `expire_time` can be updated for "
                    + "`CachedContent`. Got: `" + path + "` instead.");
            }
        }
        if (body.size() > 1) {
            throw new IllegalArgumentException(
                "Exclusive arguments: Please provide either `ttl` or `expire_time`, not both.");
        }

        String updateMask = UpdatePaths.toFieldMask(body.keySet());
        return execute("updateCachedContent", resource, () -> restClient.patch()
            .uri(uriBuilder -> resourcePath(uriBuilder, resource)
                .queryParam("updateMask", updateMask)
                .build())
            .contentType(MediaType.APPLICATION_JSON)
            .body(body)
            .retrieve()
            .body(CachedContent.class));
    }

    public void delete(String name) {
        String resource = qualify(name);
        execute("deleteCachedContent", resource, () -> restClient.delete()
            .uri(uriBuilder -> resourcePath(uriBuilder, resource).build())
            .retrieve()
            .toBodilessEntity());
        LOGGER.info("Deleted cached content '{}'", resource);
    }

    static String qualify(String name) {
        Assert.hasText(name, "Cached content name must not be empty");
        return name.startsWith(PREFIX) ? name : PREFIX + name;
    }

    private static String ttlValue(Object value) {
        if (value instanceof Duration duration) {
            return CreateCachedContentRequest.formatDuration(duration);
        }
        if (value instanceof Number seconds) {
            return seconds.longValue() + "s";
        }
        if (value instanceof String text && text.endsWith("s")) {
            return text;
        }
        throw new IllegalArgumentException("Unsupported `ttl` value: " + value);
    }

    private static String expireTimeValue(Object value) {
        if (value instanceof Instant instant) {
            return instant.toString();
        }
        if (value instanceof String text) {
            try {
                return Instant.parse(text).toString();
            } catch (DateTimeParseException ex) {
                throw new IllegalArgumentException("`expire_time` must be an RFC 3339 timestamp: " + text, ex);
            }
        }
        throw new IllegalArgumentException("Unsupported `expire_time` value: " + value);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ListResponse(List<CachedContent> cachedContents, String nextPageToken) {
    }
}
