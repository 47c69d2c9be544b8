package dev.pekelund.genai.content;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Token accounting reported by the service. Streams report running totals, so the latest
 * value describes the whole response.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record UsageMetadata(
    Integer promptTokenCount,
    Integer cachedContentTokenCount,
    Integer candidatesTokenCount,
    Integer totalTokenCount
) {
}
