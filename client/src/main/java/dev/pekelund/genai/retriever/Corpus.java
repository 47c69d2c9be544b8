package dev.pekelund.genai.retriever;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

/**
 * A collection of {@link Document}s that can be queried semantically.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Corpus(String name, String displayName, Instant createTime, Instant updateTime) {
}
