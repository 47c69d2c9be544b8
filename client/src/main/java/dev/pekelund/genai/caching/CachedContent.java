package dev.pekelund.genai.caching;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.pekelund.genai.content.UsageMetadata;
import java.time.Instant;

/**
 * Server side cache of prompt content that later requests can refer to by {@code name}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CachedContent(
    String name,
    String model,
    String displayName,
    UsageMetadata usageMetadata,
    Instant createTime,
    Instant updateTime,
    Instant expireTime
) {
}
