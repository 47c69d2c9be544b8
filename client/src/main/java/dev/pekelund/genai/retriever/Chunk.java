package dev.pekelund.genai.retriever;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;

/**
 * A piece of a {@link Document}'s text, the unit returned by semantic queries.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Chunk(
    String name,
    ChunkData data,
    List<CustomMetadata> customMetadata,
    ChunkState state,
    Instant createTime,
    Instant updateTime
) {

    public Chunk {
        customMetadata = customMetadata != null ? List.copyOf(customMetadata) : List.of();
    }

    public String text() {
        return data != null ? data.stringValue() : null;
    }
}
