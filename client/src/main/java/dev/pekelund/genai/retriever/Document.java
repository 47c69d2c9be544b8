package dev.pekelund.genai.retriever;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Document(
    String name,
    String displayName,
    List<CustomMetadata> customMetadata,
    Instant createTime,
    Instant updateTime
) {

    public Document {
        customMetadata = customMetadata != null ? List.copyOf(customMetadata) : List.of();
    }
}
