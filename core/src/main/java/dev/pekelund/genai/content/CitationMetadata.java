package dev.pekelund.genai.content;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CitationMetadata(List<CitationSource> citationSources) {

    public CitationMetadata {
        citationSources = citationSources != null ? List.copyOf(citationSources) : List.of();
    }
}
