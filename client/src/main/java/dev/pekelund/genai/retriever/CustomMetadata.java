package dev.pekelund.genai.retriever;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * User supplied key/value attached to a document or chunk. Exactly one of the value fields is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record CustomMetadata(String key, String stringValue, StringList stringListValue, Double numericValue) {

    public static CustomMetadata ofString(String key, String value) {
        return new CustomMetadata(key, value, null, null);
    }

    public static CustomMetadata ofStrings(String key, List<String> values) {
        return new CustomMetadata(key, null, new StringList(values), null);
    }

    public static CustomMetadata ofNumber(String key, double value) {
        return new CustomMetadata(key, null, null, value);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StringList(List<String> values) {

        public StringList {
            values = values != null ? List.copyOf(values) : List.of();
        }
    }
}
