package dev.pekelund.genai.content;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Arrays;
import java.util.List;

/**
 * A role plus the ordered parts produced or supplied under that role.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Content(String role, List<Part> parts) {

    public static final String ROLE_USER = "user";
    public static final String ROLE_MODEL = "model";

    public Content {
        parts = parts != null ? List.copyOf(parts) : List.of();
    }

    public static Content user(String text) {
        return new Content(ROLE_USER, List.of(Part.fromText(text)));
    }

    public static Content model(String text) {
        return new Content(ROLE_MODEL, List.of(Part.fromText(text)));
    }

    public static Content of(String role, Part... parts) {
        return new Content(role, Arrays.asList(parts));
    }
}
