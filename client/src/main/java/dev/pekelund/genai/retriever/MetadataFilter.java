package dev.pekelund.genai.retriever;

import java.util.Arrays;
import java.util.List;
import org.springframework.util.Assert;

/**
 * Conditions on one metadata key. Conditions on the same key are OR-ed, filters are AND-ed.
 */
public record MetadataFilter(String key, List<Condition> conditions) {

    public MetadataFilter {
        Assert.hasText(key, "Metadata filter key must not be empty");
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
    }

    public static MetadataFilter of(String key, Condition... conditions) {
        return new MetadataFilter(key, Arrays.asList(conditions));
    }
}
