package dev.pekelund.genai.retriever;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Objects;

/**
 * One comparison inside a {@link MetadataFilter}, against either a string or a numeric value.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Condition(String stringValue, Double numericValue, ConditionOperator operation) {

    public Condition {
        Objects.requireNonNull(operation, "operation");
        if ((stringValue == null) == (numericValue == null)) {
            throw new IllegalArgumentException("A condition compares against exactly one of a string or a numeric value");
        }
    }

    public static Condition of(Object operator, String value) {
        return new Condition(value, null, ConditionOperator.parse(operator));
    }

    public static Condition of(Object operator, double value) {
        return new Condition(null, value, ConditionOperator.parse(operator));
    }
}
