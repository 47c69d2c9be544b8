package dev.pekelund.genai.retriever;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Comparison applied by a metadata {@link Condition}. Numbers follow the service's enum values.
 */
public enum ConditionOperator {
    @JsonEnumDefaultValue
    OPERATOR_UNSPECIFIED(0, "unspecified"),
    LESS(1, "less", "<"),
    LESS_EQUAL(2, "less_equal", "<="),
    EQUAL(3, "equal", "=="),
    GREATER_EQUAL(4, "greater_equal", ">="),
    GREATER(5, "greater", ">"),
    NOT_EQUAL(6, "not_equal", "!="),
    INCLUDES(7, "includes", "in"),
    EXCLUDES(8, "excludes", "not in");

    private static final Map<String, ConditionOperator> ALIASES = new HashMap<>();

    static {
        for (ConditionOperator operator : values()) {
            ALIASES.put(operator.name().toLowerCase(Locale.ROOT), operator);
            ALIASES.put("operator_" + operator.name().toLowerCase(Locale.ROOT), operator);
            ALIASES.put(Integer.toString(operator.number), operator);
            for (String alias : operator.aliases) {
                ALIASES.put(alias, operator);
            }
        }
    }

    private final int number;
    private final String[] aliases;

    ConditionOperator(int number, String... aliases) {
        this.number = number;
        this.aliases = aliases;
    }

    public int number() {
        return number;
    }

    /**
     * Accepts an operator, its number, or one of its names and symbols ({@code "less"},
     * {@code "operator_less"}, {@code "<"}), ignoring case.
     *
     * @throws IllegalArgumentException for anything else
     */
    public static ConditionOperator parse(Object value) {
        if (value instanceof ConditionOperator operator) {
            return operator;
        }
        if (value == null) {
            throw new IllegalArgumentException("Condition operator must not be null");
        }
        ConditionOperator operator = ALIASES.get(value.toString().trim().toLowerCase(Locale.ROOT));
        if (operator == null) {
            throw new IllegalArgumentException("Unknown condition operator: " + value);
        }
        return operator;
    }
}
