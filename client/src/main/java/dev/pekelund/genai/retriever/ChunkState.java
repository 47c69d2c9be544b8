package dev.pekelund.genai.retriever;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

public enum ChunkState {
    @JsonEnumDefaultValue
    STATE_UNSPECIFIED(0, "unspecified"),
    STATE_PENDING_PROCESSING(1, "pending_processing", "pending"),
    STATE_ACTIVE(2, "active"),
    STATE_FAILED(10, "failed");

    private static final Map<String, ChunkState> ALIASES = new HashMap<>();

    static {
        for (ChunkState state : values()) {
            ALIASES.put(state.name().toLowerCase(Locale.ROOT), state);
            ALIASES.put(Integer.toString(state.number), state);
            for (String alias : state.aliases) {
                ALIASES.put(alias, state);
            }
        }
    }

    private final int number;
    private final String[] aliases;

    ChunkState(int number, String... aliases) {
        this.number = number;
        this.aliases = aliases;
    }

    public int number() {
        return number;
    }

    /**
     * Accepts a state, its number, or its name with or without the {@code state_} prefix.
     *
     * @throws IllegalArgumentException for anything else
     */
    public static ChunkState parse(Object value) {
        if (value instanceof ChunkState state) {
            return state;
        }
        if (value == null) {
            throw new IllegalArgumentException("Chunk state must not be null");
        }
        ChunkState state = ALIASES.get(value.toString().trim().toLowerCase(Locale.ROOT));
        if (state == null) {
            throw new IllegalArgumentException("Unknown chunk state: " + value);
        }
        return state;
    }
}
