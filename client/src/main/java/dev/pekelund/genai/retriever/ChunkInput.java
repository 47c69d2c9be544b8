package dev.pekelund.genai.retriever;

import java.util.List;
import java.util.Objects;

/**
 * One entry of a batch create: plain text, text with a chunk name, or both plus metadata.
 */
public sealed interface ChunkInput permits ChunkInput.Text, ChunkInput.Named, ChunkInput.WithMetadata {

    String data();

    static ChunkInput of(String data) {
        return new Text(data);
    }

    static ChunkInput of(String name, String data) {
        return new Named(name, data);
    }

    static ChunkInput of(String name, String data, List<CustomMetadata> customMetadata) {
        return new WithMetadata(name, data, customMetadata);
    }

    record Text(String data) implements ChunkInput {

        public Text {
            Objects.requireNonNull(data, "data");
        }
    }

    record Named(String name, String data) implements ChunkInput {

        public Named {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(data, "data");
        }
    }

    record WithMetadata(String name, String data, List<CustomMetadata> customMetadata) implements ChunkInput {

        public WithMetadata {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(data, "data");
            customMetadata = customMetadata != null ? List.copyOf(customMetadata) : List.of();
        }
    }
}
