package dev.pekelund.genai.response;

import dev.pekelund.genai.content.GenerateContentChunk;
import java.util.Objects;

/**
 * Outcome of pulling once from an upstream chunk sequence.
 */
public sealed interface ChunkSignal permits ChunkSignal.Item, ChunkSignal.End, ChunkSignal.Failure {

    static ChunkSignal item(GenerateContentChunk chunk) {
        return new Item(chunk);
    }

    static ChunkSignal end() {
        return End.INSTANCE;
    }

    static ChunkSignal failure(Throwable cause) {
        return new Failure(cause);
    }

    record Item(GenerateContentChunk chunk) implements ChunkSignal {

        public Item {
            Objects.requireNonNull(chunk, "chunk");
        }
    }

    record End() implements ChunkSignal {

        private static final End INSTANCE = new End();
    }

    record Failure(Throwable cause) implements ChunkSignal {

        public Failure {
            Objects.requireNonNull(cause, "cause");
        }
    }
}
