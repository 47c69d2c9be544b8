package dev.pekelund.genai.response;

import dev.pekelund.genai.content.GenerateContentChunk;
import java.util.Iterator;
import java.util.Objects;

/**
 * Blocking, pull-based producer of response chunks. Each call to {@link #next()} blocks until the
 * next chunk, the end of the stream or a failure is known. Implementations report failures as
 * {@link ChunkSignal.Failure} rather than throwing.
 */
@FunctionalInterface
public interface ChunkSource extends AutoCloseable {

    ChunkSignal next();

    /**
     * Releases the underlying stream. Called once, when the stream has ended, failed or been
     * abandoned.
     */
    @Override
    default void close() {
    }

    static ChunkSource fromIterator(Iterator<GenerateContentChunk> iterator) {
        Objects.requireNonNull(iterator, "iterator");
        return () -> {
            try {
                return iterator.hasNext() ? ChunkSignal.item(iterator.next()) : ChunkSignal.end();
            } catch (RuntimeException ex) {
                return ChunkSignal.failure(ex);
            }
        };
    }
}
