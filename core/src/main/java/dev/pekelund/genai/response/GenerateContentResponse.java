package dev.pekelund.genai.response;

import dev.pekelund.genai.content.GenerateContentChunk;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Response to a generate-content call, either complete or still streaming.
 *
 * <p>Iterating yields one snapshot per received chunk. Iteration is restartable: a second pass
 * replays the buffered chunks and only pulls from the source for steps it has not seen. Reading
 * {@link #text()}, {@link #parts()} or {@link #candidates()} requires the stream to be finished,
 * either by iterating to the end or through {@link #drain()}.
 *
 * <pre>{@code
 * try (GenerateContentResponse response = model.streamGenerateContent("Tell me a story")) {
 *     for (GenerateContentResponse step : response) {
 *         System.out.print(step.text());
 *     }
 *     String story = response.text();
 * }
 * }</pre>
 */
public final class GenerateContentResponse extends BaseGenerateContentResponse
    implements Iterable<GenerateContentResponse> {

    private final ChunkSource source;

    private GenerateContentResponse(GenerateContentChunk first, ChunkSource source) {
        super(first, source != null ? source::close : null);
        this.source = source;
    }

    /**
     * Wraps a response that was received in full.
     */
    public static GenerateContentResponse fromResponse(GenerateContentChunk chunk) {
        return new GenerateContentResponse(chunk, null);
    }

    /**
     * Wraps a live stream, pulling its first chunk immediately.
     *
     * @throws ResponseStreamException when the stream ends before its first chunk
     */
    public static GenerateContentResponse fromSource(ChunkSource source) {
        Objects.requireNonNull(source, "source");
        return new GenerateContentResponse(firstChunk(pull(source), source::close), source);
    }

    public static GenerateContentResponse fromIterator(Iterator<GenerateContentChunk> iterator) {
        return fromSource(ChunkSource.fromIterator(iterator));
    }

    @Override
    public Iterator<GenerateContentResponse> iterator() {
        return new StepIterator();
    }

    public Stream<GenerateContentResponse> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    /**
     * Consumes the rest of the stream so the accumulated attributes become readable. Does nothing
     * once the stream is done; re-raises the recorded error once it has failed.
     */
    public void drain() {
        if (state() == StreamState.DONE) {
            return;
        }
        Iterator<GenerateContentResponse> steps = iterator();
        while (steps.hasNext()) {
            steps.next();
        }
    }

    private static ChunkSignal pull(ChunkSource source) {
        try {
            ChunkSignal signal = source.next();
            return signal != null
                ? signal
                : ChunkSignal.failure(new ResponseStreamException("The response stream produced no signal"));
        } catch (RuntimeException ex) {
            return ChunkSignal.failure(ex);
        }
    }

    private final class StepIterator implements Iterator<GenerateContentResponse> {

        private int step;

        @Override
        public boolean hasNext() {
            while (true) {
                StepStatus status = probe(step);
                if (status == StepStatus.AVAILABLE) {
                    return true;
                }
                if (status == StepStatus.EXHAUSTED) {
                    return false;
                }
                accept(pull(source));
            }
        }

        @Override
        public GenerateContentResponse next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return fromResponse(chunkAt(step++));
        }
    }
}
