package dev.pekelund.genai.response;

import dev.pekelund.genai.content.Candidate;
import dev.pekelund.genai.content.GenerateContentChunk;
import dev.pekelund.genai.content.Part;
import dev.pekelund.genai.content.PromptFeedback;
import dev.pekelund.genai.content.UsageMetadata;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State shared by the blocking and the non-blocking streamed response.
 *
 * <p>The buffer holds every chunk received so far and only ever grows. The accumulated result is
 * the left fold of the buffer through {@link ResponseChunkMerger}. Iteration keeps one chunk of
 * lookahead, so the step that is yielded last is the one during which the stream turned
 * {@link StreamState#DONE} or {@link StreamState#FAILED}.
 *
 * <p>The live source is closed as soon as the stream ends or fails. A caller that stops early
 * releases it through {@link #close()}.
 *
 * <p>Instances keep a single cursor and are not thread-safe.
 */
public abstract class BaseGenerateContentResponse implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(BaseGenerateContentResponse.class);

    private static final String INCOMPLETE_ITERATION_MESSAGE = "Please let the response complete iteration "
        + "before accessing the final accumulated attributes (or call `drain()`)";

    /**
     * Result of checking whether a given iteration step can be served.
     */
    protected enum StepStatus {
        AVAILABLE,
        EXHAUSTED,
        NEEDS_PULL
    }

    private final List<GenerateContentChunk> chunks = new ArrayList<>();
    private GenerateContentChunk result;
    private StreamState state;
    private Throwable error;
    private int errorStep;
    private final Runnable release;
    private boolean released;

    /**
     * @param first the first chunk of the stream
     * @param release closes the live source, or {@code null} for a response received in full
     */
    protected BaseGenerateContentResponse(GenerateContentChunk first, Runnable release) {
        Objects.requireNonNull(first, "first");
        this.chunks.add(first);
        this.result = first;
        this.release = release;
        this.released = release == null;
        this.state = release == null ? StreamState.DONE : StreamState.PENDING;
        if (release != null && first.promptBlocked()) {
            latch(new BlockedPromptException(first.promptFeedback()), 0);
        }
    }

    public StreamState state() {
        return state;
    }

    public List<Candidate> candidates() {
        return result().candidates();
    }

    /**
     * Parts of the sole candidate of the accumulated result.
     *
     * @throws AmbiguousResponseException when the result does not have exactly one candidate, or
     *     that candidate has no parts
     */
    public List<Part> parts() {
        List<Candidate> candidates = candidates();
        if (candidates.isEmpty()) {
            throw new AmbiguousResponseException("The `parts()` accessor only works for a single candidate, "
                + "but none were returned. Check `promptFeedback()` to see if the prompt was blocked.");
        }
        if (candidates.size() > 1) {
            throw new AmbiguousResponseException("The `parts()` accessor only works with a single candidate. "
                + "With multiple candidates use `candidates().get(index).content().parts()`.");
        }
        List<Part> parts = candidates.get(0).parts();
        if (parts.isEmpty()) {
            throw new AmbiguousResponseException("The `parts()` accessor requires the candidate to have content, "
                + "but it has none (finish reason: " + candidates.get(0).finishReason() + ").");
        }
        return parts;
    }

    /**
     * Text of a response made of one candidate with a single text part.
     */
    public String text() {
        List<Part> parts = parts();
        if (parts.size() > 1 || !parts.get(0).hasText()) {
            throw new AmbiguousResponseException("The `text()` accessor only works for simple (single part) "
                + "text responses. This response has " + parts.size() + " part(s). Use `parts()` or "
                + "`candidates().get(index).content().parts()` instead.");
        }
        return parts.get(0).text();
    }

    public UsageMetadata usageMetadata() {
        return result().usageMetadata();
    }

    /**
     * Prompt feedback of the first chunk. Available in every state.
     */
    public PromptFeedback promptFeedback() {
        return result.promptFeedback();
    }

    /**
     * The accumulated result.
     *
     * @throws IncompleteIterationException while the stream is still pending
     */
    public GenerateContentChunk result() {
        if (state == StreamState.PENDING) {
            throw new IncompleteIterationException(INCOMPLETE_ITERATION_MESSAGE);
        }
        return result;
    }

    protected final StepStatus probe(int step) {
        if (error != null && step >= errorStep) {
            state = StreamState.FAILED;
            throw raise(error);
        }
        if (step < chunks.size() - 1) {
            return StepStatus.AVAILABLE;
        }
        if (state != StreamState.PENDING) {
            return step < chunks.size() ? StepStatus.AVAILABLE : StepStatus.EXHAUSTED;
        }
        return StepStatus.NEEDS_PULL;
    }

    protected final void accept(ChunkSignal signal) {
        if (signal instanceof ChunkSignal.Item item) {
            GenerateContentChunk chunk = item.chunk();
            GenerateContentChunk merged;
            try {
                merged = ResponseChunkMerger.merge(result, chunk);
            } catch (ResponseMergeException ex) {
                latch(ex, chunks.size());
                return;
            }
            chunks.add(chunk);
            result = merged;
            if (chunk.promptBlocked()) {
                latch(new BlockedPromptException(chunk.promptFeedback()), chunks.size() - 1);
            }
        } else if (signal instanceof ChunkSignal.Failure failure) {
            latch(unchecked(failure.cause()), chunks.size());
        } else {
            state = StreamState.DONE;
            LOGGER.debug("Response stream completed after {} chunk(s)", chunks.size());
            releaseSource();
        }
    }

    /**
     * Releases the live source. Closing a pending response fails it with
     * {@link ResponseStreamException}; the chunks buffered so far can still be replayed.
     */
    @Override
    public void close() {
        if (state == StreamState.PENDING) {
            latch(new ResponseStreamException("The response stream was closed before it completed"), chunks.size());
        } else {
            releaseSource();
        }
    }

    protected final GenerateContentChunk chunkAt(int step) {
        return chunks.get(step);
    }

    protected final int bufferedChunks() {
        return chunks.size();
    }

    /**
     * Unwraps the signal that seeds a live stream, closing the source when there is no chunk.
     */
    protected static GenerateContentChunk firstChunk(ChunkSignal signal, Runnable release) {
        if (signal instanceof ChunkSignal.Item item) {
            return item.chunk();
        }
        Throwable failure = signal instanceof ChunkSignal.Failure f
            ? unchecked(f.cause())
            : new ResponseStreamException("The response stream ended before producing a chunk");
        try {
            release.run();
        } catch (RuntimeException ex) {
            failure.addSuppressed(ex);
        }
        throw raise(failure);
    }

    private void latch(Throwable cause, int step) {
        this.error = cause;
        this.errorStep = step;
        this.state = StreamState.FAILED;
        if (cause instanceof BlockedPromptException blocked) {
            LOGGER.warn("Prompt was blocked (block reason: {})", blocked.getPromptFeedback().blockReason());
        } else {
            LOGGER.debug("Response stream failed after {} chunk(s)", chunks.size(), cause);
        }
        releaseSource();
    }

    private void releaseSource() {
        if (released) {
            return;
        }
        released = true;
        try {
            release.run();
        } catch (RuntimeException ex) {
            if (error == null) {
                throw ex;
            }
            error.addSuppressed(ex);
        }
    }

    private static Throwable unchecked(Throwable cause) {
        if (cause instanceof RuntimeException || cause instanceof Error) {
            return cause;
        }
        if (cause instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        return new ResponseStreamException("Reading the response stream failed", cause);
    }

    private static RuntimeException raise(Throwable cause) {
        if (cause instanceof Error err) {
            throw err;
        }
        return (RuntimeException) cause;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{state=" + state + ", chunks=" + chunks.size() + ", result=" + result + "}";
    }
}
