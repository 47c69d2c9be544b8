package dev.pekelund.genai.response;

import dev.pekelund.genai.content.GenerateContentChunk;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Non-blocking variant of {@link GenerateContentResponse}. Pulling the next chunk never blocks the
 * subscriber's thread; every merge runs in the completion callback of the pull that produced the
 * chunk.
 */
public final class AsyncGenerateContentResponse extends BaseGenerateContentResponse {

    private final AsyncChunkSource source;

    private AsyncGenerateContentResponse(GenerateContentChunk first, AsyncChunkSource source) {
        super(first, source != null ? source::close : null);
        this.source = source;
    }

    public static AsyncGenerateContentResponse fromResponse(GenerateContentChunk chunk) {
        return new AsyncGenerateContentResponse(chunk, null);
    }

    /**
     * Wraps a live stream. The returned {@link Mono} completes once the first chunk has arrived.
     */
    public static Mono<AsyncGenerateContentResponse> fromSource(AsyncChunkSource source) {
        Objects.requireNonNull(source, "source");
        return pull(source).map(signal -> new AsyncGenerateContentResponse(firstChunk(signal, source::close), source));
    }

    /**
     * Per-chunk snapshots, replaying buffered chunks before pulling new ones. Every subscription
     * starts a new pass from the first chunk.
     */
    public Flux<GenerateContentResponse> iterate() {
        return Flux.defer(() -> {
            AtomicInteger step = new AtomicInteger();
            return Mono.defer(() -> advanceTo(step.get()))
                .repeat()
                .takeWhile(Boolean::booleanValue)
                .map(available -> GenerateContentResponse.fromResponse(chunkAt(step.getAndIncrement())));
        });
    }

    public Mono<Void> drain() {
        return Mono.defer(() -> state() == StreamState.DONE ? Mono.empty() : iterate().then());
    }

    private Mono<Boolean> advanceTo(int step) {
        return Mono.defer(() -> {
            StepStatus status = probe(step);
            if (status == StepStatus.AVAILABLE) {
                return Mono.just(Boolean.TRUE);
            }
            if (status == StepStatus.EXHAUSTED) {
                return Mono.just(Boolean.FALSE);
            }
            return pull(source).flatMap(signal -> {
                accept(signal);
                return advanceTo(step);
            });
        });
    }

    private static Mono<ChunkSignal> pull(AsyncChunkSource source) {
        return Mono.defer(() -> Mono.fromCompletionStage(source.next()))
            .onErrorResume(ex -> Mono.just(ChunkSignal.failure(ex)))
            .switchIfEmpty(Mono.fromSupplier(
                () -> ChunkSignal.failure(new ResponseStreamException("The response stream produced no signal"))));
    }
}
