package dev.pekelund.genai.response;

import java.util.Objects;
import java.util.concurrent.CompletionStage;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Non-blocking counterpart of {@link ChunkSource}: every pull completes a stage instead of
 * blocking the caller.
 */
@FunctionalInterface
public interface AsyncChunkSource extends AutoCloseable {

    CompletionStage<ChunkSignal> next();

    @Override
    default void close() {
    }

    /**
     * Adapts a blocking source by running each pull on the given scheduler.
     */
    static AsyncChunkSource offload(ChunkSource source, Scheduler scheduler) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(scheduler, "scheduler");
        return new AsyncChunkSource() {

            @Override
            public CompletionStage<ChunkSignal> next() {
                return Mono.fromCallable(source::next)
                    .subscribeOn(scheduler)
                    .toFuture();
            }

            @Override
            public void close() {
                source.close();
            }
        };
    }
}
