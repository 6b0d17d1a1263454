package gitcontext.core.repository;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A value computed at most once and shared by every caller.
 *
 * <pre>
 * UNCOMPUTED ──get()──▶ IN_PROGRESS(shared future) ──settles──▶ DONE(result)
 * </pre>
 *
 * Callers that arrive while the computation is in flight receive the same
 * future as the caller that started it.
 */
final class LazyValue<T> {
    private static final Logger logger = LoggerFactory.getLogger(LazyValue.class);

    enum State {
        UNCOMPUTED, IN_PROGRESS, DONE
    }

    private final String name;
    private final Supplier<CompletableFuture<Result<T>>> computation;
    private final AtomicReference<CompletableFuture<Result<T>>> future = new AtomicReference<>();
    private final AtomicInteger starts = new AtomicInteger();

    LazyValue(String name, Supplier<CompletableFuture<Result<T>>> computation) {
        this.name = name;
        this.computation = computation;
    }

    CompletableFuture<Result<T>> get() {
        CompletableFuture<Result<T>> existing = future.get();
        if (existing != null) {
            return existing;
        }

        CompletableFuture<Result<T>> created = new CompletableFuture<>();
        if (!future.compareAndSet(null, created)) {
            return future.get();
        }

        starts.incrementAndGet();
        logger.debug("Computing {}", name);
        try {
            computation.get().whenComplete((result, failure) -> {
                if (failure != null) {
                    created.completeExceptionally(failure);
                } else {
                    logger.debug("Computed {}: {}", name, result);
                    created.complete(result);
                }
            });
        } catch (RuntimeException e) {
            created.completeExceptionally(e);
        }
        return created;
    }

    State state() {
        CompletableFuture<Result<T>> current = future.get();
        if (current == null) {
            return State.UNCOMPUTED;
        }
        return current.isDone() ? State.DONE : State.IN_PROGRESS;
    }

    /**
     * How many times the computation has been started. Never more than one.
     */
    int starts() {
        return starts.get();
    }
}
