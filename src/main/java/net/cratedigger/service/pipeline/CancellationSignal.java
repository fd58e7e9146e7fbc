package net.cratedigger.service.pipeline;

import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Cooperative cancellation for a pipeline run.
 *
 * <p>Cancelling stops the run from waiting on outstanding provider calls. Work
 * already running elsewhere is left to finish and its result is discarded.</p>
 */
public final class CancellationSignal {

    private final CompletableFuture<Void> cancelled = new CompletableFuture<>();

    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancelled.complete(null);
    }

    public boolean isCancelled() {
        return cancelled.isDone();
    }

    /**
     * Waits for a future unless the signal fires first.
     *
     * @return the future's value, or empty when cancelled before it completed
     * @throws RuntimeException the future's own failure, unwrapped
     */
    public <T> Optional<T> await(CompletableFuture<T> future) {
        if (!future.isDone() && !isCancelled()) {
            try {
                CompletableFuture.anyOf(future, cancelled).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            } catch (ExecutionException e) {
                // the future failed; rethrown below with its original cause
            }
        }
        if (!future.isDone()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(future.join());
        } catch (CompletionException e) {
            throw unwrap(e);
        } catch (CancellationException e) {
            return Optional.empty();
        }
    }

    private static RuntimeException unwrap(CompletionException failure) {
        Throwable cause = failure.getCause();
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return failure;
    }
}
