package com.qqsuccubus.pacer.scheduler.pool;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.function.Consumer;

/**
 * Waits on futures whose failures must not abort the surrounding map or batch.
 */
public final class TaskResults {
    private TaskResults() {
    }

    /**
     * Waits for a result, substituting {@code null} for a failed or cancelled unit of work.
     *
     * @param future    Pending result
     * @param onFailure Receives the failure cause (for logging and metrics)
     * @return The result, or {@code null} if the work failed
     * @throws InterruptedException if interrupted while waiting
     */
    public static <T> T awaitOrNull(Future<? extends T> future, Consumer<Throwable> onFailure)
            throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            onFailure.accept(e.getCause() != null ? e.getCause() : e);
            return null;
        } catch (CancellationException e) {
            onFailure.accept(e);
            return null;
        }
    }
}
