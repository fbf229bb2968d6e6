package com.questrail.netconn;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Runs asynchronous write sequences one after another.
 *
 * <p>A connection orders the parts of each typed write, but two independent
 * producers issuing typed writes at the same time can interleave their parts.
 * Producers that share a connection submit their sequences here instead; each
 * task starts only after the previous one has completed, successfully or
 * not.</p>
 */
public final class WriteQueue
{
    private CompletableFuture<?> tail = CompletableFuture.completedFuture(null);

    /**
     * Queue {@code task}. The returned future mirrors the task's own result.
     */
    public synchronized <T> CompletableFuture<T> submit(Supplier<? extends CompletionStage<T>> task)
    {
        CompletableFuture<T> result = new CompletableFuture<>();
        tail.whenComplete((ignored, previousFailure) -> {
            try {
                task.get().whenComplete((value, failure) -> {
                    if (failure != null) {
                        result.completeExceptionally(failure);
                    }
                    else {
                        result.complete(value);
                    }
                });
            }
            catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        tail = result;
        return result;
    }
}
