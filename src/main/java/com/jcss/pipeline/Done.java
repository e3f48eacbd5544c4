package com.jcss.pipeline;

import com.jcss.node.Root;

import java.util.concurrent.CompletableFuture;

/**
 * Completion signal handed to a {@link CallbackTransform}. Only the first call counts.
 */
public final class Done {
    private final CompletableFuture<Root> future = new CompletableFuture<>();

    Done() {
    }

    public void complete() {
        future.complete(null);
    }

    public void complete(Root replacement) {
        future.complete(replacement);
    }

    public void fail(Throwable error) {
        future.completeExceptionally(error);
    }

    CompletableFuture<Root> future() {
        return future;
    }
}
