package com.jcss.pipeline;

import com.jcss.node.Root;

import java.util.concurrent.CompletionStage;

/**
 * A transform unit that finishes when the returned stage completes. A stage that
 * completes with null keeps the current root.
 */
@FunctionalInterface
public interface AsyncTransform {
    CompletionStage<Root> applyAsync(Root root, ProcessOptions options);
}
