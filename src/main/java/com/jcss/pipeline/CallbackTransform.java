package com.jcss.pipeline;

import com.jcss.node.Root;

/**
 * A transform unit that reports completion through {@link Done}. The pipeline does
 * not move on until one of the {@code Done} methods has been called.
 */
@FunctionalInterface
public interface CallbackTransform {
    void apply(Root root, ProcessOptions options, Done done);
}
