package com.jcss.pipeline;

import com.jcss.node.Root;

/**
 * A transform unit that finishes before it returns.
 */
@FunctionalInterface
public interface Transform {
    /**
     * @return a root to continue with instead of {@code root}, or null to keep it
     */
    Root apply(Root root, ProcessOptions options);
}
