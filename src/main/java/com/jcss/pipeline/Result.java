package com.jcss.pipeline;

import com.jcss.node.Root;
import com.jcss.output.Stringifier;

/**
 * The outcome of one pipeline run: the final root, the options the run used and
 * the processor that ran it. The CSS text is produced on first request and kept.
 */
public final class Result {
    private final Processor processor;
    private final Root root;
    private final ProcessOptions options;
    private String css;

    Result(Processor processor, Root root, ProcessOptions options) {
        this.processor = processor;
        this.root = root;
        this.options = options;
    }

    public Processor processor() {
        return processor;
    }

    public Root root() {
        return root;
    }

    public ProcessOptions options() {
        return options;
    }

    public String css() {
        if (css == null) {
            css = new Stringifier().stringify(root);
        }
        return css;
    }

    @Override
    public String toString() {
        return css();
    }
}
