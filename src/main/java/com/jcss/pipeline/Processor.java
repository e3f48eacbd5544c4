package com.jcss.pipeline;

import com.jcss.node.Root;
import com.jcss.parse.CssParser;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.jboss.logging.Logger;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * An ordered list of transform units and the two ways of running them over a tree.
 * <p>
 * {@code process} runs everything on the calling thread and accepts synchronous
 * units only. {@code async} waits for each unit's completion signal before starting
 * the next one and reports every failure through the returned future.
 */
public class Processor {
    private static final Logger LOG = Logger.getLogger(Processor.class);

    private final MutableList<TransformUnit> units = Lists.mutable.empty();

    public Processor() {
    }

    /**
     * @param units any mix of accepted transform-unit forms
     * @throws IllegalArgumentException if an element is not a transform unit
     */
    public Processor(Iterable<?> units) {
        for (Object unit : units) {
            use(unit);
        }
    }

    public static Processor of(Transform... transforms) {
        Processor processor = new Processor();
        for (Transform transform : transforms) {
            processor.use(transform);
        }
        return processor;
    }

    public Processor use(Transform transform) {
        units.add(TransformUnit.of(transform));
        return this;
    }

    public Processor use(Object unit) {
        units.add(TransformUnit.from(unit));
        return this;
    }

    public ImmutableList<TransformUnit> units() {
        return units.toImmutable();
    }

    // Blocking

    public Result process(String css) {
        return process(css, ProcessOptions.defaults());
    }

    /**
     * @throws com.jcss.parse.CssSyntaxError when the text cannot be parsed
     */
    public Result process(String css, ProcessOptions options) {
        Objects.requireNonNull(options, "options");
        requireSync();
        return run(new CssParser(css, options.from()).parse(), options);
    }

    public Result process(Root root) {
        return process(root, ProcessOptions.defaults());
    }

    public Result process(Root root, ProcessOptions options) {
        Objects.requireNonNull(options, "options");
        requireSync();
        return run(root, options);
    }

    /**
     * Continues from an earlier result, reusing its tree and its options.
     */
    public Result process(Result previous) {
        return process(previous.root(), previous.options());
    }

    public Result process(Result previous, ProcessOptions options) {
        Objects.requireNonNull(options, "options");
        return process(previous.root(), options);
    }

    private Result run(Root root, ProcessOptions options) {
        LOG.debugv("Processing {0} with {1} units", label(options), units.size());
        Root current = root;
        for (int i = 0; i < units.size(); i++) {
            LOG.debugv("Running unit {0}", i);
            Root replacement = ((TransformUnit.Sync) units.get(i)).transform().apply(current, options);
            current = replace(current, replacement, i);
        }
        return new Result(this, current, options);
    }

    private void requireSync() {
        int index = units.detectIndex(unit -> !(unit instanceof TransformUnit.Sync));
        if (index >= 0) {
            throw new IllegalStateException("Transform unit " + index
                + " completes asynchronously; use async() instead of process()");
        }
    }

    // Non-blocking

    public CompletableFuture<Result> async(String css) {
        return async(css, ProcessOptions.defaults());
    }

    public CompletableFuture<Result> async(String css, ProcessOptions options) {
        Objects.requireNonNull(options, "options");
        Root root;
        try {
            root = new CssParser(css, options.from()).parse();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return async(root, options);
    }

    public CompletableFuture<Result> async(Root root) {
        return async(root, ProcessOptions.defaults());
    }

    public CompletableFuture<Result> async(Root root, ProcessOptions options) {
        Objects.requireNonNull(options, "options");
        LOG.debugv("Processing {0} asynchronously with {1} units", label(options), units.size());
        CompletableFuture<Root> chain = CompletableFuture.completedFuture(root);
        for (int i = 0; i < units.size(); i++) {
            int index = i;
            TransformUnit unit = units.get(i);
            chain = chain.thenCompose(current -> start(unit, index, current, options)
                .thenApply(replacement -> replace(current, replacement, index)));
        }
        return chain.thenApply(current -> new Result(this, current, options));
    }

    public CompletableFuture<Result> async(Result previous) {
        return async(previous.root(), previous.options());
    }

    public CompletableFuture<Result> async(Result previous, ProcessOptions options) {
        Objects.requireNonNull(options, "options");
        return async(previous.root(), options);
    }

    private CompletableFuture<Root> start(TransformUnit unit, int index, Root root, ProcessOptions options) {
        LOG.debugv("Running unit {0}", index);
        try {
            if (unit instanceof TransformUnit.Sync sync) {
                return CompletableFuture.completedFuture(sync.transform().apply(root, options));
            }
            if (unit instanceof TransformUnit.Async asyncUnit) {
                return asyncUnit.transform().applyAsync(root, options).toCompletableFuture();
            }
            Done done = new Done();
            try {
                ((TransformUnit.Callback) unit).transform().apply(root, options, done);
            } catch (RuntimeException e) {
                done.fail(e);
            }
            return done.future();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static Root replace(Root current, Root replacement, int index) {
        if (replacement == null || replacement == current) {
            return current;
        }
        LOG.tracev("Unit {0} replaced the root", index);
        return replacement;
    }

    private static String label(ProcessOptions options) {
        return options.from() == null ? "<input>" : options.from();
    }
}
