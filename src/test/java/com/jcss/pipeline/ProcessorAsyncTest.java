package com.jcss.pipeline;

import com.jcss.node.Comment;
import com.jcss.node.Declaration;
import com.jcss.node.Root;
import com.jcss.parse.CssParser;
import com.jcss.parse.CssSyntaxError;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class ProcessorAsyncTest {

    private static final CallbackTransform BEFORE_CONTENT = (root, options, done) -> {
        root.eachRule(rule -> {
            if (!rule.selector().matches(".*::(before|after).*")) {
                return;
            }
            if (!rule.some(node -> node instanceof Declaration decl && decl.prop().equals("content"))) {
                rule.prepend(Map.of("prop", "content", "value", "\"\""));
            }
        });
        CompletableFuture.runAsync(done::complete);
    };

    private static Result await(CompletableFuture<Result> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    private static Throwable failureOf(CompletableFuture<Result> future) {
        ExecutionException error = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        return error.getCause();
    }

    private static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // ============================================================
    // Input forms
    // ============================================================

    @Test
    public void testProcessesCss() throws Exception {
        Result result = await(new Processor().use(BEFORE_CONTENT).async("a::before{top:0}"));

        assertEquals("a::before{content:\"\";top:0}", result.css());
    }

    @Test
    public void testProcessesParsedRoot() throws Exception {
        Root root = new CssParser("a::before{top:0}").parse();

        Result result = await(new Processor().use(BEFORE_CONTENT).async(root));

        assertEquals("a::before{content:\"\";top:0}", result.css());
    }

    @Test
    public void testProcessesPreviousResult() throws Exception {
        Result previous = Processor.of((root, options) -> root).process("a::before{top:0}");

        Result result = await(new Processor().use(BEFORE_CONTENT).async(previous));

        assertEquals("a::before{content:\"\";top:0}", result.css());
    }

    @Test
    public void testEmptyRootReplacement() throws Exception {
        Result result = await(Processor.of((root, options) -> new Root()).async("a {}"));

        assertEquals("", result.css());
    }

    @Test
    public void testResultObject() throws Exception {
        Processor processor = new Processor();

        Result result = await(processor.async("a{}"));

        assertSame(processor, result.processor());
        assertEquals("a{}", result.css());
        assertEquals("a{}", result.toString());
    }

    @Test
    public void testCallsAllUnits() throws Exception {
        StringBuffer calls = new StringBuffer();
        Transform a = (root, options) -> {
            calls.append('a');
            return null;
        };
        Transform b = (root, options) -> {
            calls.append('b');
            return null;
        };

        await(Processor.of(a, b).async(""));

        assertEquals("ab", calls.toString());
    }

    @Test
    public void testOptionsReachUnits() throws Exception {
        StringBuffer labels = new StringBuffer();
        Transform record = (root, options) -> {
            assertNotNull(root);
            labels.append(options.from());
            return null;
        };

        Result result = await(Processor.of(record).async("a {}", ProcessOptions.from("a.css")));

        assertEquals("a.css", labels.toString());
        assertEquals("a.css", result.options().from());
    }

    @Test
    public void testNullOptionsRejected() {
        Processor processor = new Processor();
        Result previous = processor.process("a{}");

        NullPointerException error = assertThrows(NullPointerException.class,
            () -> processor.async("a{}", null));
        assertEquals("options", error.getMessage());
        assertThrows(NullPointerException.class, () -> processor.async(new Root(), null));
        assertThrows(NullPointerException.class, () -> processor.async(previous, null));
    }

    // ============================================================
    // Ordering
    // ============================================================

    @Test
    public void testSlowUnitFinishesBeforeNextStarts() throws Exception {
        StringBuffer order = new StringBuffer();
        AsyncTransform slow = (root, options) -> CompletableFuture.supplyAsync(() -> {
            pause(50);
            order.append('a');
            return null;
        });
        Transform fast = (root, options) -> {
            order.append('b');
            return null;
        };

        Result result = await(new Processor().use(slow).use(fast).async("a{}"));

        assertEquals("ab", order.toString());
        assertEquals("a{}", result.css());
    }

    @Test
    public void testCallbackUnitFromAnotherThread() throws Exception {
        StringBuffer order = new StringBuffer();
        CallbackTransform later = (root, options, done) -> new Thread(() -> {
            pause(50);
            order.append('a');
            done.complete();
        }).start();
        Transform next = (root, options) -> {
            order.append('b');
            return null;
        };

        await(new Processor().use(later).use(next).async("a{}"));

        assertEquals("ab", order.toString());
    }

    @Test
    public void testSyncUnitsInAsyncPath() throws Exception {
        Transform add = (root, options) -> {
            root.append(new Comment("x"));
            return null;
        };

        Result result = await(Processor.of(add).async("a{}"));

        assertEquals("a{}\n/* x */", result.css());
    }

    @Test
    public void testAsyncReplacementRoot() throws Exception {
        Root replacement = new CssParser("b{}").parse();
        AsyncTransform swap = (root, options) -> CompletableFuture.completedFuture(replacement);
        CallbackTransform check = (root, options, done) -> {
            if (root == replacement) {
                done.complete();
            } else {
                done.fail(new AssertionError("expected the replacement root"));
            }
        };

        Result result = await(new Processor().use(swap).use(check).async("a{}"));

        assertSame(replacement, result.root());
        assertEquals("b{}", result.css());
    }

    @Test
    public void testCallbackReplacementRoot() throws Exception {
        Root replacement = new Root();
        CallbackTransform swap = (root, options, done) -> done.complete(replacement);

        Result result = await(new Processor().use(swap).async("a{}"));

        assertSame(replacement, result.root());
        assertEquals("", result.css());
    }

    @Test
    public void testFirstDoneSignalWins() throws Exception {
        CallbackTransform twice = (root, options, done) -> {
            done.complete();
            done.fail(new IllegalStateException("late"));
        };

        Result result = await(new Processor().use(twice).async("a{}"));

        assertEquals("a{}", result.css());
    }

    @Test
    public void testOptionsAndPreviousResult() throws Exception {
        StringBuffer labels = new StringBuffer();
        CallbackTransform record = (root, options, done) -> {
            labels.append(options.from());
            done.complete();
        };
        Processor processor = new Processor().use(record);

        Result first = await(processor.async("a{}", ProcessOptions.from("x.css")));
        Result second = await(processor.async(first));

        assertEquals("x.cssx.css", labels.toString());
        assertSame(first.root(), second.root());
        assertEquals("x.css", second.options().from());
    }

    // ============================================================
    // Failures
    // ============================================================

    @Test
    public void testSyntaxErrorCompletesExceptionally() {
        CompletableFuture<Result> future = new Processor().async("a {", ProcessOptions.from("A"));

        assertTrue(future.isCompletedExceptionally());
        Throwable cause = failureOf(future);
        assertTrue(cause instanceof CssSyntaxError);
        assertEquals("A:1:1: Unclosed block", cause.getMessage());
    }

    @Test
    public void testThrowingUnitCompletesExceptionally() {
        IllegalStateException failure = new IllegalStateException("boom");
        StringBuffer order = new StringBuffer();
        Transform failing = (root, options) -> {
            throw failure;
        };
        Transform after = (root, options) -> {
            order.append('x');
            return null;
        };

        Throwable cause = failureOf(Processor.of(failing, after).async("a{}"));

        assertSame(failure, cause);
        assertEquals("", order.toString());
    }

    @Test
    public void testFailedStageCompletesExceptionally() {
        IllegalArgumentException failure = new IllegalArgumentException("rejected");
        AsyncTransform failing = (root, options) -> CompletableFuture.failedFuture(failure);

        assertSame(failure, failureOf(new Processor().use(failing).async("a{}")));
    }

    @Test
    public void testDoneFailCompletesExceptionally() {
        IllegalStateException failure = new IllegalStateException("callback failed");
        CallbackTransform failing = (root, options, done) -> done.fail(failure);

        assertSame(failure, failureOf(new Processor().use(failing).async("a{}")));
    }

    @Test
    public void testThrowingCallbackCompletesExceptionally() {
        IllegalStateException failure = new IllegalStateException("thrown");
        CallbackTransform failing = (root, options, done) -> {
            throw failure;
        };

        assertSame(failure, failureOf(new Processor().use(failing).async("a{}")));
    }
}
