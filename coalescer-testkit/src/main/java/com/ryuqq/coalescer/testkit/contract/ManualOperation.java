package com.ryuqq.coalescer.testkit.contract;

import com.ryuqq.coalescer.core.operation.Operation;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Controllable {@link Operation} for contract tests.
 *
 * <p>Every invocation is counted and returns a fresh pending future that the test completes
 * explicitly, so the test decides when the "remote call" finishes.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ManualOperation&lt;Integer&gt; operation = new ManualOperation&lt;&gt;();
 * CompletableFuture&lt;Integer&gt; result = coalescer.execute(operation, key);
 * operation.completeLatest(42);
 * assertEquals(1, operation.invocationCount());
 * </pre>
 *
 * @param <T> result type
 * @author Coalescer Team
 * @since 1.0.0
 */
public final class ManualOperation<T> implements Operation<T> {

    private final List<CompletableFuture<T>> invocations = new ArrayList<>();
    private final boolean autoComplete;
    private final T autoValue;

    /**
     * Creates an operation whose invocations stay pending until completed by the test.
     */
    public ManualOperation() {
        this(false, null);
    }

    private ManualOperation(boolean autoComplete, T autoValue) {
        this.autoComplete = autoComplete;
        this.autoValue = autoValue;
    }

    /**
     * Creates an operation that completes every invocation immediately with the given value.
     *
     * @param value the result of every invocation
     * @param <T> result type
     * @return a new self-completing operation
     */
    public static <T> ManualOperation<T> returning(T value) {
        return new ManualOperation<>(true, value);
    }

    @Override
    public synchronized CompletionStage<T> invoke() {
        CompletableFuture<T> invocation = new CompletableFuture<>();
        invocations.add(invocation);
        if (autoComplete) {
            invocation.complete(autoValue);
        }
        return invocation;
    }

    /**
     * Completes the most recent invocation.
     *
     * @param value the result
     * @throws IllegalStateException if the operation was never invoked
     */
    public void completeLatest(T value) {
        latest().complete(value);
    }

    /**
     * Fails the most recent invocation.
     *
     * @param error the failure
     * @throws IllegalStateException if the operation was never invoked
     */
    public void failLatest(Throwable error) {
        latest().completeExceptionally(error);
    }

    /**
     * Completes a specific invocation (0-based).
     *
     * @param index invocation index
     * @param value the result
     */
    public synchronized void complete(int index, T value) {
        invocations.get(index).complete(value);
    }

    private synchronized CompletableFuture<T> latest() {
        if (invocations.isEmpty()) {
            throw new IllegalStateException("Operation was never invoked");
        }
        return invocations.get(invocations.size() - 1);
    }

    public synchronized int invocationCount() {
        return invocations.size();
    }
}
