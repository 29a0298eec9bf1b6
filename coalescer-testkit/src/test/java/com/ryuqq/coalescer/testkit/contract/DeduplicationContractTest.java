package com.ryuqq.coalescer.testkit.contract;

import com.ryuqq.coalescer.application.telemetry.CoalescerStats;
import com.ryuqq.coalescer.core.model.RequestKey;
import com.ryuqq.coalescer.core.model.RequestOptions;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: Deduplication of identical in-flight requests.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>N concurrent calls with one key → one invocation, duplicates N-1</li>
 *   <li>Operation failure delivered verbatim to every waiter</li>
 *   <li>A resolved key starts a fresh execution</li>
 *   <li>Keys derived from reordered parameters deduplicate</li>
 * </ul>
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
class DeduplicationContractTest extends AbstractEngineContractTest {

    @Test
    void testDedup_ThreeCallersSameKey_OperationInvokedOnce() {
        // Given
        ManualOperation<Integer> operation = new ManualOperation<>();
        RequestOptions options = RequestOptions.defaults().withCost(0.01);

        // When
        CompletableFuture<Integer> first = coalescer.execute(operation, key("k1"), options);
        CompletableFuture<Integer> second = coalescer.execute(operation, key("k1"), options);
        CompletableFuture<Integer> third = coalescer.execute(operation, key("k1"), options);
        operation.completeLatest(42);

        // Then
        assertEquals(42, awaitResult(first));
        assertEquals(42, awaitResult(second));
        assertEquals(42, awaitResult(third));
        assertEquals(1, operation.invocationCount(), "Operation must run once per key");

        CoalescerStats stats = coalescer.getStats();
        assertEquals(3, stats.totalRequests());
        assertEquals(2, stats.duplicateRequests());
        assertEquals(0.02, stats.costSaved(), 1e-9);
    }

    @Test
    void testDedup_OperationFails_EveryWaiterReceivesSameError() {
        // Given
        ManualOperation<String> operation = new ManualOperation<>();
        CompletableFuture<String> first = coalescer.execute(operation, key("failing"));
        CompletableFuture<String> second = coalescer.execute(operation, key("failing"));
        IllegalStateException failure = new IllegalStateException("remote unavailable");

        // When
        operation.failLatest(failure);

        // Then
        assertSame(failure, awaitFailure(first));
        assertSame(failure, awaitFailure(second));
        assertEquals(0, coalescer.getStats().currentPending());
    }

    @Test
    void testDedup_AfterResolution_SameKeyRunsAgain() {
        // Given
        ManualOperation<String> operation = ManualOperation.returning("value");
        awaitResult(coalescer.execute(operation, key("k1")));

        // When
        awaitResult(coalescer.execute(operation, key("k1")));

        // Then
        assertEquals(2, operation.invocationCount());
        assertEquals(0, coalescer.getStats().duplicateRequests());
    }

    @Test
    void testDedup_ReorderedParameters_SameKey() {
        // Given
        RequestKey a = coalescer.generateKey("summarize", Map.of("model", "m1", "maxTokens", 256));
        RequestKey b = coalescer.generateKey("summarize", Map.of("maxTokens", 256, "model", "m1"));
        ManualOperation<String> operation = new ManualOperation<>();

        // When
        CompletableFuture<String> first = coalescer.execute(operation, a);
        CompletableFuture<String> second = coalescer.execute(operation, b);
        operation.completeLatest("summary");

        // Then
        assertEquals(a, b);
        assertEquals("summary", awaitResult(first));
        assertEquals("summary", awaitResult(second));
        assertEquals(1, operation.invocationCount());
    }
}
