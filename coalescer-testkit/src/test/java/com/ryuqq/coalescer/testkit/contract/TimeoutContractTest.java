package com.ryuqq.coalescer.testkit.contract;

import com.ryuqq.coalescer.core.exception.FailureKind;
import com.ryuqq.coalescer.core.exception.RequestTimeoutException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: Bounded waiting.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>A request that never completes times out for every waiter</li>
 *   <li>A late completion after timeout does not disturb a new request for the same key</li>
 * </ul>
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
class TimeoutContractTest extends AbstractEngineContractTest {

    @Test
    void testTimeout_NeverCompletes_AllWaitersTimeOut() {
        // Given
        ManualOperation<String> operation = new ManualOperation<>();

        // When
        CompletableFuture<String> first = coalescer.execute(operation, key("slow"));
        CompletableFuture<String> second = coalescer.execute(operation, key("slow"));

        // Then
        Throwable error = awaitFailure(first);
        assertInstanceOf(RequestTimeoutException.class, error);
        RequestTimeoutException timeout = (RequestTimeoutException) error;
        assertEquals(FailureKind.TIMEOUT, timeout.kind());
        assertEquals(key("slow"), timeout.key());
        assertTrue(timeout.ageMs() > CONTRACT_MAX_PENDING_TIME_MS);
        assertInstanceOf(RequestTimeoutException.class, awaitFailure(second));
        assertEquals(0, coalescer.getStats().currentPending());
    }

    @Test
    void testTimeout_LateCompletion_IgnoredForNewRequest() {
        // Given
        ManualOperation<String> operation = new ManualOperation<>();
        awaitFailure(coalescer.execute(operation, key("slow")));
        CompletableFuture<String> retried = coalescer.execute(operation, key("slow"));

        // When: the first invocation finishes late
        operation.complete(0, "stale");

        // Then
        assertFalse(retried.isDone(), "Stale completion must not resolve the new request");
        operation.complete(1, "fresh");
        assertEquals("fresh", awaitResult(retried));
    }
}
