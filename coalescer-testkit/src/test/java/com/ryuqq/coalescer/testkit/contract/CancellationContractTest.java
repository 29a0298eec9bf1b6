package com.ryuqq.coalescer.testkit.contract;

import com.ryuqq.coalescer.core.exception.RequestCancelledException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: Cancellation and clearing.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Cancelling one key leaves other keys untouched</li>
 *   <li>Cancelling an unknown key returns false</li>
 *   <li>clearPending fails in-flight and batched waiters with CLEARED</li>
 * </ul>
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
class CancellationContractTest extends AbstractEngineContractTest {

    @Test
    void testCancel_OneKey_OtherKeysUnaffected() {
        // Given
        ManualOperation<String> cancelled = new ManualOperation<>();
        ManualOperation<String> kept = new ManualOperation<>();
        CompletableFuture<String> a = coalescer.execute(cancelled, key("a"));
        CompletableFuture<String> b = coalescer.execute(kept, key("b"));

        // When
        boolean result = coalescer.cancelRequest(key("a"));
        kept.completeLatest("kept");

        // Then
        assertTrue(result);
        RequestCancelledException error = assertInstanceOf(RequestCancelledException.class, awaitFailure(a));
        assertEquals(RequestCancelledException.Reason.CANCELLED, error.reason());
        assertEquals("kept", awaitResult(b));
    }

    @Test
    void testCancel_UnknownKey_ReturnsFalse() {
        assertFalse(coalescer.cancelRequest(key("missing")));
    }

    @Test
    void testClear_FailsEveryWaiterWithCleared() {
        // Given
        CompletableFuture<String> inFlight = coalescer.execute(new ManualOperation<>(), key("x"));
        CompletableFuture<String> batched = coalescer.execute(new ManualOperation<>(), key("y"), batchable("embed"));

        // When
        coalescer.clearPending();

        // Then
        for (CompletableFuture<String> future : List.of(inFlight, batched)) {
            RequestCancelledException error = assertInstanceOf(RequestCancelledException.class, awaitFailure(future));
            assertEquals(RequestCancelledException.Reason.CLEARED, error.reason());
        }
        assertTrue(coalescer.getPendingRequests().isEmpty());
    }
}
