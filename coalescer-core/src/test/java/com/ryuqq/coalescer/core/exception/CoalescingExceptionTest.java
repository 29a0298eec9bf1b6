package com.ryuqq.coalescer.core.exception;

import com.ryuqq.coalescer.core.model.BatchType;
import com.ryuqq.coalescer.core.model.RequestKey;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 합성 실패 예외와 FailureKind 분류 테스트.
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
class CoalescingExceptionTest {

    private static final RequestKey KEY = RequestKey.of("k1");

    @Test
    void timeout_CarriesKeyAgeAndLimit() {
        // When
        RequestTimeoutException exception = new RequestTimeoutException(KEY, 30_500, 30_000);

        // Then
        assertEquals(KEY, exception.key());
        assertEquals(FailureKind.TIMEOUT, exception.kind());
        assertEquals(30_500, exception.ageMs());
        assertEquals(30_000, exception.maxPendingTimeMs());
        assertTrue(exception.getMessage().contains("exceeded maximum pending time"));
        assertTrue(exception.getMessage().contains("k1"));
    }

    @Test
    void cancelled_MessageDependsOnReason() {
        RequestCancelledException cancelled = new RequestCancelledException(KEY, RequestCancelledException.Reason.CANCELLED);
        RequestCancelledException cleared = new RequestCancelledException(KEY, RequestCancelledException.Reason.CLEARED);

        assertEquals(FailureKind.CANCELLED, cancelled.kind());
        assertEquals(RequestCancelledException.Reason.CANCELLED, cancelled.reason());
        assertTrue(cancelled.getMessage().startsWith("Request cancelled"));
        assertTrue(cleared.getMessage().startsWith("All requests cleared"));
    }

    @Test
    void batchOrchestration_KeepsCauseAndType() {
        // Given
        RejectedExecutionException cause = new RejectedExecutionException("shut down");

        // When
        BatchOrchestrationException exception = new BatchOrchestrationException(KEY, BatchType.of("embed"), cause);

        // Then
        assertSame(cause, exception.getCause());
        assertEquals(BatchType.of("embed"), exception.batchType());
        assertEquals(FailureKind.BATCH_ORCHESTRATION_FAILURE, exception.kind());
    }

    @Test
    void nullKey_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new RequestTimeoutException(null, 1, 1)
        );
        assertTrue(exception.getMessage().contains("key cannot be null"));
        assertThrows(IllegalArgumentException.class, () -> new RequestCancelledException(KEY, null));
    }

    @Test
    void failureKind_ClassifiesErrors() {
        assertEquals(FailureKind.TIMEOUT, FailureKind.of(new RequestTimeoutException(KEY, 2, 1)));
        assertEquals(FailureKind.CANCELLED,
            FailureKind.of(new RequestCancelledException(KEY, RequestCancelledException.Reason.CLEARED)));
        assertEquals(FailureKind.OPERATION_FAILURE, FailureKind.of(new IOException("remote")));
        assertThrows(IllegalArgumentException.class, () -> FailureKind.of(null));
    }
}
