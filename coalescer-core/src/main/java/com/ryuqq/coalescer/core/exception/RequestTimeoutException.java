package com.ryuqq.coalescer.core.exception;

import com.ryuqq.coalescer.core.model.RequestKey;

/**
 * 최대 대기 시간을 넘긴 요청에 전달되는 실패.
 *
 * <p>Reaper가 만료 항목을 정리할 때 생성합니다. 작업에서 온 예외가 아닙니다.</p>
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
public final class RequestTimeoutException extends CoalescingException {

    private final long ageMs;
    private final long maxPendingTimeMs;

    /**
     * 생성자.
     *
     * @param key 만료된 요청 키
     * @param ageMs 만료 시점의 경과 시간 (밀리초)
     * @param maxPendingTimeMs 허용된 최대 대기 시간 (밀리초)
     */
    public RequestTimeoutException(RequestKey key, long ageMs, long maxPendingTimeMs) {
        super(key, FailureKind.TIMEOUT,
            "Request timeout - exceeded maximum pending time (key: " + (key == null ? "null" : key.getValue())
                + ", age: " + ageMs + "ms, max: " + maxPendingTimeMs + "ms)",
            null);
        this.ageMs = ageMs;
        this.maxPendingTimeMs = maxPendingTimeMs;
    }

    public long ageMs() {
        return ageMs;
    }

    public long maxPendingTimeMs() {
        return maxPendingTimeMs;
    }
}
