package com.ryuqq.coalescer.core.exception;

import com.ryuqq.coalescer.core.model.RequestKey;

/**
 * 엔진이 직접 만들어 대기자에게 전달하는 실패.
 *
 * <p>작업 자체의 실패는 이 타입으로 감싸지 않고 원래 예외 그대로 전달됩니다.
 * 이 sealed 계층은 작업 외부에서 발생한 종료 사유만 표현합니다.</p>
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
public abstract sealed class CoalescingException extends RuntimeException
    permits RequestTimeoutException, RequestCancelledException, BatchOrchestrationException {

    private final RequestKey key;
    private final FailureKind kind;

    protected CoalescingException(RequestKey key, FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.key = key;
        this.kind = kind;
    }

    /**
     * 실패한 요청의 키.
     *
     * @return RequestKey
     */
    public RequestKey key() {
        return key;
    }

    /**
     * 실패 분류.
     *
     * @return FailureKind
     */
    public FailureKind kind() {
        return kind;
    }
}
