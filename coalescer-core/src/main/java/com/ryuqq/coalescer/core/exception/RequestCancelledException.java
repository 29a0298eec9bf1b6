package com.ryuqq.coalescer.core.exception;

import com.ryuqq.coalescer.core.model.RequestKey;

/**
 * 취소된 요청에 전달되는 실패.
 *
 * <p>취소는 키 단위입니다. 같은 키에 붙은 대기자 전원이 함께 이 예외를 받습니다.</p>
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
public final class RequestCancelledException extends CoalescingException {

    /**
     * 취소 사유.
     */
    public enum Reason {

        /**
         * cancelRequest(key)로 해당 키만 취소됨.
         */
        CANCELLED,

        /**
         * clearPending() 또는 shutdown()으로 전체 정리됨.
         */
        CLEARED
    }

    private final Reason reason;

    /**
     * 생성자.
     *
     * @param key 취소된 요청 키
     * @param reason 취소 사유
     */
    public RequestCancelledException(RequestKey key, Reason reason) {
        super(key, FailureKind.CANCELLED, messageFor(key, reason), null);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    private static String messageFor(RequestKey key, Reason reason) {
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        String value = key == null ? "null" : key.getValue();
        return switch (reason) {
            case CANCELLED -> "Request cancelled (key: " + value + ")";
            case CLEARED -> "All requests cleared (key: " + value + ")";
        };
    }
}
