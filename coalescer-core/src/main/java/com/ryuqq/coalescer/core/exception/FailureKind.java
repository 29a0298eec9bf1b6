package com.ryuqq.coalescer.core.exception;

/**
 * 요청이 실패로 종료된 원인 분류.
 *
 * <ul>
 *   <li>{@link #OPERATION_FAILURE}: 감싼 작업 자체가 실패 (원래 예외가 그대로 전달됨)</li>
 *   <li>{@link #TIMEOUT}: 최대 대기 시간 초과 ({@link RequestTimeoutException})</li>
 *   <li>{@link #CANCELLED}: 명시적 취소 또는 전체 정리 ({@link RequestCancelledException})</li>
 *   <li>{@link #BATCH_ORCHESTRATION_FAILURE}: 배치 실행 단계 자체의 실패 ({@link BatchOrchestrationException})</li>
 * </ul>
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
public enum FailureKind {

    OPERATION_FAILURE,

    TIMEOUT,

    CANCELLED,

    BATCH_ORCHESTRATION_FAILURE;

    /**
     * 예외로부터 실패 분류 판별.
     *
     * <p>엔진이 만든 {@link CoalescingException}이 아니면 모두 작업 실패로 봅니다.</p>
     *
     * @param error 대기자에게 전달된 예외
     * @return 실패 분류
     * @throws IllegalArgumentException error가 null인 경우
     */
    public static FailureKind of(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        if (error instanceof CoalescingException coalescing) {
            return coalescing.kind();
        }
        return OPERATION_FAILURE;
    }
}
