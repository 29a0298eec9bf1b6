package com.ryuqq.coalescer.core.statemachine;

/**
 * 대기 요청(PendingRequest)의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING
 *    │
 *    ├─► IN_FLIGHT (즉시 실행)
 *    │       ├─► COMPLETED (성공)
 *    │       └─► FAILED (작업 실패, 타임아웃, 취소)
 *    │
 *    ├─► BATCHED (배치 윈도우에 합류)
 *    │       ├─► IN_FLIGHT (flush 후 stagger 지연이 끝나 실행 시작)
 *    │       └─► FAILED (취소, 전체 정리, 배치 실행 단계 실패)
 *    │
 *    └─► FAILED (등록 직후 취소)
 *
 * 금지된 전이:
 * - COMPLETED → * ❌
 * - FAILED → * ❌
 * - IN_FLIGHT → BATCHED ❌
 * </pre>
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
public enum RequestState {

    /**
     * 제출됨 (아직 실행 경로가 정해지지 않음).
     */
    PENDING,

    /**
     * 배치 윈도우에서 flush 대기 중.
     */
    BATCHED,

    /**
     * 작업 실행 중.
     */
    IN_FLIGHT,

    /**
     * 성공으로 종료.
     */
    COMPLETED,

    /**
     * 실패로 종료.
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * <p>종료 상태에서는 대기자가 모두 해소되었으며 더 이상 전이할 수 없습니다.</p>
     *
     * @return COMPLETED 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
