package com.ryuqq.coalescer.application.telemetry;

/**
 * 엔진 통계 스냅샷 (불변 record).
 *
 * <p><strong>항목:</strong></p>
 * <ul>
 *   <li>totalRequests: execute 호출 총 수</li>
 *   <li>duplicateRequests: 기존 요청에 합류한 수 (작업 재실행 없음)</li>
 *   <li>batchedRequests: 배치 윈도우에 추가된 멤버 수</li>
 *   <li>costSaved: 합류한 호출자들이 선언한 비용 합계</li>
 *   <li>averageWaitTimeMs: 요청 생성부터 종료까지 평균 시간</li>
 *   <li>currentPending / currentBatches: 현재 진행 중 요청 수 / 열린 윈도우 수</li>
 * </ul>
 *
 * @author Coalescer Team
 * @since 1.0.0
 * @param totalRequests 총 요청 수
 * @param duplicateRequests 중복 제거된 요청 수
 * @param batchedRequests 배치된 요청 수
 * @param costSaved 절감 비용
 * @param averageWaitTimeMs 평균 대기 시간 (밀리초)
 * @param currentPending 현재 진행 중 요청 수
 * @param currentBatches 현재 열린 배치 윈도우 수
 */
public record CoalescerStats(
    long totalRequests,
    long duplicateRequests,
    long batchedRequests,
    double costSaved,
    double averageWaitTimeMs,
    int currentPending,
    int currentBatches
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 음수 값이 있는 경우
     */
    public CoalescerStats {
        if (totalRequests < 0 || duplicateRequests < 0 || batchedRequests < 0) {
            throw new IllegalArgumentException("counters cannot be negative");
        }
        if (costSaved < 0 || averageWaitTimeMs < 0) {
            throw new IllegalArgumentException("costSaved and averageWaitTimeMs cannot be negative");
        }
        if (currentPending < 0 || currentBatches < 0) {
            throw new IllegalArgumentException("currentPending and currentBatches cannot be negative");
        }
    }

    /**
     * 효율 = (중복 제거 + 배치) / 전체.
     *
     * @return 효율 (totalRequests가 0이면 0)
     */
    public double efficiency() {
        if (totalRequests == 0) {
            return 0.0;
        }
        return (double) (duplicateRequests + batchedRequests) / totalRequests;
    }
}
