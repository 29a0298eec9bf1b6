package com.ryuqq.coalescer.adapter.runner;

/**
 * BatchCoordinator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>batchDelayMs: 윈도우가 열린 뒤 flush까지의 대기 시간 (기본 5000ms)</li>
 *   <li>maxBatchSize: 윈도우 최대 멤버 수, 도달 시 즉시 flush (기본 10)</li>
 *   <li>staggerDelayMs: flush된 멤버 간 실행 시작 간격 (기본 200ms)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>원격 API rate limit이 엄격함: staggerDelayMs 증가</li>
 *   <li>지연 민감: batchDelayMs 감소 또는 HIGH 우선순위 사용</li>
 * </ul>
 *
 * <p>마지막 멤버의 시작 시점({@link #maxStartDelayMs()})은 ReaperConfig의 maxPendingTimeMs보다
 * 작아야 하며, 이 조건은 엔진 생성 시 검증됩니다.</p>
 *
 * @author Coalescer Team
 * @since 1.0.0
 * @param batchDelayMs flush 대기 시간 (밀리초, 양수여야 함)
 * @param maxBatchSize 최대 배치 크기 (1 이상이어야 함)
 * @param staggerDelayMs 멤버 간 시작 간격 (밀리초, 양수여야 함)
 */
public record BatchConfig(
    long batchDelayMs,
    int maxBatchSize,
    long staggerDelayMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: batchDelayMs=5000ms, maxBatchSize=10, staggerDelayMs=200ms</p>
     */
    public BatchConfig() {
        this(5000, 10, 200);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BatchConfig {
        if (batchDelayMs <= 0) {
            throw new IllegalArgumentException(
                "batchDelayMs must be positive (current: " + batchDelayMs + ")"
            );
        }
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException(
                "maxBatchSize must be positive (current: " + maxBatchSize + ")"
            );
        }
        if (staggerDelayMs <= 0) {
            throw new IllegalArgumentException(
                "staggerDelayMs must be positive (current: " + staggerDelayMs + ")"
            );
        }
    }

    /**
     * 윈도우가 열린 시점부터 마지막 멤버가 시작되기까지의 최대 지연.
     *
     * @return batchDelayMs + (maxBatchSize - 1) * staggerDelayMs, 오버플로 시 Long.MAX_VALUE
     */
    public long maxStartDelayMs() {
        try {
            return Math.addExact(batchDelayMs, Math.multiplyExact(maxBatchSize - 1L, staggerDelayMs));
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    /**
     * batchDelayMs만 변경한 새 인스턴스 생성.
     */
    public BatchConfig withBatchDelayMs(long batchDelayMs) {
        return new BatchConfig(batchDelayMs, maxBatchSize, staggerDelayMs);
    }

    /**
     * maxBatchSize만 변경한 새 인스턴스 생성.
     */
    public BatchConfig withMaxBatchSize(int maxBatchSize) {
        return new BatchConfig(batchDelayMs, maxBatchSize, staggerDelayMs);
    }

    /**
     * staggerDelayMs만 변경한 새 인스턴스 생성.
     */
    public BatchConfig withStaggerDelayMs(long staggerDelayMs) {
        return new BatchConfig(batchDelayMs, maxBatchSize, staggerDelayMs);
    }
}
