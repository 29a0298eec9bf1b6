package com.ryuqq.coalescer.adapter.runner;

/**
 * TimeoutReaper 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 스캔 주기 (기본 60000ms = 1분)</li>
 *   <li>maxPendingTimeMs: 진행 중 요청의 최대 허용 경과 시간 (기본 30000ms = 30초)</li>
 * </ul>
 *
 * <p>요청은 maxPendingTimeMs를 넘긴 직후가 아니라 그 다음 스캔에서 실패 처리되므로,
 * 실제 최대 대기 시간은 maxPendingTimeMs + scanIntervalMs입니다.</p>
 *
 * @author Coalescer Team
 * @since 1.0.0
 * @param scanIntervalMs 스캔 주기 (밀리초, 양수여야 함)
 * @param maxPendingTimeMs 최대 허용 경과 시간 (밀리초, 양수여야 함)
 */
public record ReaperConfig(
    long scanIntervalMs,
    long maxPendingTimeMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: scanIntervalMs=60000ms (1분), maxPendingTimeMs=30000ms (30초)</p>
     */
    public ReaperConfig() {
        this(60000, 30000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ReaperConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "scanIntervalMs must be positive (current: " + scanIntervalMs + ")"
            );
        }
        if (maxPendingTimeMs <= 0) {
            throw new IllegalArgumentException(
                "maxPendingTimeMs must be positive (current: " + maxPendingTimeMs + ")"
            );
        }
    }

    /**
     * scanIntervalMs만 변경한 새 인스턴스 생성.
     */
    public ReaperConfig withScanIntervalMs(long scanIntervalMs) {
        return new ReaperConfig(scanIntervalMs, maxPendingTimeMs);
    }

    /**
     * maxPendingTimeMs만 변경한 새 인스턴스 생성.
     */
    public ReaperConfig withMaxPendingTimeMs(long maxPendingTimeMs) {
        return new ReaperConfig(scanIntervalMs, maxPendingTimeMs);
    }
}
