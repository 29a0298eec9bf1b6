package com.ryuqq.coalescer.adapter.runner;

import com.ryuqq.coalescer.application.telemetry.CoalescerStats;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * 중복 제거 통계 집계기.
 *
 * <p>카운터는 엔진 모니터 안팎 양쪽에서 갱신되므로 atomic 타입을 사용합니다.
 * {@link #reset()} 외에는 감소하지 않습니다.</p>
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
public final class TelemetryAggregator {

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong duplicateRequests = new AtomicLong();
    private final AtomicLong batchedRequests = new AtomicLong();
    private final DoubleAdder costSaved = new DoubleAdder();
    private final AtomicLong resolvedRequests = new AtomicLong();
    private final AtomicLong totalWaitTimeMs = new AtomicLong();

    public void recordRequest() {
        totalRequests.incrementAndGet();
    }

    /**
     * 중복 합류 기록.
     *
     * @param cost 합류한 호출자가 선언한 비용
     */
    public void recordDuplicate(double cost) {
        duplicateRequests.incrementAndGet();
        costSaved.add(cost);
    }

    public void recordBatched() {
        batchedRequests.incrementAndGet();
    }

    /**
     * 진행 중 엔트리의 종료 기록 (성공, 실패, 타임아웃, 취소 모두 포함).
     *
     * @param waitTimeMs 엔트리 생성부터 종료까지 걸린 시간
     */
    public void recordResolution(long waitTimeMs) {
        resolvedRequests.incrementAndGet();
        totalWaitTimeMs.addAndGet(Math.max(0, waitTimeMs));
    }

    /**
     * 현재 통계 스냅샷.
     *
     * @param currentPending 현재 대기 중인 요청 수
     * @param currentBatches 현재 열린 배치 윈도우 수
     * @return 통계 스냅샷
     */
    public CoalescerStats snapshot(int currentPending, int currentBatches) {
        long resolved = resolvedRequests.get();
        double averageWait = resolved == 0 ? 0.0 : (double) totalWaitTimeMs.get() / resolved;
        return new CoalescerStats(
            totalRequests.get(),
            duplicateRequests.get(),
            batchedRequests.get(),
            costSaved.sum(),
            averageWait,
            currentPending,
            currentBatches
        );
    }

    /**
     * 모든 카운터 초기화 (유지보수 용도).
     */
    public void reset() {
        totalRequests.set(0);
        duplicateRequests.set(0);
        batchedRequests.set(0);
        costSaved.reset();
        resolvedRequests.set(0);
        totalWaitTimeMs.set(0);
    }
}
