package com.ryuqq.coalescer.adapter.runner;

import com.ryuqq.coalescer.adapter.inmemory.registry.PendingRequest;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 모니터 안에서 실패로 종료시키고 비워낸 대기자 묶음.
 *
 * <p>모니터 안에서 {@link #fail(PendingRequest, long)}로 만들고,
 * 모니터 밖에서 {@link #deliver(Throwable, TelemetryAggregator)}로 전달합니다.</p>
 *
 * @param request 종료된 요청
 * @param waiters 비워낸 대기자 (합류 순서)
 * @param waitTimeMs 생성부터 종료까지 걸린 시간
 */
record Drained(PendingRequest<?> request, List<? extends CompletableFuture<?>> waiters, long waitTimeMs) {

    /**
     * 요청을 실패로 종료하고 대기자를 비움. 엔진 모니터를 잡은 상태에서 호출해야 합니다.
     *
     * @param request 종료할 요청
     * @param now 현재 시각 (epoch millis)
     * @return 비워낸 대기자 묶음
     */
    static Drained fail(PendingRequest<?> request, long now) {
        return new Drained(request, request.fail(), request.ageMs(now));
    }

    /**
     * 비워낸 대기자 전원에게 예외 전달. 엔진 모니터 밖에서 호출해야 합니다.
     *
     * @param error 전달할 예외
     * @param telemetry 종료 기록 대상
     */
    void deliver(Throwable error, TelemetryAggregator telemetry) {
        if (waiters.isEmpty()) {
            return;
        }
        telemetry.recordResolution(waitTimeMs);
        PendingRequest.failAll(waiters, error);
    }
}
