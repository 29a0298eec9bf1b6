package com.ryuqq.coalescer.adapter.runner;

import com.ryuqq.coalescer.adapter.inmemory.batch.BatchWindow;
import com.ryuqq.coalescer.adapter.inmemory.batch.BatchWindowTable;
import com.ryuqq.coalescer.adapter.inmemory.registry.InFlightRegistry;
import com.ryuqq.coalescer.adapter.inmemory.registry.PendingRequest;
import com.ryuqq.coalescer.core.exception.BatchOrchestrationException;
import com.ryuqq.coalescer.core.model.BatchType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 배치 가능 요청을 타입별 시간 윈도우로 모아 순차 실행하는 컴포넌트.
 *
 * <p><strong>윈도우 규칙:</strong></p>
 * <ul>
 *   <li>타입에 열린 윈도우가 없으면 새로 열고 batchDelayMs 뒤 flush 예약</li>
 *   <li>maxBatchSize 도달 또는 HIGH 우선순위 합류 시 예약을 취소하고 즉시 flush</li>
 *   <li>HIGH 우선순위 요청이 윈도우를 열면 멤버 하나짜리 윈도우로 즉시 flush</li>
 * </ul>
 *
 * <p><strong>Flush:</strong></p>
 * <pre>
 * 1. (모니터) 윈도우를 테이블에서 떼어내고 멤버를 레지스트리로 이관
 *    - 이관 후 같은 키의 호출자는 레지스트리에서 합류 (실행 중 중복 제거)
 * 2. 멤버를 HIGH → NORMAL → LOW 순 (같은 우선순위는 합류 순)으로 정렬
 * 3. i번째 멤버를 i × staggerDelayMs 뒤에 실행하도록 예약
 * 4. 예약 자체가 실패하면 아직 종료되지 않은 멤버 전원을 BatchOrchestrationException으로 실패
 * </pre>
 *
 * <p>각 멤버의 결과는 서로 독립적으로 전달됩니다.</p>
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
public final class BatchCoordinator {

    private static final Logger log = LoggerFactory.getLogger(BatchCoordinator.class);

    private final Object monitor;
    private final BatchWindowTable windows;
    private final InFlightRegistry registry;
    private final OperationLauncher launcher;
    private final TelemetryAggregator telemetry;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final BatchConfig config;

    BatchCoordinator(
        Object monitor,
        BatchWindowTable windows,
        InFlightRegistry registry,
        OperationLauncher launcher,
        TelemetryAggregator telemetry,
        ScheduledExecutorService scheduler,
        Clock clock,
        BatchConfig config
    ) {
        this.monitor = monitor;
        this.windows = windows;
        this.registry = registry;
        this.launcher = launcher;
        this.telemetry = telemetry;
        this.scheduler = scheduler;
        this.clock = clock;
        this.config = config;
    }

    /**
     * 새 배치 가능 요청을 타입의 윈도우에 추가.
     *
     * <p>엔진 모니터를 잡은 상태에서 호출해야 합니다. 호출자는 이 키가 레지스트리에도,
     * 열린 윈도우에도 없음을 이미 확인했어야 합니다.</p>
     *
     * <p>즉시 flush 조건을 만족하면 윈도우를 떼어내 멤버를 레지스트리로 이관한 뒤 반환합니다.
     * 반환된 윈도우는 모니터를 놓은 뒤 {@link #dispatch(BatchWindow)}로 실행해야 합니다.</p>
     *
     * @param request 새 요청 (PENDING 상태)
     * @param type 배치 타입
     * @return 즉시 실행할 윈도우, 아직 수집 중이면 null
     */
    BatchWindow submitBatchable(PendingRequest<?> request, BatchType type) {
        BatchWindow window = windows.find(type);
        boolean opened = false;
        if (window == null) {
            window = new BatchWindow(type, clock.millis() + config.batchDelayMs());
            windows.open(window);
            opened = true;
            log.debug("Opened batch window {} for type {}", window.getId(), type.getValue());
        }

        windows.addMember(window, request);
        request.markBatched();
        telemetry.recordBatched();

        if (request.getPriority().flushesImmediately() || window.size() >= config.maxBatchSize()) {
            handOver(window);
            return window;
        }

        if (opened) {
            try {
                BatchWindow due = window;
                window.attachTimer(scheduler.schedule(() -> flushDue(due), config.batchDelayMs(), TimeUnit.MILLISECONDS));
            } catch (RejectedExecutionException e) {
                log.error("Failed to schedule flush of batch window {}, flushing now", window.getId(), e);
                handOver(window);
                return window;
            }
        }
        return null;
    }

    /**
     * 떼어낸 윈도우의 멤버를 stagger 간격으로 실행 예약.
     *
     * <p>엔진 모니터를 잡지 않은 상태에서 호출해야 합니다.</p>
     *
     * @param window {@link #submitBatchable}이 반환했거나 타이머로 떼어낸 윈도우
     */
    void dispatch(BatchWindow window) {
        List<PendingRequest<?>> ordered = window.orderedMembers();
        log.info("Flushing batch window {} (type: {}, members: {})",
            window.getId(), window.getType().getValue(), ordered.size());

        try {
            for (int i = 0; i < ordered.size(); i++) {
                PendingRequest<?> member = ordered.get(i);
                scheduler.schedule(() -> launcher.launch(member), i * config.staggerDelayMs(), TimeUnit.MILLISECONDS);
            }
        } catch (RuntimeException e) {
            log.error("Batch orchestration failed for window {}", window.getId(), e);
            failUnresolved(window, ordered, e);
        }
    }

    /**
     * 타이머에 의한 flush.
     *
     * <p>이미 즉시 flush되었거나 취소로 비워진 윈도우면 아무것도 하지 않습니다.
     * 스케줄러 스레드에서 실행되므로 예외를 던지지 않고 로그만 남깁니다.</p>
     */
    private void flushDue(BatchWindow window) {
        try {
            synchronized (monitor) {
                if (!windows.detach(window)) {
                    return;
                }
                registerMembers(window);
            }
            dispatch(window);
        } catch (RuntimeException e) {
            log.error("Timed flush of batch window {} failed", window.getId(), e);
        }
    }

    private void handOver(BatchWindow window) {
        window.cancelTimer();
        windows.detach(window);
        registerMembers(window);
    }

    private void registerMembers(BatchWindow window) {
        for (PendingRequest<?> member : window.getMembers()) {
            registry.register(member);
        }
    }

    private void failUnresolved(BatchWindow window, List<PendingRequest<?>> members, Throwable cause) {
        List<Drained> failed = new ArrayList<>();
        synchronized (monitor) {
            long now = clock.millis();
            for (PendingRequest<?> member : members) {
                if (member.getState().isTerminal()) {
                    continue;
                }
                registry.remove(member);
                failed.add(Drained.fail(member, now));
            }
        }
        for (Drained drained : failed) {
            BatchType type = window.getType();
            drained.deliver(new BatchOrchestrationException(drained.request().getKey(), type, cause), telemetry);
        }
    }
}
