package com.ryuqq.coalescer.adapter.runner;

import com.ryuqq.coalescer.adapter.inmemory.registry.InFlightRegistry;
import com.ryuqq.coalescer.adapter.inmemory.registry.PendingRequest;
import com.ryuqq.coalescer.core.exception.RequestTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * TimeoutReaper 컴포넌트.
 *
 * <p>maxPendingTimeMs를 넘긴 진행 중 요청을 찾아 실패 처리합니다.</p>
 *
 * <p><strong>스캔 시나리오:</strong></p>
 * <pre>
 * 1. 원격 작업 호출 → 응답이 오지 않음
 * 2. 레지스트리 엔트리가 계속 남아 같은 키의 호출자가 무한정 합류
 * 3. Reaper가 scanIntervalMs마다 스캔
 * 4. 경과 시간이 maxPendingTimeMs를 넘긴 엔트리 발견
 * 5. 레지스트리에서 제거 + 대기자 전원에게 RequestTimeoutException 전달
 * 6. 이후 같은 키의 호출은 새 실행을 시작
 * </pre>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>레지스트리 엔트리만 스캔 (열린 배치 윈도우는 batchDelayMs로 이미 제한됨)</li>
 *   <li>항목별 예외가 발생해도 나머지 항목 처리를 계속 진행</li>
 *   <li>스캔 중 예외를 스케줄러 스레드로 던지지 않음 (던지면 주기 실행이 멈춤)</li>
 * </ul>
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
public final class TimeoutReaper {

    private static final Logger log = LoggerFactory.getLogger(TimeoutReaper.class);

    private final Object monitor;
    private final InFlightRegistry registry;
    private final TelemetryAggregator telemetry;
    private final Clock clock;
    private final ReaperConfig config;
    private ScheduledFuture<?> task;

    /**
     * 생성자.
     *
     * @param monitor 레지스트리를 보호하는 엔진 모니터
     * @param registry 진행 중 요청 레지스트리
     * @param telemetry 통계 집계기
     * @param clock 시계
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    TimeoutReaper(Object monitor, InFlightRegistry registry, TelemetryAggregator telemetry, Clock clock, ReaperConfig config) {
        if (monitor == null) {
            throw new IllegalArgumentException("monitor cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (telemetry == null) {
            throw new IllegalArgumentException("telemetry cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.monitor = monitor;
        this.registry = registry;
        this.telemetry = telemetry;
        this.clock = clock;
        this.config = config;
    }

    /**
     * 주기 스캔 시작.
     *
     * @param scheduler 스캔을 실행할 스케줄러
     * @throws IllegalStateException 이미 시작된 경우
     */
    synchronized void start(ScheduledExecutorService scheduler) {
        if (task != null) {
            throw new IllegalStateException("TimeoutReaper already started");
        }
        task = scheduler.scheduleAtFixedRate(
            this::scan,
            config.scanIntervalMs(),
            config.scanIntervalMs(),
            TimeUnit.MILLISECONDS
        );
        log.info("TimeoutReaper started (scanInterval: {}ms, maxPendingTime: {}ms)",
            config.scanIntervalMs(), config.maxPendingTimeMs());
    }

    /**
     * 주기 스캔 중지. 시작되지 않았으면 무시합니다.
     */
    synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
            log.info("TimeoutReaper stopped");
        }
    }

    /**
     * 만료된 요청 스캔 및 실패 처리.
     *
     * @return 타임아웃 처리된 요청 수
     */
    public int scan() {
        try {
            long now = clock.millis();
            List<Drained> expired = new ArrayList<>();
            synchronized (monitor) {
                for (PendingRequest<?> request : registry.removeExpired(now, config.maxPendingTimeMs())) {
                    expired.add(Drained.fail(request, now));
                }
            }

            int reaped = 0;
            for (Drained drained : expired) {
                if (tryExpire(drained)) {
                    reaped++;
                }
            }

            if (reaped > 0) {
                log.info("TimeoutReaper scan completed: {} requests timed out", reaped);
            } else {
                log.debug("TimeoutReaper scan completed: nothing expired");
            }
            return reaped;

        } catch (RuntimeException e) {
            log.error("TimeoutReaper scan failed", e);
            return 0;
        }
    }

    /**
     * 개별 요청 타임아웃 전달.
     *
     * <p>예외 발생 시에도 계속 진행하여 다른 항목 처리를 방해하지 않습니다.</p>
     */
    private boolean tryExpire(Drained drained) {
        PendingRequest<?> request = drained.request();
        try {
            RequestTimeoutException timeout = new RequestTimeoutException(
                request.getKey(),
                drained.waitTimeMs(),
                config.maxPendingTimeMs()
            );
            drained.deliver(timeout, telemetry);
            log.warn("Request {} timed out after {}ms ({} waiters notified)",
                request.getKey(), drained.waitTimeMs(), drained.waiters().size());
            return true;

        } catch (RuntimeException e) {
            log.error("Failed to expire request {}", request.getKey(), e);
            return false;
        }
    }
}
