package com.ryuqq.coalescer.adapter.runner;

import com.ryuqq.coalescer.adapter.inmemory.batch.BatchWindow;
import com.ryuqq.coalescer.adapter.inmemory.batch.BatchWindowTable;
import com.ryuqq.coalescer.adapter.inmemory.registry.InFlightRegistry;
import com.ryuqq.coalescer.adapter.inmemory.registry.PendingRequest;
import com.ryuqq.coalescer.application.coalescer.RequestCoalescer;
import com.ryuqq.coalescer.application.telemetry.CoalescerStats;
import com.ryuqq.coalescer.application.telemetry.PendingRequestView;
import com.ryuqq.coalescer.core.exception.RequestCancelledException;
import com.ryuqq.coalescer.core.key.DigestKeyDeriver;
import com.ryuqq.coalescer.core.key.KeyDeriver;
import com.ryuqq.coalescer.core.model.RequestKey;
import com.ryuqq.coalescer.core.model.RequestOptions;
import com.ryuqq.coalescer.core.operation.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * 요청 병합 엔진 구현체.
 *
 * <p>{@link InFlightRegistry}, {@link BatchCoordinator}, {@link TimeoutReaper},
 * {@link TelemetryAggregator}를 하나의 엔진 모니터 아래에서 조합합니다.</p>
 *
 * <p><strong>execute 흐름:</strong></p>
 * <ol>
 *   <li>totalRequests 증가</li>
 *   <li>레지스트리에 같은 키가 있으면 대기자로 합류 (duplicate, costSaved 증가)</li>
 *   <li>열린 배치 윈도우에 같은 키의 멤버가 있으면 그 멤버에 합류 (duplicate)</li>
 *   <li>batchable이면 BatchCoordinator로 위임</li>
 *   <li>아니면 레지스트리에 등록하고 호출자 스레드에서 즉시 작업 시작</li>
 * </ol>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>레지스트리와 윈도우 테이블의 모든 변경은 엔진 모니터 안에서 직렬화</li>
 *   <li>대기자 future는 모니터 밖에서 완료 (호출자 콜백이 임계 구역 안에서 실행되지 않음)</li>
 *   <li>배치 타이머, stagger 실행, Reaper는 하나의 스케줄러 스레드에서 실행</li>
 * </ul>
 *
 * <p>스케줄러를 주입하지 않으면 엔진이 daemon 스레드 {@value #SCHEDULER_THREAD_NAME}를
 * 소유하고 {@link #shutdown()} 시 종료합니다. 주입된 스케줄러는 종료하지 않습니다.</p>
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
public final class CoalescingEngine implements RequestCoalescer {

    private static final Logger log = LoggerFactory.getLogger(CoalescingEngine.class);

    static final String SCHEDULER_THREAD_NAME = "request-coalescer-scheduler";

    private final Object monitor = new Object();
    private final InFlightRegistry registry = new InFlightRegistry();
    private final BatchWindowTable windows = new BatchWindowTable();
    private final TelemetryAggregator telemetry = new TelemetryAggregator();
    private final KeyDeriver keyDeriver;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final OperationLauncher launcher;
    private final BatchCoordinator batchCoordinator;
    private final TimeoutReaper reaper;
    private boolean shutdown;

    /**
     * 기본 설정 생성자.
     */
    public CoalescingEngine() {
        this(new BatchConfig(), new ReaperConfig());
    }

    /**
     * 생성자 (설정 커스터마이징, SHA-256 키 생성기, 시스템 시계, 자체 스케줄러).
     *
     * @param batchConfig 배치 설정
     * @param reaperConfig Reaper 설정
     */
    public CoalescingEngine(BatchConfig batchConfig, ReaperConfig reaperConfig) {
        this(batchConfig, reaperConfig, new DigestKeyDeriver(), Clock.systemUTC(), null);
    }

    /**
     * 생성자 (모든 의존성 주입).
     *
     * @param batchConfig 배치 설정
     * @param reaperConfig Reaper 설정
     * @param keyDeriver 키 생성기
     * @param clock 요청 경과 시간 계산용 시계
     * @param scheduler 타이머 실행용 스케줄러, null이면 엔진이 생성하고 소유
     * @throws IllegalArgumentException 의존성이 null이거나 배치 멤버의 최대 시작 지연이 maxPendingTimeMs 이상인 경우
     */
    public CoalescingEngine(
        BatchConfig batchConfig,
        ReaperConfig reaperConfig,
        KeyDeriver keyDeriver,
        Clock clock,
        ScheduledExecutorService scheduler
    ) {
        if (batchConfig == null) {
            throw new IllegalArgumentException("batchConfig cannot be null");
        }
        if (reaperConfig == null) {
            throw new IllegalArgumentException("reaperConfig cannot be null");
        }
        if (keyDeriver == null) {
            throw new IllegalArgumentException("keyDeriver cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (batchConfig.batchDelayMs() >= reaperConfig.maxPendingTimeMs()) {
            throw new IllegalArgumentException(
                "batchDelayMs must be less than maxPendingTimeMs (current: "
                    + batchConfig.batchDelayMs() + " >= " + reaperConfig.maxPendingTimeMs() + ")"
            );
        }
        if (batchConfig.maxStartDelayMs() >= reaperConfig.maxPendingTimeMs()) {
            throw new IllegalArgumentException(
                "batchDelayMs + (maxBatchSize - 1) * staggerDelayMs must be less than maxPendingTimeMs (current: "
                    + batchConfig.maxStartDelayMs() + " >= " + reaperConfig.maxPendingTimeMs() + ")"
            );
        }
        this.keyDeriver = keyDeriver;
        this.clock = clock;
        this.ownsScheduler = scheduler == null;
        this.scheduler = ownsScheduler ? newScheduler() : scheduler;
        this.launcher = new OperationLauncher(monitor, registry, telemetry, clock);
        this.batchCoordinator = new BatchCoordinator(
            monitor, windows, registry, launcher, telemetry, this.scheduler, clock, batchConfig
        );
        this.reaper = new TimeoutReaper(monitor, registry, telemetry, clock, reaperConfig);
        this.reaper.start(this.scheduler);
        log.info("CoalescingEngine started ({}, {})", batchConfig, reaperConfig);
    }

    private static ScheduledExecutorService newScheduler() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, SCHEDULER_THREAD_NAME);
            thread.setDaemon(true);
            return thread;
        });
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    @Override
    public <T> CompletableFuture<T> execute(Operation<T> operation, RequestKey key, RequestOptions options) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }

        PendingRequest<T> created;
        CompletableFuture<T> waiter;
        BatchWindow flushNow = null;
        synchronized (monitor) {
            if (shutdown) {
                throw new IllegalStateException("RequestCoalescer has been shut down");
            }
            telemetry.recordRequest();

            PendingRequest<?> existing = registry.find(key);
            if (existing == null) {
                BatchWindowTable.Entry batched = windows.findMember(key);
                existing = batched == null ? null : batched.member();
            }
            if (existing != null) {
                telemetry.recordDuplicate(options.cost());
                log.debug("Request {} joined existing {} (state: {})", key, existing.getId(), existing.getState());
                return joinExisting(existing);
            }

            created = new PendingRequest<>(key, operation, options, clock.millis());
            waiter = created.attachWaiter();
            if (options.batchable()) {
                flushNow = batchCoordinator.submitBatchable(created, options.batchType());
            } else {
                registry.register(created);
            }
        }

        if (options.batchable()) {
            if (flushNow != null) {
                batchCoordinator.dispatch(flushNow);
            }
        } else {
            log.debug("Request {} started immediately", key);
            launcher.launch(created);
        }
        return waiter;
    }

    /**
     * 진행 중 요청에 합류.
     *
     * <p>같은 키를 공유하는 호출자는 같은 결과 타입을 기대해야 합니다.</p>
     */
    private static <T> CompletableFuture<T> joinExisting(PendingRequest<?> existing) {
        // 레지스트리는 키만으로 조회하므로 결과 타입은 호출자 계약으로 보장
        PendingRequest<T> typed = (PendingRequest<T>) existing;
        return typed.attachWaiter();
    }

    @Override
    public RequestKey generateKey(String content, Map<String, ?> parameters) {
        return keyDeriver.deriveKey(content, parameters);
    }

    @Override
    public boolean cancelRequest(RequestKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        Drained cancelled;
        synchronized (monitor) {
            PendingRequest<?> request = registry.remove(key);
            if (request == null) {
                BatchWindowTable.Entry batched = windows.removeMember(key);
                request = batched == null ? null : batched.member();
            }
            if (request == null) {
                return false;
            }
            cancelled = Drained.fail(request, clock.millis());
        }
        log.warn("Request {} cancelled ({} waiters notified)", key, cancelled.waiters().size());
        cancelled.deliver(new RequestCancelledException(key, RequestCancelledException.Reason.CANCELLED), telemetry);
        return true;
    }

    @Override
    public void clearPending() {
        List<Drained> cleared = new ArrayList<>();
        synchronized (monitor) {
            long now = clock.millis();
            for (PendingRequest<?> request : registry.removeAll()) {
                cleared.add(Drained.fail(request, now));
            }
            for (BatchWindow window : windows.detachAll()) {
                for (PendingRequest<?> member : window.getMembers()) {
                    cleared.add(Drained.fail(member, now));
                }
            }
        }
        if (!cleared.isEmpty()) {
            log.warn("Cleared {} pending requests", cleared.size());
        }
        for (Drained drained : cleared) {
            RequestKey key = drained.request().getKey();
            drained.deliver(new RequestCancelledException(key, RequestCancelledException.Reason.CLEARED), telemetry);
        }
    }

    @Override
    public CoalescerStats getStats() {
        synchronized (monitor) {
            return telemetry.snapshot(registry.size() + windows.memberCount(), windows.windowCount());
        }
    }

    @Override
    public List<PendingRequestView> getPendingRequests() {
        List<PendingRequest<?>> pending;
        synchronized (monitor) {
            pending = registry.snapshot();
            pending.addAll(windows.memberSnapshot());
        }
        long now = clock.millis();
        List<PendingRequestView> views = new ArrayList<>(pending.size());
        for (PendingRequest<?> request : pending) {
            views.add(new PendingRequestView(request.getKey(), request.ageMs(now), request.getPriority(), request.getCost()));
        }
        return views;
    }

    @Override
    public void resetStats() {
        telemetry.reset();
        log.info("Coalescer statistics reset");
    }

    @Override
    public void shutdown() {
        synchronized (monitor) {
            if (shutdown) {
                return;
            }
            shutdown = true;
        }
        reaper.stop();
        clearPending();
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
        log.info("CoalescingEngine shut down");
    }

    /**
     * 즉시 만료 스캔 실행 (주기 스캔과 별개).
     *
     * @return 타임아웃 처리된 요청 수
     */
    public int reapExpired() {
        return reaper.scan();
    }
}
