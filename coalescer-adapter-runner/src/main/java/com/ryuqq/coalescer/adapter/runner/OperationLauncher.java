package com.ryuqq.coalescer.adapter.runner;

import com.ryuqq.coalescer.adapter.inmemory.registry.InFlightRegistry;
import com.ryuqq.coalescer.adapter.inmemory.registry.PendingRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * 등록된 요청의 작업을 한 번 실행하고 결과를 모든 대기자에게 전달합니다.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. (모니터) 이미 종료된 요청이면 중단, 아니면 IN_FLIGHT 전이
 * 2. operation.invoke() - 모니터 밖
 * 3. 완료 시 (모니터) 레지스트리에서 동일 인스턴스 제거 + 종료 전이 + 대기자 비우기
 * 4. 모니터 밖에서 대기자를 합류 순서대로 완료
 * </pre>
 *
 * <p>타임아웃이나 취소로 먼저 종료된 요청의 늦은 완료는 무시됩니다.
 * 레지스트리 제거가 인스턴스 비교이므로 같은 키로 새로 등록된 요청에도 영향이 없습니다.</p>
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
final class OperationLauncher {

    private static final Logger log = LoggerFactory.getLogger(OperationLauncher.class);

    private final Object monitor;
    private final InFlightRegistry registry;
    private final TelemetryAggregator telemetry;
    private final Clock clock;

    OperationLauncher(Object monitor, InFlightRegistry registry, TelemetryAggregator telemetry, Clock clock) {
        this.monitor = monitor;
        this.registry = registry;
        this.telemetry = telemetry;
        this.clock = clock;
    }

    /**
     * 요청 실행.
     *
     * <p>작업이 동기적으로 예외를 던지거나 null stage를 반환해도 실패로 전달됩니다.</p>
     *
     * @param request 레지스트리에 등록된 요청
     * @param <T> 결과 타입
     */
    <T> void launch(PendingRequest<T> request) {
        synchronized (monitor) {
            if (!request.markInFlight()) {
                log.debug("Skipping launch of already resolved request {}", request.getKey());
                return;
            }
        }

        CompletionStage<T> stage;
        try {
            stage = request.getOperation().invoke();
            if (stage == null) {
                throw new NullPointerException("Operation returned null stage for " + request.getKey());
            }
        } catch (Exception e) {
            resolveFailure(request, e);
            return;
        }

        stage.whenComplete((value, error) -> {
            if (error != null) {
                resolveFailure(request, unwrap(error));
            } else {
                resolveSuccess(request, value);
            }
        });
    }

    private <T> void resolveSuccess(PendingRequest<T> request, T value) {
        List<CompletableFuture<T>> drained;
        synchronized (monitor) {
            if (request.getState().isTerminal()) {
                log.debug("Ignoring late completion of {} (state: {})", request.getKey(), request.getState());
                return;
            }
            registry.remove(request);
            drained = request.complete();
        }
        telemetry.recordResolution(request.ageMs(clock.millis()));
        log.debug("Request {} completed, notifying {} waiters", request.getKey(), drained.size());
        PendingRequest.succeed(drained, value);
    }

    private void resolveFailure(PendingRequest<?> request, Throwable error) {
        Drained drained;
        synchronized (monitor) {
            if (request.getState().isTerminal()) {
                log.debug("Ignoring late failure of {} (state: {})", request.getKey(), request.getState());
                return;
            }
            registry.remove(request);
            drained = Drained.fail(request, clock.millis());
        }
        log.debug("Request {} failed, notifying {} waiters: {}", request.getKey(), drained.waiters().size(), error.toString());
        drained.deliver(error, telemetry);
    }

    private static Throwable unwrap(Throwable error) {
        if ((error instanceof CompletionException || error instanceof ExecutionException) && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
