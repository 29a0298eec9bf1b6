package com.ryuqq.coalescer.application.coalescer;

import com.ryuqq.coalescer.application.telemetry.CoalescerStats;
import com.ryuqq.coalescer.application.telemetry.PendingRequestView;
import com.ryuqq.coalescer.core.model.RequestKey;
import com.ryuqq.coalescer.core.model.RequestOptions;
import com.ryuqq.coalescer.core.operation.Operation;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 요청 병합 및 적응형 배치 엔진.
 *
 * <p>비싸고 호출량이 제한된 원격 작업 앞에 위치하여, 의미상 동일한 동시 요청이
 * 원격 작업을 최대 한 번만 실행하도록 보장하고, 배치 가능한 요청은 시간 윈도우로 묶어
 * 순서대로 나누어(stagger) 실행합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RequestKey key = coalescer.generateKey(prompt, Map.of("model", "gpt-4o", "temperature", 0.2));
 *
 * CompletableFuture&lt;Completion&gt; result = coalescer.execute(
 *     () -&gt; client.completeAsync(prompt),
 *     key,
 *     RequestOptions.defaults().withCost(0.01)
 * );
 * </pre>
 *
 * <p><strong>결과 보장:</strong> 반환된 future는 결과 값, 또는 작업 실패 /
 * 타임아웃 / 취소 / 배치 실행 실패 중 하나로 정확히 한 번 완료되며,
 * 최대 대기 시간을 넘겨 멈춰 있지 않습니다.</p>
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
public interface RequestCoalescer {

    /**
     * 작업을 중복 제거하여 실행.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>같은 키의 진행 중 요청이 있으면 대기자로 합류 (작업 재실행 없음)</li>
     *   <li>없고 batchable이면 배치 코디네이터로 위임</li>
     *   <li>둘 다 아니면 새 요청을 등록하고 작업을 즉시 한 번 실행</li>
     * </ol>
     *
     * @param operation 실행할 작업
     * @param key 중복 제거 키
     * @param options 제출 옵션
     * @param <T> 결과 타입
     * @return 결과 future (이 호출자 전용)
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws IllegalStateException 엔진이 이미 종료된 경우
     */
    <T> CompletableFuture<T> execute(Operation<T> operation, RequestKey key, RequestOptions options);

    /**
     * 기본 옵션으로 작업 실행.
     *
     * @param operation 실행할 작업
     * @param key 중복 제거 키
     * @param <T> 결과 타입
     * @return 결과 future
     */
    default <T> CompletableFuture<T> execute(Operation<T> operation, RequestKey key) {
        return execute(operation, key, RequestOptions.defaults());
    }

    /**
     * 요청 내용과 파라미터로부터 중복 제거 키 생성 (상태 없음).
     *
     * @param content 요청 본문
     * @param parameters 요청 파라미터 (순서 무관)
     * @return 중복 제거 키
     */
    RequestKey generateKey(String content, Map<String, ?> parameters);

    /**
     * 특정 키의 진행 중 요청 취소.
     *
     * <p>해당 키의 대기자 전원이 {@code RequestCancelledException(CANCELLED)}로 실패합니다.
     * 다른 키와 다른 배치 윈도우에는 영향이 없습니다.</p>
     *
     * @param key 취소할 키
     * @return 진행 중 요청이 있어 취소된 경우 true
     */
    boolean cancelRequest(RequestKey key);

    /**
     * 모든 진행 중 요청과 배치 윈도우 정리.
     *
     * <p>대기자를 조용히 버리지 않고 전원 {@code RequestCancelledException(CLEARED)}로 실패시킨 뒤
     * 상태를 비웁니다.</p>
     */
    void clearPending();

    /**
     * 누적 통계 조회.
     *
     * @return 통계 스냅샷
     */
    CoalescerStats getStats();

    /**
     * 진행 중 요청 목록 조회.
     *
     * @return 키, 경과 시간, 우선순위, 비용 목록
     */
    List<PendingRequestView> getPendingRequests();

    /**
     * 누적 카운터 초기화 (운영/테스트용 유지보수 작업).
     */
    void resetStats();

    /**
     * 엔진 종료.
     *
     * <p>Reaper를 멈추고 남은 대기자를 모두 실패시킵니다. 종료 후 execute는 거부됩니다.</p>
     */
    void shutdown();
}
