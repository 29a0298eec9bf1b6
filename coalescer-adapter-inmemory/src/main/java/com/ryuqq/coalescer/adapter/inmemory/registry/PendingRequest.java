package com.ryuqq.coalescer.adapter.inmemory.registry;

import com.ryuqq.coalescer.core.model.Priority;
import com.ryuqq.coalescer.core.model.RequestId;
import com.ryuqq.coalescer.core.model.RequestKey;
import com.ryuqq.coalescer.core.model.RequestOptions;
import com.ryuqq.coalescer.core.operation.Operation;
import com.ryuqq.coalescer.core.statemachine.RequestState;
import com.ryuqq.coalescer.core.statemachine.StateTransition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 하나의 키에 대한 진행 중 요청.
 *
 * <p>최초 제출 시 생성되며, 실제 작업({@link Operation})을 함께 보관합니다.
 * 이후 같은 키로 들어온 호출자는 대기자(waiter)로 합류하고,
 * 종료 시 대기자 전원이 합류한 순서대로 한 번씩 해소됩니다.</p>
 *
 * <p><strong>대기자 표현:</strong> 호출자 한 명당 {@link CompletableFuture} 하나.
 * future의 complete / completeExceptionally가 성공/실패 continuation 쌍에 해당합니다.</p>
 *
 * <p><strong>불변식:</strong> 종료 상태(COMPLETED, FAILED)의 요청에는 대기자가 남아있지 않습니다.
 * {@link #complete()}와 {@link #fail()}은 상태 전이와 대기자 비우기를 한 번에 수행합니다.</p>
 *
 * <p><strong>Thread Safety:</strong> 이 클래스는 thread-safe하지 않습니다.
 * 모든 변경은 엔진의 단일 모니터 안에서만 일어나야 하며,
 * 비워낸 대기자의 완료({@link #succeed}, {@link #failAll})는 모니터 밖에서 수행합니다.</p>
 *
 * @param <T> 결과 타입
 * @author Coalescer Team
 * @since 1.0.0
 */
public final class PendingRequest<T> {

    private final RequestId id;
    private final RequestKey key;
    private final long createdAt;
    private final Priority priority;
    private final double cost;
    private final Map<String, Object> metadata;
    private final Operation<T> operation;
    private final List<CompletableFuture<T>> waiters;
    private RequestState state;

    /**
     * 생성자.
     *
     * @param key 중복 제거 키
     * @param operation 실행할 작업
     * @param options 제출 옵션 (priority, cost, metadata)
     * @param createdAt 생성 시각 (epoch millis)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public PendingRequest(RequestKey key, Operation<T> operation, RequestOptions options, long createdAt) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        this.id = RequestId.generate();
        this.key = key;
        this.createdAt = createdAt;
        this.priority = options.priority();
        this.cost = options.cost();
        this.metadata = options.metadata();
        this.operation = operation;
        this.waiters = new ArrayList<>();
        this.state = RequestState.PENDING;
    }

    /**
     * 대기자 합류.
     *
     * @return 이 호출자 전용 결과 future
     * @throws IllegalStateException 이미 종료된 요청인 경우
     */
    public CompletableFuture<T> attachWaiter() {
        if (state.isTerminal()) {
            throw new IllegalStateException("Cannot attach waiter to terminal request " + id + " (state: " + state + ")");
        }
        CompletableFuture<T> waiter = new CompletableFuture<>();
        waiters.add(waiter);
        return waiter;
    }

    /**
     * 배치 윈도우에 합류한 상태로 전이.
     */
    public void markBatched() {
        state = StateTransition.transition(state, RequestState.BATCHED);
    }

    /**
     * 실행 시작 상태로 전이.
     *
     * <p>이미 종료된 요청(예: stagger 대기 중 취소)이면 전이하지 않고 false를 반환합니다.
     * 호출자는 false일 때 작업을 실행하면 안 됩니다.</p>
     *
     * @return 실행해도 되는 경우 true
     */
    public boolean markInFlight() {
        if (state.isTerminal()) {
            return false;
        }
        state = StateTransition.transition(state, RequestState.IN_FLIGHT);
        return true;
    }

    /**
     * 성공으로 종료하고 대기자를 비워서 반환.
     *
     * @return 해소할 대기자 목록 (합류 순서), 이미 종료된 경우 빈 목록
     */
    public List<CompletableFuture<T>> complete() {
        return terminate(RequestState.COMPLETED);
    }

    /**
     * 실패로 종료하고 대기자를 비워서 반환.
     *
     * @return 해소할 대기자 목록 (합류 순서), 이미 종료된 경우 빈 목록
     */
    public List<CompletableFuture<T>> fail() {
        return terminate(RequestState.FAILED);
    }

    private List<CompletableFuture<T>> terminate(RequestState terminal) {
        if (state.isTerminal()) {
            return List.of();
        }
        state = StateTransition.transition(state, terminal);
        List<CompletableFuture<T>> drained = new ArrayList<>(waiters);
        waiters.clear();
        return drained;
    }

    /**
     * 비워낸 대기자 전원을 값으로 완료 (합류 순서대로).
     *
     * @param drained 비워낸 대기자 목록
     * @param value 결과 값
     * @param <T> 결과 타입
     */
    public static <T> void succeed(List<CompletableFuture<T>> drained, T value) {
        for (CompletableFuture<T> waiter : drained) {
            waiter.complete(value);
        }
    }

    /**
     * 비워낸 대기자 전원을 예외로 완료 (합류 순서대로).
     *
     * @param drained 비워낸 대기자 목록
     * @param error 전달할 예외
     */
    public static void failAll(List<? extends CompletableFuture<?>> drained, Throwable error) {
        for (CompletableFuture<?> waiter : drained) {
            waiter.completeExceptionally(error);
        }
    }

    /**
     * 경과 시간 계산.
     *
     * @param now 현재 시각 (epoch millis)
     * @return now - createdAt (음수이면 0)
     */
    public long ageMs(long now) {
        return Math.max(0, now - createdAt);
    }

    public RequestId getId() {
        return id;
    }

    public RequestKey getKey() {
        return key;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public Priority getPriority() {
        return priority;
    }

    public double getCost() {
        return cost;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Operation<T> getOperation() {
        return operation;
    }

    public RequestState getState() {
        return state;
    }

    public int waiterCount() {
        return waiters.size();
    }

    @Override
    public String toString() {
        return "PendingRequest{id=" + id.getValue() + ", key=" + key.getValue()
            + ", priority=" + priority + ", state=" + state + ", waiters=" + waiters.size() + "}";
    }
}
