package com.ryuqq.coalescer.adapter.inmemory.batch;

import com.ryuqq.coalescer.adapter.inmemory.registry.PendingRequest;
import com.ryuqq.coalescer.core.model.BatchType;
import com.ryuqq.coalescer.core.model.Priority;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;

/**
 * 배치 타입별로 열려 있는 수집 윈도우.
 *
 * <p>해당 타입의 첫 배치 가능 요청이 도착하면 생성되고,
 * flush 시점에 윈도우 테이블에서 즉시 제거됩니다 (멤버 실행 전).</p>
 *
 * <p><strong>Thread Safety:</strong> 엔진 모니터 안에서만 변경됩니다.</p>
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
public final class BatchWindow {

    private static final Comparator<PendingRequest<?>> BY_PRIORITY =
        Comparator.comparing(PendingRequest::getPriority, Comparator.comparingInt(Priority::ordinal));

    private final String id;
    private final BatchType type;
    private final long scheduledAt;
    private final List<PendingRequest<?>> members;
    private ScheduledFuture<?> timerHandle;

    /**
     * 생성자.
     *
     * @param type 배치 타입
     * @param scheduledAt flush 예정 시각 (epoch millis)
     * @throws IllegalArgumentException type이 null인 경우
     */
    public BatchWindow(BatchType type, long scheduledAt) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        this.id = "batch_" + UUID.randomUUID();
        this.type = type;
        this.scheduledAt = scheduledAt;
        this.members = new ArrayList<>();
    }

    void add(PendingRequest<?> member) {
        members.add(member);
    }

    boolean removeMember(PendingRequest<?> member) {
        return members.remove(member);
    }

    /**
     * flush 타이머 연결.
     *
     * @param timerHandle 예약된 flush 작업
     */
    public void attachTimer(ScheduledFuture<?> timerHandle) {
        this.timerHandle = timerHandle;
    }

    /**
     * 예약된 flush 취소 (없으면 무시).
     */
    public void cancelTimer() {
        if (timerHandle != null) {
            timerHandle.cancel(false);
            timerHandle = null;
        }
    }

    /**
     * 실행 순서로 정렬된 멤버 목록.
     *
     * <p>HIGH → NORMAL → LOW, 같은 우선순위는 합류 순서 유지 (stable sort).</p>
     *
     * @return 정렬된 멤버 복사본
     */
    public List<PendingRequest<?>> orderedMembers() {
        List<PendingRequest<?>> ordered = new ArrayList<>(members);
        ordered.sort(BY_PRIORITY);
        return ordered;
    }

    public List<PendingRequest<?>> getMembers() {
        return List.copyOf(members);
    }

    public String getId() {
        return id;
    }

    public BatchType getType() {
        return type;
    }

    public long getScheduledAt() {
        return scheduledAt;
    }

    public boolean hasTimer() {
        return timerHandle != null;
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    @Override
    public String toString() {
        return "BatchWindow{id=" + id + ", type=" + type.getValue() + ", size=" + members.size() + "}";
    }
}
