package com.ryuqq.coalescer.adapter.inmemory.batch;

import com.ryuqq.coalescer.adapter.inmemory.registry.PendingRequest;
import com.ryuqq.coalescer.core.model.BatchType;
import com.ryuqq.coalescer.core.model.RequestKey;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 열린 배치 윈도우 테이블.
 *
 * <p>배치 타입당 최대 하나의 열린 윈도우를 보관하고,
 * 윈도우 멤버를 키로도 찾을 수 있도록 멤버 인덱스를 함께 유지합니다.
 * 멤버 인덱스 덕분에 아직 flush되지 않은 키로 들어온 중복 호출도 기존 멤버에 합류할 수 있습니다.</p>
 *
 * <p><strong>Thread Safety:</strong> thread-safe하지 않습니다. 엔진 모니터 안에서만 호출합니다.</p>
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
public class BatchWindowTable {

    private final Map<BatchType, BatchWindow> windows = new LinkedHashMap<>();
    private final Map<RequestKey, Entry> memberIndex = new HashMap<>();

    /**
     * 멤버와 그 멤버가 속한 윈도우.
     *
     * @param window 소속 윈도우
     * @param member 멤버 요청
     */
    public record Entry(BatchWindow window, PendingRequest<?> member) {
    }

    /**
     * 타입의 열린 윈도우 조회.
     *
     * @param type 배치 타입
     * @return 열린 윈도우, 없으면 null
     */
    public BatchWindow find(BatchType type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        return windows.get(type);
    }

    /**
     * 새 윈도우 등록.
     *
     * @param window 윈도우
     * @throws IllegalStateException 같은 타입의 윈도우가 이미 열려 있는 경우
     */
    public void open(BatchWindow window) {
        if (window == null) {
            throw new IllegalArgumentException("window cannot be null");
        }
        BatchWindow existing = windows.putIfAbsent(window.getType(), window);
        if (existing != null) {
            throw new IllegalStateException("Batch window already open for type: " + window.getType().getValue());
        }
    }

    /**
     * 열린 윈도우에 멤버 추가.
     *
     * @param window 열린 윈도우
     * @param member 추가할 요청
     * @throws IllegalStateException 윈도우가 테이블에 없거나 키가 이미 다른 멤버로 존재하는 경우
     */
    public void addMember(BatchWindow window, PendingRequest<?> member) {
        if (window == null) {
            throw new IllegalArgumentException("window cannot be null");
        }
        if (member == null) {
            throw new IllegalArgumentException("member cannot be null");
        }
        if (windows.get(window.getType()) != window) {
            throw new IllegalStateException("Batch window is not open: " + window.getId());
        }
        if (memberIndex.containsKey(member.getKey())) {
            throw new IllegalStateException("Key already batched: " + member.getKey().getValue());
        }
        window.add(member);
        memberIndex.put(member.getKey(), new Entry(window, member));
    }

    /**
     * 키로 멤버 조회.
     *
     * @param key 요청 키
     * @return 멤버 엔트리, 없으면 null
     */
    public Entry findMember(RequestKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return memberIndex.get(key);
    }

    /**
     * 윈도우를 테이블에서 떼어냄 (flush).
     *
     * <p>윈도우와 그 멤버 인덱스가 모두 제거됩니다. 이미 떼어진 윈도우면 false.</p>
     *
     * @param window 떼어낼 윈도우
     * @return 테이블에 있었으면 true
     */
    public boolean detach(BatchWindow window) {
        if (window == null) {
            throw new IllegalArgumentException("window cannot be null");
        }
        if (!windows.remove(window.getType(), window)) {
            return false;
        }
        for (PendingRequest<?> member : window.getMembers()) {
            memberIndex.remove(member.getKey());
        }
        return true;
    }

    /**
     * 키에 해당하는 멤버만 윈도우에서 제거.
     *
     * <p>멤버가 빠져 윈도우가 비면 윈도우도 테이블에서 제거되고 타이머가 취소됩니다.</p>
     *
     * @param key 요청 키
     * @return 제거된 엔트리, 없으면 null
     */
    public Entry removeMember(RequestKey key) {
        Entry entry = findMember(key);
        if (entry == null) {
            return null;
        }
        memberIndex.remove(key);
        BatchWindow window = entry.window();
        window.removeMember(entry.member());
        if (window.isEmpty()) {
            window.cancelTimer();
            windows.remove(window.getType(), window);
        }
        return entry;
    }

    /**
     * 모든 윈도우를 떼어내고 반환 (타이머 취소 포함).
     *
     * @return 떼어낸 윈도우 목록
     */
    public List<BatchWindow> detachAll() {
        List<BatchWindow> all = new ArrayList<>(windows.values());
        for (BatchWindow window : all) {
            window.cancelTimer();
        }
        windows.clear();
        memberIndex.clear();
        return all;
    }

    /**
     * 모든 열린 윈도우의 멤버 (윈도우 등록 순, 합류 순).
     *
     * @return 멤버 복사본
     */
    public List<PendingRequest<?>> memberSnapshot() {
        List<PendingRequest<?>> all = new ArrayList<>();
        for (BatchWindow window : windows.values()) {
            all.addAll(window.getMembers());
        }
        return all;
    }

    public int windowCount() {
        return windows.size();
    }

    public int memberCount() {
        return memberIndex.size();
    }
}
