package com.ryuqq.coalescer.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 요청 제출 옵션 (불변 record).
 *
 * <p><strong>옵션 항목:</strong></p>
 * <ul>
 *   <li>priority: 우선순위 (기본 NORMAL)</li>
 *   <li>cost: 예상 비용 단위 (기본 0, 절감액 집계에만 사용)</li>
 *   <li>metadata: 호출자 측 부가 정보 (엔진은 해석하지 않고 그대로 보관)</li>
 *   <li>batchable: 배치 대상 여부 (기본 false)</li>
 *   <li>batchType: 배치 그룹 (기본 {@link BatchType#DEFAULT})</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RequestOptions options = RequestOptions.defaults()
 *     .withPriority(Priority.HIGH)
 *     .withCost(0.01)
 *     .withBatchable(true)
 *     .withBatchType(BatchType.of("embed"));
 * </pre>
 *
 * @author Coalescer Team
 * @since 1.0.0
 * @param priority 우선순위 (null이 아니어야 함)
 * @param cost 예상 비용 (0 이상, 유한값)
 * @param metadata 부가 정보 (null이면 빈 map)
 * @param batchable 배치 대상 여부
 * @param batchType 배치 그룹 (null이 아니어야 함)
 */
public record RequestOptions(
    Priority priority,
    double cost,
    Map<String, Object> metadata,
    boolean batchable,
    BatchType batchType
) {

    private static final RequestOptions DEFAULTS =
        new RequestOptions(Priority.NORMAL, 0.0, Map.of(), false, BatchType.DEFAULT);

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RequestOptions {
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }
        if (Double.isNaN(cost) || Double.isInfinite(cost) || cost < 0) {
            throw new IllegalArgumentException("cost must be a finite non-negative number (current: " + cost + ")");
        }
        if (batchType == null) {
            throw new IllegalArgumentException("batchType cannot be null");
        }
        // Map.copyOf는 null 값을 거부하므로 순서를 유지하는 복사본으로 감싼다
        metadata = metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * 기본 옵션.
     *
     * @return priority=NORMAL, cost=0, metadata={}, batchable=false, batchType=default
     */
    public static RequestOptions defaults() {
        return DEFAULTS;
    }

    public RequestOptions withPriority(Priority priority) {
        return new RequestOptions(priority, cost, metadata, batchable, batchType);
    }

    public RequestOptions withCost(double cost) {
        return new RequestOptions(priority, cost, metadata, batchable, batchType);
    }

    public RequestOptions withMetadata(Map<String, Object> metadata) {
        return new RequestOptions(priority, cost, metadata, batchable, batchType);
    }

    public RequestOptions withBatchable(boolean batchable) {
        return new RequestOptions(priority, cost, metadata, batchable, batchType);
    }

    public RequestOptions withBatchType(BatchType batchType) {
        return new RequestOptions(priority, cost, metadata, batchable, batchType);
    }
}
