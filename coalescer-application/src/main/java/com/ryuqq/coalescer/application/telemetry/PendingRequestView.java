package com.ryuqq.coalescer.application.telemetry;

import com.ryuqq.coalescer.core.model.Priority;
import com.ryuqq.coalescer.core.model.RequestKey;

/**
 * 진행 중 요청 조회 결과.
 *
 * @param key 요청 키
 * @param ageMs 최초 제출 이후 경과 시간 (밀리초)
 * @param priority 우선순위
 * @param cost 선언된 비용
 * @author Coalescer Team
 * @since 1.0.0
 */
public record PendingRequestView(
    RequestKey key,
    long ageMs,
    Priority priority,
    double cost
) {

    public PendingRequestView {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }
    }
}
