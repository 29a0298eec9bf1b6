package com.ryuqq.coalescer.core.exception;

import com.ryuqq.coalescer.core.model.BatchType;
import com.ryuqq.coalescer.core.model.RequestKey;

/**
 * 배치 실행 단계 자체가 실패했을 때 아직 결과가 없는 멤버 전원에게 전달되는 실패.
 *
 * <p>개별 멤버의 작업 실패와는 구분됩니다. 멤버 작업이 실패하면 그 멤버만
 * 원래 예외로 실패하고 형제 멤버에는 영향이 없습니다.</p>
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
public final class BatchOrchestrationException extends CoalescingException {

    private final BatchType batchType;

    /**
     * 생성자.
     *
     * @param key 실패한 멤버의 키
     * @param batchType 배치 타입
     * @param cause 배치 단계 실패 원인
     */
    public BatchOrchestrationException(RequestKey key, BatchType batchType, Throwable cause) {
        super(key, FailureKind.BATCH_ORCHESTRATION_FAILURE,
            "Batch execution failed for type " + (batchType == null ? "null" : batchType.getValue())
                + " before member result was known"
                + (cause == null ? "" : ": " + cause.getMessage()),
            cause);
        this.batchType = batchType;
    }

    public BatchType batchType() {
        return batchType;
    }
}
