/**
 * 실패 분류 체계.
 *
 * <p>대기자는 결과 값 하나, 또는 다음 네 가지 중 하나의 실패를 정확히 한 번 받습니다.</p>
 * <ul>
 *   <li>작업 실패: 작업이 던진 원래 예외</li>
 *   <li>{@link com.ryuqq.coalescer.core.exception.RequestTimeoutException}</li>
 *   <li>{@link com.ryuqq.coalescer.core.exception.RequestCancelledException}</li>
 *   <li>{@link com.ryuqq.coalescer.core.exception.BatchOrchestrationException}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Coalescer Team
 */
package com.ryuqq.coalescer.core.exception;
