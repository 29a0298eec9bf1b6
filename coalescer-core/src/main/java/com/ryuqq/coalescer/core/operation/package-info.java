/**
 * 엔진이 감싸는 원격 작업 계약.
 *
 * <p>{@link com.ryuqq.coalescer.core.operation.Operation}은 엔진이 알고 있는
 * 유일한 외부 작업 형태입니다. 재시도/백오프는 호출자의 책임입니다.</p>
 *
 * @since 1.0.0
 * @author Coalescer Team
 */
package com.ryuqq.coalescer.core.operation;
