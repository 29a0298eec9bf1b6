/**
 * Application Layer - 엔진 공개 계약.
 *
 * <h2>인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.coalescer.application.coalescer.RequestCoalescer} - 중복 제거/배치 실행 진입점</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (CoalescingEngine)
 *   ↓ implements
 * application (RequestCoalescer interface)
 *   ↓ depends on
 * core (RequestKey, RequestOptions, Operation, exceptions)
 * </pre>
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
package com.ryuqq.coalescer.application.coalescer;
