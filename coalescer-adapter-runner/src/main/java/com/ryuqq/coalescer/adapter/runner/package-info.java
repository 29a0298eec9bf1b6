/**
 * Runner Adapter Layer - RequestCoalescer 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.coalescer.adapter.runner.CoalescingEngine} - 중복 제거 + 배치 + 타임아웃을 조합한 엔진</li>
 *   <li>{@link com.ryuqq.coalescer.adapter.runner.BatchCoordinator} - 타입별 시간 윈도우 수집과 stagger 실행</li>
 *   <li>{@link com.ryuqq.coalescer.adapter.runner.TimeoutReaper} - 오래된 진행 중 요청 실패 처리</li>
 *   <li>{@link com.ryuqq.coalescer.adapter.runner.TelemetryAggregator} - 통계 카운터</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (CoalescingEngine)
 *   ↓ implements
 * application (RequestCoalescer interface)
 *   ↓ depends on
 * adapter-inmemory (InFlightRegistry, BatchWindowTable)
 *   ↓ depends on
 * core (RequestKey, RequestOptions, Operation, RequestState)
 * </pre>
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
package com.ryuqq.coalescer.adapter.runner;
