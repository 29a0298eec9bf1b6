/**
 * Request state machine package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.coalescer.core.statemachine.RequestState} - Pending request lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.coalescer.core.statemachine.StateTransition} - State transition validation and execution</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * RequestState state = RequestState.PENDING;
 * state = StateTransition.transition(state, RequestState.BATCHED);
 * state = StateTransition.transition(state, RequestState.IN_FLIGHT);
 * state = StateTransition.transition(state, RequestState.COMPLETED);
 *
 * // This will throw IllegalStateException
 * StateTransition.validate(state, RequestState.FAILED);
 * </pre>
 *
 * @since 1.0.0
 * @author Coalescer Team
 */
package com.ryuqq.coalescer.core.statemachine;
