/**
 * Contract test fixtures for {@link com.ryuqq.coalescer.application.coalescer.RequestCoalescer} implementations.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.coalescer.testkit.contract.AbstractCoalescerContractTest} - Lifecycle, timings and await helpers</li>
 *   <li>{@link com.ryuqq.coalescer.testkit.contract.ManualOperation} - Operation completed explicitly by the test</li>
 * </ul>
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
package com.ryuqq.coalescer.testkit.contract;
