/**
 * In-flight registry - one live execution per request key.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.coalescer.adapter.inmemory.registry.PendingRequest} - A request with its stored operation and ordered waiters</li>
 *   <li>{@link com.ryuqq.coalescer.adapter.inmemory.registry.InFlightRegistry} - Key to live entry mapping</li>
 * </ul>
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
package com.ryuqq.coalescer.adapter.inmemory.registry;
