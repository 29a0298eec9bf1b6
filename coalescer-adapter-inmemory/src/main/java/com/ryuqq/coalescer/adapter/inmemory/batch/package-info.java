/**
 * Open batch windows keyed by batch type.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.coalescer.adapter.inmemory.batch.BatchWindow} - Members collected for one timed flush</li>
 *   <li>{@link com.ryuqq.coalescer.adapter.inmemory.batch.BatchWindowTable} - At most one open window per type, plus a member index by key</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 * first batchable request ─▶ open(window) ─▶ addMember(...)* ─▶ detach(window) ─▶ members handed to the registry
 * </pre>
 *
 * @since 1.0.0
 */
package com.ryuqq.coalescer.adapter.inmemory.batch;
