/**
 * Core value objects of the request coalescer.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.coalescer.core.model.RequestKey} - Deduplication key (identity of "the same request")</li>
 *   <li>{@link com.ryuqq.coalescer.core.model.RequestId} - Process-unique submission identifier</li>
 *   <li>{@link com.ryuqq.coalescer.core.model.BatchType} - Batch grouping key</li>
 *   <li>{@link com.ryuqq.coalescer.core.model.Priority} - Batch ordering and eager-flush trigger</li>
 *   <li>{@link com.ryuqq.coalescer.core.model.RequestOptions} - Per-submission options</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable (final fields)</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Coalescer Team
 */
package com.ryuqq.coalescer.core.model;
