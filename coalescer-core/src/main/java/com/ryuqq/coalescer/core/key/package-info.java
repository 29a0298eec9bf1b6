/**
 * Key derivation.
 *
 * <p>Turns a request's semantic content plus parameters into a stable
 * {@link com.ryuqq.coalescer.core.model.RequestKey} used for deduplication.</p>
 *
 * @since 1.0.0
 * @author Coalescer Team
 */
package com.ryuqq.coalescer.core.key;
