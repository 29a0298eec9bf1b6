/**
 * Read-only telemetry snapshots returned by
 * {@link com.ryuqq.coalescer.application.coalescer.RequestCoalescer}.
 *
 * @since 1.0.0
 * @author Coalescer Team
 */
package com.ryuqq.coalescer.application.telemetry;
