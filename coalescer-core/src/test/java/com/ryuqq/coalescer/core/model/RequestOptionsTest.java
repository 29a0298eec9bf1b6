package com.ryuqq.coalescer.core.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RequestOptions 테스트.
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
class RequestOptionsTest {

    @Test
    void defaults_MatchDocumentedValues() {
        // When
        RequestOptions options = RequestOptions.defaults();

        // Then
        assertEquals(Priority.NORMAL, options.priority());
        assertEquals(0.0, options.cost());
        assertTrue(options.metadata().isEmpty());
        assertFalse(options.batchable());
        assertEquals(BatchType.DEFAULT, options.batchType());
    }

    @Test
    void withMethods_ChangeOnlyOneField() {
        // When
        RequestOptions options = RequestOptions.defaults()
            .withPriority(Priority.HIGH)
            .withCost(0.25)
            .withBatchable(true)
            .withBatchType(BatchType.of("embed"));

        // Then
        assertEquals(Priority.HIGH, options.priority());
        assertEquals(0.25, options.cost());
        assertTrue(options.batchable());
        assertEquals(BatchType.of("embed"), options.batchType());
    }

    @Test
    void metadata_IsDefensivelyCopied() {
        // Given
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("tenant", "acme");

        // When
        RequestOptions options = RequestOptions.defaults().withMetadata(metadata);
        metadata.put("tenant", "other");

        // Then
        assertEquals("acme", options.metadata().get("tenant"));
        assertThrows(UnsupportedOperationException.class, () -> options.metadata().put("x", 1));
    }

    @Test
    void nullMetadata_BecomesEmpty() {
        assertTrue(RequestOptions.defaults().withMetadata(null).metadata().isEmpty());
    }

    @Test
    void invalidValues_ThrowException() {
        RequestOptions defaults = RequestOptions.defaults();

        assertThrows(IllegalArgumentException.class, () -> defaults.withPriority(null));
        assertThrows(IllegalArgumentException.class, () -> defaults.withBatchType(null));
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> defaults.withCost(-0.01)
        );
        assertTrue(exception.getMessage().contains("current: -0.01"));
        assertThrows(IllegalArgumentException.class, () -> defaults.withCost(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> defaults.withCost(Double.POSITIVE_INFINITY));
    }

    @Test
    void priority_OnlyHighFlushesImmediately() {
        assertTrue(Priority.HIGH.flushesImmediately());
        assertFalse(Priority.NORMAL.flushesImmediately());
        assertFalse(Priority.LOW.flushesImmediately());
    }
}
