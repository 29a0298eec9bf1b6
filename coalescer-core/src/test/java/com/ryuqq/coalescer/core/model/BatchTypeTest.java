package com.ryuqq.coalescer.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BatchType Value Object 테스트.
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
class BatchTypeTest {

    @Test
    void default_IsNamedDefault() {
        assertEquals("default", BatchType.DEFAULT.getValue());
        assertEquals(BatchType.DEFAULT, BatchType.of("default"));
    }

    @Test
    void of_DottedName_CreatesType() {
        assertEquals("embed.v2", BatchType.of("embed.v2").getValue());
    }

    @Test
    void of_InvalidValues_ThrowException() {
        assertThrows(IllegalArgumentException.class, () -> BatchType.of(null));
        assertThrows(IllegalArgumentException.class, () -> BatchType.of("has space"));
        assertThrows(IllegalArgumentException.class, () -> BatchType.of("t".repeat(51)));
    }
}
