package com.work.zkreceipt.core.support;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class ValidationUtilsTest {

    @Test
    public void non_empty_rejects_null_and_blank() {
        assertThrows(IllegalArgumentException.class, () -> ValidationUtils.requireNonEmpty(null, "orderRef"));
        assertThrows(IllegalArgumentException.class, () -> ValidationUtils.requireNonEmpty("  ", "orderRef"));
        assertEquals("order 1", ValidationUtils.requireNonEmpty("order 1", "orderRef"));
    }

    @Test
    public void duration_must_be_positive() {
        assertThrows(IllegalArgumentException.class, () -> ValidationUtils.requirePositive(Duration.ZERO, "timeout"));
        assertThrows(IllegalArgumentException.class, () -> ValidationUtils.requirePositive((Duration) null, "timeout"));
        assertEquals(Duration.ofMillis(1), ValidationUtils.requirePositive(Duration.ofMillis(1), "timeout"));
    }
}
