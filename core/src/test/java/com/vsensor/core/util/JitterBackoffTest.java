package com.vsensor.core.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertTrue;

class JitterBackoffTest {

    @Test
    void testDelayGrowsAndIsCapped() {
        Duration base = Duration.ofMillis(100);
        Duration max = Duration.ofMillis(1000);
        Duration jitter = Duration.ofMillis(50);

        Duration first = JitterBackoff.next(0, base, max, jitter);
        Duration third = JitterBackoff.next(2, base, max, jitter);
        Duration late = JitterBackoff.next(40, base, max, jitter);

        assertTrue(first.toMillis() >= 100 && first.toMillis() <= 150);
        assertTrue(third.toMillis() >= 400 && third.toMillis() <= 450);
        assertTrue(late.toMillis() >= 1000 && late.toMillis() <= 1050);
    }
}
