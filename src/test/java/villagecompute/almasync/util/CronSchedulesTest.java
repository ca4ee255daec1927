/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link CronSchedules}.
 */
class CronSchedulesTest {

    @Test
    void testValidExpressions() {
        assertTrue(CronSchedules.isValid("0 0 * * *"));
        assertTrue(CronSchedules.isValid("*/15 * * * *"));
        assertTrue(CronSchedules.isValid("0 30 2 * * *"));
    }

    @Test
    void testInvalidExpressions() {
        assertFalse(CronSchedules.isValid(null));
        assertFalse(CronSchedules.isValid(""));
        assertFalse(CronSchedules.isValid("not a cron"));
        assertFalse(CronSchedules.isValid("61 * * * *"));
        assertFalse(CronSchedules.isValid("* * * * * * * *"));
    }

    @Test
    void testParseRejectsWrongFieldCount() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> CronSchedules.parse("0 0 *"));
        assertTrue(e.getMessage().contains("5 or 6 fields"));
    }

    @Test
    void testNextRunOfMidnightCron() {
        Instant from = Instant.parse("2024-03-15T10:00:00Z");

        assertEquals(Instant.parse("2024-03-16T00:00:00Z"),
                CronSchedules.nextRun("0 0 * * *", from, ZoneOffset.UTC).orElseThrow());
    }

    @Test
    void testNextRunIsStrictlyAfterReference() {
        Instant midnight = Instant.parse("2024-03-16T00:00:00Z");

        assertEquals(Instant.parse("2024-03-17T00:00:00Z"),
                CronSchedules.nextRun("0 0 * * *", midnight, ZoneOffset.UTC).orElseThrow());
    }

    @Test
    void testNextRunHonoursZone() {
        Instant from = Instant.parse("2024-03-15T10:00:00Z");

        // Midnight in Nairobi (UTC+3) is 21:00 UTC
        assertEquals(Instant.parse("2024-03-15T21:00:00Z"),
                CronSchedules.nextRun("0 0 * * *", from, ZoneId.of("Africa/Nairobi")).orElseThrow());
    }
}
