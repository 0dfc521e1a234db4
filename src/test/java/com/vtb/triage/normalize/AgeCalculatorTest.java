package com.vtb.triage.normalize;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class AgeCalculatorTest {

    private final Clock clock = Clock.fixed(Instant.parse("2025-09-24T12:00:00Z"), ZoneOffset.UTC);
    private final AgeCalculator calculator = new AgeCalculator(clock);

    @Test
    void testOpenFindingAgedUntilNow() {
        assertEquals(23L, calculator.ageInDays("2025-09-01T00:00:00Z", null, "Open"));
    }

    @Test
    void testResolvedFindingUsesResolutionDate() {
        assertEquals(9L, calculator.ageInDays("2025-09-01T00:00:00Z", "2025-09-10T08:00:00Z", "Resolved"));
        assertEquals(9L, calculator.ageInDays("2025-09-01", "2025-09-10", "resolved"));
    }

    @Test
    void testResolvedWithoutDateFallsBackToNow() {
        assertEquals(23L, calculator.ageInDays("2025-09-01T00:00:00Z", "", "Resolved"));
        assertEquals(23L, calculator.ageInDays("2025-09-01T00:00:00Z", "not a date", "Resolved"));
    }

    @Test
    void testResolvedAtIgnoredForOpenFinding() {
        assertEquals(23L, calculator.ageInDays("2025-09-01T00:00:00Z", "2025-09-02T00:00:00Z", "InProgress"));
    }

    @Test
    void testNegativeAgeClampedToZero() {
        assertEquals(0L, calculator.ageInDays("2025-10-01T00:00:00Z", null, null));
    }

    @Test
    void testMissingOrInvalidDetectionDate() {
        assertNull(calculator.ageInDays(null, null, null));
        assertNull(calculator.ageInDays("вчера", null, null));
    }

    @Test
    void testSupportedTimestampFormats() {
        assertNotNull(AgeCalculator.parseTimestamp("2025-09-01T10:15:30+03:00"));
        assertNotNull(AgeCalculator.parseTimestamp("2025-09-01T10:15:30.123Z"));
        assertNotNull(AgeCalculator.parseTimestamp("2025-09-01T10:15:30"));
        assertNotNull(AgeCalculator.parseTimestamp("2025-09-01 10:15:30"));
        assertNotNull(AgeCalculator.parseTimestamp("2025-09-01 10:15"));
        assertNotNull(AgeCalculator.parseTimestamp("2025-09-01"));
        assertEquals(Instant.parse("2025-09-01T07:15:30Z"), AgeCalculator.parseTimestamp("2025-09-01T10:15:30+03:00"));
    }

    @Test
    void testClockRequired() {
        assertThrows(IllegalArgumentException.class, () -> new AgeCalculator(null));
    }
}
