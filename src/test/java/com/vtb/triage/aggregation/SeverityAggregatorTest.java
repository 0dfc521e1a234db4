package com.vtb.triage.aggregation;

import com.vtb.triage.TestFindings;
import com.vtb.triage.models.GroupSummary;
import com.vtb.triage.models.NormalizedRecord;
import com.vtb.triage.models.SeverityBreakdown;
import com.vtb.triage.models.SeverityLevel;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты для SeverityAggregator
 */
class SeverityAggregatorTest {

    private final SeverityAggregator aggregator = new SeverityAggregator();

    @Test
    void testCountsAreZeroFilled() {
        GroupSummary summary = aggregator.summarize("Dev", List.of(
            TestFindings.withSeverity(SeverityLevel.HIGH, false),
            TestFindings.withSeverity(SeverityLevel.HIGH, false),
            TestFindings.withSeverity(SeverityLevel.NONE, false)));

        assertEquals(2, summary.count(SeverityLevel.HIGH));
        assertEquals(1, summary.count(SeverityLevel.NONE));
        assertEquals(0, summary.count(SeverityLevel.LOW));
        assertEquals(0, summary.count(SeverityLevel.CRITICAL));
        assertEquals(SeverityLevel.values().length, summary.getSeverityCounts().size());
        assertEquals(3, summary.getTotal());
    }

    @Test
    void testExploitSubCountOnlyForCriticalAndHigh() {
        GroupSummary summary = aggregator.summarize("SRE", List.of(
            TestFindings.withSeverity(SeverityLevel.CRITICAL, true),
            TestFindings.withSeverity(SeverityLevel.CRITICAL, false),
            TestFindings.withSeverity(SeverityLevel.HIGH, true),
            TestFindings.withSeverity(SeverityLevel.HIGH, true),
            TestFindings.withSeverity(SeverityLevel.MEDIUM, true),
            TestFindings.withSeverity(SeverityLevel.LOW, true)));

        assertEquals(1, summary.getCriticalExploits());
        assertEquals(2, summary.getHighExploits());
        assertEquals(0, summary.exploitCount(SeverityLevel.MEDIUM));
        assertEquals(2, summary.count(SeverityLevel.CRITICAL), "Эксплойты не заменяют базовый подсчет");
    }

    @Test
    void testPassThroughBucketsCountedSeparately() {
        GroupSummary summary = aggregator.summarize("Dev", List.of(
            TestFindings.passThrough("Unknown"),
            TestFindings.passThrough("Unknown"),
            TestFindings.withSeverity(SeverityLevel.LOW, false)));

        assertEquals(2, summary.passThroughCount("Unknown"));
        assertEquals(1, summary.count(SeverityLevel.LOW));
        assertEquals(0, summary.count(SeverityLevel.NONE));
        assertEquals(3, summary.getTotal());
    }

    @Test
    void testTotalIsElementWiseSum() {
        Map<String, List<NormalizedRecord>> groups = new LinkedHashMap<>();
        groups.put("Dev", List.of(
            TestFindings.withSeverity(SeverityLevel.CRITICAL, true),
            TestFindings.withSeverity(SeverityLevel.LOW, false)));
        groups.put("SRE", List.of(
            TestFindings.withSeverity(SeverityLevel.CRITICAL, false),
            TestFindings.withSeverity(SeverityLevel.HIGH, true),
            TestFindings.passThrough("Odd")));
        groups.put("Database", List.of());

        SeverityBreakdown breakdown = aggregator.aggregate(groups, 5);
        GroupSummary total = breakdown.getTotal();

        assertEquals(5, total.getTotal());
        for (SeverityLevel level : SeverityLevel.values()) {
            long sum = breakdown.getGroups().values().stream().mapToLong(g -> g.count(level)).sum();
            assertEquals(sum, total.count(level), "Уровень " + level);
        }
        assertEquals(2, total.count(SeverityLevel.CRITICAL));
        assertEquals(1, total.getCriticalExploits());
        assertEquals(1, total.getHighExploits());
        assertEquals(1, total.passThroughCount("Odd"));
        assertEquals(0, breakdown.group("Database").getTotal());
        assertEquals(List.of("Dev", "SRE", "Database"), List.copyOf(breakdown.getGroups().keySet()));
    }

    @Test
    void testTotalMismatchDetected() {
        Map<String, List<NormalizedRecord>> groups = Map.of("Dev", List.of(TestFindings.withSeverity(SeverityLevel.LOW, false)));

        assertThrows(IllegalStateException.class, () -> aggregator.aggregate(groups, 2));
    }
}
