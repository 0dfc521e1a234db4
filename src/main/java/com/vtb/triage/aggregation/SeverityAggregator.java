package com.vtb.triage.aggregation;

import com.vtb.triage.models.GroupSummary;
import com.vtb.triage.models.NormalizedRecord;
import com.vtb.triage.models.SeverityBreakdown;
import com.vtb.triage.models.SeverityLevel;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Подсчет находок по уровням критичности для каждой группы и итога
 */
@Slf4j
public class SeverityAggregator {

    /**
     * Сводка одной группы: все уровни присутствуют (0, если записей нет)
     */
    public GroupSummary summarize(String group, List<NormalizedRecord> records) {
        Map<SeverityLevel, Long> counts = new EnumMap<>(SeverityLevel.class);
        for (SeverityLevel level : SeverityLevel.values()) {
            counts.put(level, 0L);
        }
        Map<String, Long> passThrough = new LinkedHashMap<>();
        long criticalExploits = 0;
        long highExploits = 0;

        for (NormalizedRecord record : records) {
            if (record.isPassThrough()) {
                passThrough.merge(record.getSeverityLabel(), 1L, Long::sum);
                continue;
            }
            SeverityLevel level = record.getSeverity();
            counts.merge(level, 1L, Long::sum);
            if (record.isExploitKnown()) {
                if (level == SeverityLevel.CRITICAL) {
                    criticalExploits++;
                } else if (level == SeverityLevel.HIGH) {
                    highExploits++;
                }
            }
        }

        return GroupSummary.builder()
            .group(group)
            .severityCounts(counts)
            .passThroughCounts(passThrough)
            .total(records.size())
            .criticalExploits(criticalExploits)
            .highExploits(highExploits)
            .build();
    }

    /**
     * Сводки по всем группам и поэлементный итог.
     *
     * @param expectedTotal исходное число записей; итог обязан с ним совпасть
     */
    public SeverityBreakdown aggregate(Map<String, List<NormalizedRecord>> groups, int expectedTotal) {
        Map<String, GroupSummary> summaries = new LinkedHashMap<>();
        GroupSummary total = GroupSummary.empty(GroupSummary.TOTAL);

        for (Map.Entry<String, List<NormalizedRecord>> entry : groups.entrySet()) {
            GroupSummary summary = summarize(entry.getKey(), entry.getValue());
            summaries.put(entry.getKey(), summary);
            total = total.plus(summary, GroupSummary.TOTAL);
        }

        if (total.getTotal() != expectedTotal) {
            throw new IllegalStateException("Сумма по группам (" + total.getTotal()
                + ") не совпадает с числом записей (" + expectedTotal + ")");
        }

        log.debug("Итог: {} записей, Critical={}, High={}, Medium={}, Low={}, None={}",
            total.getTotal(),
            total.count(SeverityLevel.CRITICAL), total.count(SeverityLevel.HIGH),
            total.count(SeverityLevel.MEDIUM), total.count(SeverityLevel.LOW), total.count(SeverityLevel.NONE));

        return SeverityBreakdown.builder()
            .groups(summaries)
            .total(total)
            .build();
    }
}
