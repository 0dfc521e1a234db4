package com.vtb.triage.models;

import lombok.Builder;
import lombok.Data;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Распределение находок одной группы по критичности
 */
@Data
@Builder
public class GroupSummary {

    public static final String TOTAL = "Total";

    private String group;

    @Builder.Default
    private Map<SeverityLevel, Long> severityCounts = zeroCounts();

    /** Нераспознанные значения критичности (сквозная категория), ключ = метка */
    @Builder.Default
    private Map<String, Long> passThroughCounts = new LinkedHashMap<>();

    private long total;
    private long criticalExploits;
    private long highExploits;

    public long count(SeverityLevel level) {
        Long value = severityCounts.get(level);
        return value == null ? 0L : value;
    }

    public long passThroughCount(String label) {
        Long value = passThroughCounts.get(label);
        return value == null ? 0L : value;
    }

    /**
     * Количество находок с известным эксплойтом; для уровней ниже High всегда 0
     */
    public long exploitCount(SeverityLevel level) {
        if (level == SeverityLevel.CRITICAL) {
            return criticalExploits;
        }
        if (level == SeverityLevel.HIGH) {
            return highExploits;
        }
        return 0L;
    }

    /**
     * Поэлементная сумма двух сводок
     */
    public GroupSummary plus(GroupSummary other, String resultGroup) {
        Map<SeverityLevel, Long> counts = zeroCounts();
        for (SeverityLevel level : SeverityLevel.values()) {
            counts.put(level, count(level) + other.count(level));
        }
        Map<String, Long> passThrough = new LinkedHashMap<>(passThroughCounts);
        other.passThroughCounts.forEach((label, value) -> passThrough.merge(label, value, Long::sum));

        return GroupSummary.builder()
            .group(resultGroup)
            .severityCounts(counts)
            .passThroughCounts(passThrough)
            .total(total + other.total)
            .criticalExploits(criticalExploits + other.criticalExploits)
            .highExploits(highExploits + other.highExploits)
            .build();
    }

    public static GroupSummary empty(String group) {
        return GroupSummary.builder().group(group).build();
    }

    private static Map<SeverityLevel, Long> zeroCounts() {
        Map<SeverityLevel, Long> counts = new EnumMap<>(SeverityLevel.class);
        for (SeverityLevel level : SeverityLevel.values()) {
            counts.put(level, 0L);
        }
        return counts;
    }
}
